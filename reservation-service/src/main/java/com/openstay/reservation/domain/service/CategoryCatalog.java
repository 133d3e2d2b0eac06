package com.openstay.reservation.domain.service;

import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.repository.RoomCategoryRepository;
import com.openstay.reservation.exception.CategoryNotFoundException;
import com.openstay.reservation.exception.StayValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only lookup of room categories.
 *
 * Label matching policy (case-insensitive, label trimmed):
 * 1. a category whose name equals the label wins;
 * 2. otherwise the first category, by ascending id, whose name contains the label;
 * 3. otherwise {@link CategoryNotFoundException}.
 * Ties at either step go to the lowest id, so the same label always resolves to the same category.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryCatalog {

    private final RoomCategoryRepository categoryRepository;

    @Transactional(readOnly = true)
    public List<RoomCategory> listCategories() {
        return categoryRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public RoomCategory resolve(String label) {
        if (label == null || label.isBlank()) {
            throw new StayValidationException("A room category is required");
        }
        RoomCategory category = match(categoryRepository.findAllByOrderByIdAsc(), label)
                .orElseThrow(() -> new CategoryNotFoundException(label.trim()));
        log.debug("Resolved category label '{}' to {} (id {})", label, category.getName(), category.getId());
        return category;
    }

    /**
     * Applies the matching policy to categories already sorted by ascending id.
     */
    static Optional<RoomCategory> match(List<RoomCategory> categoriesById, String label) {
        String needle = label.trim().toLowerCase(Locale.ROOT);
        Optional<RoomCategory> exact = categoriesById.stream()
                .filter(c -> c.getName().toLowerCase(Locale.ROOT).equals(needle))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return categoriesById.stream()
                .filter(c -> c.getName().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }
}
