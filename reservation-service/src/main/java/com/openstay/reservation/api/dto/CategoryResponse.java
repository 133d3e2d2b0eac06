package com.openstay.reservation.api.dto;

import com.openstay.reservation.domain.model.RoomCategory;

import java.math.BigDecimal;

public record CategoryResponse(
        Long id,
        String name,
        BigDecimal basePrice,
        Integer maxOccupancy,
        String description
) {
    public static CategoryResponse from(RoomCategory category) {
        return new CategoryResponse(
                category.getId(),
                category.getName(),
                category.getBasePrice(),
                category.getMaxOccupancy(),
                category.getDescription()
        );
    }

    /**
     * One line of the category listing, e.g. {@code Family Suite ($450.00/night): Two rooms}.
     */
    public String listingLine() {
        String line = String.format("%s ($%s/night)", name, basePrice.toPlainString());
        return description == null || description.isBlank() ? line : line + ": " + description;
    }
}
