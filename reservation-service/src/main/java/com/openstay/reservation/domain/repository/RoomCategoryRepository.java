package com.openstay.reservation.domain.repository;

import com.openstay.reservation.domain.model.RoomCategory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RoomCategoryRepository extends JpaRepository<RoomCategory, Long> {

    List<RoomCategory> findAllByOrderByIdAsc();
}
