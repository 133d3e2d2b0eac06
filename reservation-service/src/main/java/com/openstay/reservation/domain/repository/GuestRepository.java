package com.openstay.reservation.domain.repository;

import com.openstay.reservation.domain.model.Guest;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface GuestRepository extends JpaRepository<Guest, Long> {
    Optional<Guest> findByContactKey(String contactKey);
}
