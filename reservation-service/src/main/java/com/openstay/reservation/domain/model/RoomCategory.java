package com.openstay.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A class of rooms sharing a nightly base price and description.
 */
@Entity
@Table(name = "room_categories")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomCategory {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 50)
    private String name;

    @Column(name = "base_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal basePrice;

    @Column(name = "max_occupancy", nullable = false)
    private Integer maxOccupancy;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /**
     * Price of a stay at the current base price: nights x base price, two decimals.
     */
    public BigDecimal priceFor(StayInterval stay) {
        return basePrice.multiply(BigDecimal.valueOf(stay.nights())).setScale(2, RoundingMode.HALF_UP);
    }
}
