package com.openstay.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A guest's reservation for a date range. Created CONFIRMED together with its
 * {@link RoomAssignment}; the only later mutation is the one-way move to CANCELLED.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_guest", columnList = "guest_id"),
        @Index(name = "idx_bookings_status_dates", columnList = "status,check_out_date")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "guest_id", nullable = false)
    private Guest guest;

    @Column(name = "check_in_date", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "check_out_date", nullable = false)
    private LocalDate checkOutDate;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @PrePersist
    protected void onCreate() {
        if (status == null) {
            status = BookingStatus.CONFIRMED;
        }
    }

    public StayInterval stay() {
        return StayInterval.of(checkInDate, checkOutDate);
    }

    public boolean isConfirmed() {
        return status == BookingStatus.CONFIRMED;
    }

    /**
     * CONFIRMED -> CANCELLED. CANCELLED is terminal.
     */
    public void cancel(LocalDateTime when) {
        if (status != BookingStatus.CONFIRMED) {
            throw new IllegalStateException("Booking " + id + " is not confirmed (status " + status + ")");
        }
        this.status = BookingStatus.CANCELLED;
        this.cancelledAt = when;
        this.updatedAt = when;
    }

    public enum BookingStatus {
        CONFIRMED,
        CANCELLED
    }
}
