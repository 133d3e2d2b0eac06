package com.openstay.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Binds one booking to the physical room it occupies. Never deleted: a cancelled booking's
 * assignment stays as history and simply stops counting against availability.
 */
@Entity
@Table(name = "room_assignments", indexes = {
        @Index(name = "idx_room_assignments_room", columnList = "room_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomAssignment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "booking_id", nullable = false, unique = true, updatable = false)
    private Booking booking;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "room_id", nullable = false, updatable = false)
    private RoomUnit roomUnit;

    @Column(name = "assigned_at", nullable = false)
    private LocalDateTime assignedAt;
}
