package com.openstay.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A guest identified by a normalized, globally unique contact key (email or phone).
 * Timestamps are set by the services from the application {@link java.time.Clock}.
 */
@Entity
@Table(name = "guests")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Guest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "contact_key", nullable = false, unique = true, length = 100)
    private String contactKey;

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void rename(String newName, LocalDateTime when) {
        this.fullName = newName;
        this.updatedAt = when;
    }
}
