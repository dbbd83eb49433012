package com.ferrybooking.inventory.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A scheduled voyage with a finite number of seats.
 * {@code availableSeats} is only ever changed through the conditional updates in
 * {@link com.ferrybooking.inventory.domain.repository.DepartureRepository}.
 */
@Entity
@Table(name = "departures", indexes = {
        @Index(name = "idx_departures_time", columnList = "departure_time"),
        @Index(name = "idx_departures_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Departure {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "route_code", nullable = false, length = 50)
    private String routeCode;

    @Column(name = "origin_port", nullable = false, length = 100)
    private String originPort;

    @Column(name = "destination_port", nullable = false, length = 100)
    private String destinationPort;

    @Column(name = "vessel_name", nullable = false, length = 100)
    private String vesselName;

    @Column(name = "departure_time", nullable = false)
    private LocalDateTime departureTime;

    @Column(name = "total_seats", nullable = false)
    private Integer totalSeats;

    @Column(name = "available_seats", nullable = false)
    private Integer availableSeats;

    @Column(name = "fare", nullable = false, precision = 12, scale = 2)
    private BigDecimal fare;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DepartureStatus status;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = DepartureStatus.SCHEDULED;
        }
        if (availableSeats == null) {
            availableSeats = totalSeats;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isBookableAt(LocalDateTime now) {
        return status == DepartureStatus.SCHEDULED && departureTime.isAfter(now);
    }

    public enum DepartureStatus {
        SCHEDULED,
        DEPARTED,
        CANCELLED
    }
}
