package com.ferrybooking.booking.domain.model;

import com.ferrybooking.common.exception.ConflictException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One reservation attempt by one account for one departure.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_account", columnList = "account_id"),
        @Index(name = "idx_bookings_status_expires", columnList = "status,expires_at")
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

    @Column(name = "booking_code", nullable = false, unique = true, length = 32)
    private String bookingCode;

    @Column(name = "departure_id", nullable = false)
    private Long departureId;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(name = "passenger_count", nullable = false)
    private Integer passengerCount;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    /** Set once, under the booking row lock, when the held seats go back to the departure. */
    @Column(name = "inventory_released", nullable = false)
    private boolean inventoryReleased;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "cancelled_by")
    private Long cancelledBy;

    @Builder.Default
    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Passenger> passengers = new ArrayList<>();

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
            status = BookingStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public void addPassenger(Passenger passenger) {
        passenger.setBooking(this);
        passengers.add(passenger);
    }

    /**
     * Moves the booking along the transition table or fails without touching state.
     */
    public void transitionTo(BookingStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new ConflictException(String.format(
                    "Booking %s cannot move from %s to %s", bookingCode, status, target));
        }
        status = target;
    }

    public boolean isPending() {
        return status == BookingStatus.PENDING;
    }
}
