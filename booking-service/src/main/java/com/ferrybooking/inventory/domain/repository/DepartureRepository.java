package com.ferrybooking.inventory.domain.repository;

import com.ferrybooking.inventory.domain.model.Departure;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;

public interface DepartureRepository extends JpaRepository<Departure, Long> {

    /**
     * Takes {@code seats} seats in one UPDATE. The WHERE clause carries every bookability
     * condition, so two concurrent callers can never both take the last seat.
     *
     * @return 1 when the seats were taken, 0 when the departure is unknown, not bookable or short of seats
     */
    @Modifying(flushAutomatically = true)
    @Query("""
           UPDATE Departure d
           SET d.availableSeats = d.availableSeats - :seats,
               d.version = d.version + 1,
               d.updatedAt = :now
           WHERE d.id = :departureId
             AND d.status = :bookableStatus
             AND d.departureTime > :now
             AND d.availableSeats >= :seats
           """)
    int reserveSeatsAtomically(@Param("departureId") Long departureId,
                               @Param("seats") int seats,
                               @Param("now") LocalDateTime now,
                               @Param("bookableStatus") Departure.DepartureStatus bookableStatus);

    default int reserveSeatsAtomically(Long departureId, int seats, LocalDateTime now) {
        return reserveSeatsAtomically(departureId, seats, now, Departure.DepartureStatus.SCHEDULED);
    }

    /**
     * Gives {@code seats} seats back unless that would push the counter above the capacity.
     *
     * @return 1 when the seats were returned, 0 when the departure is unknown or the guard tripped
     */
    @Modifying(flushAutomatically = true)
    @Query("""
           UPDATE Departure d
           SET d.availableSeats = d.availableSeats + :seats,
               d.version = d.version + 1,
               d.updatedAt = :now
           WHERE d.id = :departureId
             AND d.availableSeats + :seats <= d.totalSeats
           """)
    int releaseSeatsAtomically(@Param("departureId") Long departureId,
                               @Param("seats") int seats,
                               @Param("now") LocalDateTime now);
}
