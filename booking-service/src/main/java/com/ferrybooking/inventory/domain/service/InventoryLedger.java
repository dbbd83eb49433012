package com.ferrybooking.inventory.domain.service;

import com.ferrybooking.common.exception.ResourceNotFoundException;
import com.ferrybooking.common.exception.ValidationException;
import com.ferrybooking.inventory.domain.model.Departure;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * The only writer of {@code Departure.availableSeats}.
 *
 * Both operations are a single conditional UPDATE; nothing here reads the counter and writes
 * it back. Callers own the exactly-once discipline for {@link #release(Long, int)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryLedger {

    private final DepartureRepository departureRepository;
    private final Clock clock;

    @Transactional
    public ReservationOutcome reserve(Long departureId, int seatCount) {
        requirePositive(seatCount);
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = departureRepository.reserveSeatsAtomically(departureId, seatCount, now);
        if (updated == 1) {
            log.info("Reserved {} seat(s) on departure {}", seatCount, departureId);
            return ReservationOutcome.RESERVED;
        }

        // Nothing changed; work out why for the caller.
        Departure departure = departureRepository.findById(departureId)
                .orElseThrow(() -> new ResourceNotFoundException("Departure", departureId));
        if (!departure.isBookableAt(now)) {
            log.info("Departure {} not bookable (status={}, time={})",
                    departureId, departure.getStatus(), departure.getDepartureTime());
            return ReservationOutcome.DEPARTURE_NOT_BOOKABLE;
        }
        log.info("Insufficient seats on departure {}: requested={}, available={}",
                departureId, seatCount, departure.getAvailableSeats());
        return ReservationOutcome.INSUFFICIENT_SEATS;
    }

    @Transactional
    public void release(Long departureId, int seatCount) {
        requirePositive(seatCount);
        int updated = departureRepository.releaseSeatsAtomically(departureId, seatCount, LocalDateTime.now(clock));
        if (updated != 1) {
            if (!departureRepository.existsById(departureId)) {
                throw new ResourceNotFoundException("Departure", departureId);
            }
            log.error("Releasing {} seat(s) would exceed capacity of departure {}", seatCount, departureId);
            throw new IllegalStateException("Seat release would exceed capacity of departure " + departureId);
        }
        log.info("Released {} seat(s) on departure {}", seatCount, departureId);
    }

    private static void requirePositive(int seatCount) {
        if (seatCount <= 0) {
            throw new ValidationException("Seat count must be positive");
        }
    }
}
