package com.ferrybooking.booking.domain.service;

import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.inventory.domain.service.InventoryLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Returns a booking's seats to its departure at most once.
 * Must be called with the booking row locked, inside the transaction that changes its status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeatHoldReleaser {

    private final InventoryLedger inventoryLedger;

    public boolean releaseOnce(Booking booking) {
        if (booking.isInventoryReleased()) {
            log.debug("Seats of booking {} already released", booking.getBookingCode());
            return false;
        }
        booking.setInventoryReleased(true);
        inventoryLedger.release(booking.getDepartureId(), booking.getPassengerCount());
        return true;
    }
}
