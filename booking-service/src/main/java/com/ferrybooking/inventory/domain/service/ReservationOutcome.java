package com.ferrybooking.inventory.domain.service;

public enum ReservationOutcome {
    RESERVED,
    INSUFFICIENT_SEATS,
    DEPARTURE_NOT_BOOKABLE
}
