package com.ferrybooking.inventory.api.dto;

import com.ferrybooking.inventory.domain.model.Departure;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record DepartureResponse(
        Long id,
        String routeCode,
        String originPort,
        String destinationPort,
        String vesselName,
        LocalDateTime departureTime,
        Integer totalSeats,
        Integer availableSeats,
        BigDecimal fare,
        String status
) {
    public static DepartureResponse from(Departure departure) {
        return new DepartureResponse(
                departure.getId(),
                departure.getRouteCode(),
                departure.getOriginPort(),
                departure.getDestinationPort(),
                departure.getVesselName(),
                departure.getDepartureTime(),
                departure.getTotalSeats(),
                departure.getAvailableSeats(),
                departure.getFare(),
                departure.getStatus().name()
        );
    }
}
