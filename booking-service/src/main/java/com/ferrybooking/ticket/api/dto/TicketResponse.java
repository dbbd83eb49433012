package com.ferrybooking.ticket.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ferrybooking.ticket.domain.model.Ticket;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TicketResponse(
        String ticketCode,
        String passengerName,
        String seatLabel,
        String status,
        String qrPayload,
        LocalDateTime checkedInAt
) {
    public static TicketResponse from(Ticket ticket) {
        return new TicketResponse(
                ticket.getTicketCode(),
                ticket.getPassengerName(),
                ticket.getSeatLabel(),
                ticket.getStatus().name(),
                ticket.getQrPayload(),
                ticket.getCheckedInAt()
        );
    }
}
