package com.ferrybooking.ticket.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckInResult(boolean checkedIn, String reason, TicketDetails ticket) {

    public static CheckInResult success(TicketDetails ticket) {
        return new CheckInResult(true, null, ticket);
    }

    public static CheckInResult rejected(String reason, TicketDetails ticket) {
        return new CheckInResult(false, reason, ticket);
    }
}
