package com.ferrybooking.ticket.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param reason operator-readable explanation when {@code valid} is false
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TicketValidationResult(boolean valid, String reason, TicketDetails ticket) {

    public static TicketValidationResult valid(TicketDetails ticket) {
        return new TicketValidationResult(true, null, ticket);
    }

    public static TicketValidationResult rejected(String reason, TicketDetails ticket) {
        return new TicketValidationResult(false, reason, ticket);
    }
}
