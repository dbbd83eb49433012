package com.ferrybooking.ticket.domain.model;

public enum TicketStatus {
    VALID,
    USED,
    CANCELLED
}
