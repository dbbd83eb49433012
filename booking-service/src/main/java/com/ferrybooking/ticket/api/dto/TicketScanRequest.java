package com.ferrybooking.ticket.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param code a ticket code typed in by the operator or the raw content of a scanned QR code
 */
public record TicketScanRequest(
        @NotBlank(message = "Ticket code or QR payload is required")
        @Size(max = 2048, message = "Scanned value is too long")
        String code
) {
}
