package com.ferrybooking.ticket.api.controller;

import com.ferrybooking.common.dto.BaseResponse;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.common.security.ActorRole;
import com.ferrybooking.common.util.Constants;
import com.ferrybooking.ticket.api.dto.CheckInResult;
import com.ferrybooking.ticket.api.dto.TicketResponse;
import com.ferrybooking.ticket.api.dto.TicketScanRequest;
import com.ferrybooking.ticket.api.dto.TicketValidationResult;
import com.ferrybooking.ticket.domain.service.TicketIssuanceService;
import com.ferrybooking.ticket.domain.service.TicketRedemptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class TicketController {

    private final TicketIssuanceService ticketIssuanceService;
    private final TicketRedemptionService ticketRedemptionService;

    @GetMapping("/bookings/{bookingCode}/tickets")
    public ResponseEntity<BaseResponse<List<TicketResponse>>> getTickets(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @PathVariable String bookingCode) {
        return ResponseEntity.ok(BaseResponse.success(
                ticketIssuanceService.getTickets(bookingCode, Actor.of(accountId, role))));
    }

    @PostMapping("/tickets/validate")
    public ResponseEntity<BaseResponse<TicketValidationResult>> validate(@Valid @RequestBody TicketScanRequest request) {
        TicketValidationResult result = ticketRedemptionService.validate(request.code());
        return ResponseEntity.ok(BaseResponse.success(result.valid() ? "Ticket is valid" : result.reason(), result));
    }

    @PostMapping("/tickets/check-in")
    public ResponseEntity<BaseResponse<CheckInResult>> checkIn(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long operatorId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @Valid @RequestBody TicketScanRequest request) {
        CheckInResult result = ticketRedemptionService.checkIn(request.code(), Actor.of(operatorId, role));
        return ResponseEntity.ok(BaseResponse.success(result.checkedIn() ? "Checked in" : result.reason(), result));
    }
}
