package com.ferrybooking.booking.api.controller;

import com.ferrybooking.booking.api.dto.BookingResponse;
import com.ferrybooking.booking.api.dto.CancelBookingRequest;
import com.ferrybooking.booking.api.dto.CreateBookingRequest;
import com.ferrybooking.booking.domain.service.BookingService;
import com.ferrybooking.common.dto.BaseResponse;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.common.security.ActorRole;
import com.ferrybooking.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = bookingService.createBooking(request, Actor.of(accountId, role));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Seats held until " + response.expiresAt() + ", please complete payment", response));
    }

    @GetMapping("/{bookingCode}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @PathVariable String bookingCode) {
        return ResponseEntity.ok(BaseResponse.success(
                bookingService.getBooking(bookingCode, Actor.of(accountId, role))));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getMyBookings(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role) {
        return ResponseEntity.ok(BaseResponse.success(
                bookingService.getBookingsForAccount(Actor.of(accountId, role))));
    }

    @PostMapping("/{bookingCode}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancelBooking(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @PathVariable String bookingCode,
            @Valid @RequestBody(required = false) CancelBookingRequest request) {
        String reason = request == null ? null : request.reason();
        BookingResponse response = bookingService.cancelBooking(bookingCode, Actor.of(accountId, role), reason);
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled", response));
    }
}
