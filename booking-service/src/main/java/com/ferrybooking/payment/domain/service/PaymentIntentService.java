package com.ferrybooking.payment.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.model.Passenger;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.common.exception.BusinessException;
import com.ferrybooking.common.exception.ConflictException;
import com.ferrybooking.common.exception.ForbiddenActionException;
import com.ferrybooking.common.exception.ResourceNotFoundException;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.inventory.domain.model.Departure;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import com.ferrybooking.payment.api.dto.PaymentIntentResponse;
import com.ferrybooking.payment.api.dto.PaymentResponse;
import com.ferrybooking.payment.client.PaymentGatewayAdapter;
import com.ferrybooking.payment.client.dto.SnapTransactionRequest;
import com.ferrybooking.payment.client.dto.SnapTransactionResponse;
import com.ferrybooking.payment.domain.model.Payment;
import com.ferrybooking.payment.domain.model.PaymentStatus;
import com.ferrybooking.payment.domain.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Opens gateway payment intents for PENDING bookings. A booking has one payment row; repeated
 * calls return the cached token while it is still valid, and a new gateway attempt reuses the
 * row under a fresh order id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentIntentService {

    static final DateTimeFormatter GATEWAY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z");

    private final BookingRepository bookingRepository;
    private final DepartureRepository departureRepository;
    private final PaymentRepository paymentRepository;
    private final PaymentGatewayAdapter gatewayAdapter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${payment.intent.max-minutes:15}")
    private int maxIntentMinutes = 15;

    @Value("${payment.gateway.finish-url:}")
    private String finishUrl = "";

    @Transactional
    public PaymentIntentResponse createIntent(String bookingCode, Actor actor, boolean force) {
        Booking booking = bookingRepository.findByBookingCodeForUpdate(bookingCode)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingCode));
        if (!actor.owns(booking.getAccountId()) && !actor.isAdmin()) {
            throw new ForbiddenActionException("You can only pay for your own bookings");
        }
        if (booking.getStatus() == BookingStatus.CONFIRMED) {
            throw new ConflictException("Booking is already paid");
        }
        if (!booking.isPending()) {
            throw new ConflictException("Booking is " + booking.getStatus() + " and can no longer be paid");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (!booking.getExpiresAt().isAfter(now)) {
            throw new ConflictException("Booking expired, please rebook");
        }
        long intentMinutes = Math.min(Duration.between(now, booking.getExpiresAt()).toMinutes(), maxIntentMinutes);
        if (intentMinutes < 1) {
            throw new ConflictException("Booking hold is about to expire, please rebook");
        }

        Optional<Payment> existing = paymentRepository.findByBookingIdForUpdate(booking.getId());
        if (existing.isPresent()) {
            Payment payment = existing.get();
            if (payment.getStatus() == PaymentStatus.SUCCESS) {
                throw new ConflictException("Booking is already paid");
            }
            if (payment.getStatus() == PaymentStatus.CHALLENGE) {
                throw new ConflictException("Payment is under review by the payment provider");
            }
            if (payment.getStatus() == PaymentStatus.REFUNDED) {
                throw new ConflictException("Payment was refunded and cannot be reopened");
            }
            if (!force && payment.hasReusableToken(now)) {
                log.debug("Reusing gateway token of order {}", payment.getOrderId());
                return toIntentResponse(payment, true);
            }
        }

        String orderId = existing
                .map(p -> booking.getBookingCode() + "-" + (p.getAttempt() + 1))
                .orElse(booking.getBookingCode());
        Departure departure = departureRepository.findById(booking.getDepartureId())
                .orElseThrow(() -> new ResourceNotFoundException("Departure", booking.getDepartureId()));
        SnapTransactionResponse response = gatewayAdapter.createTransaction(
                buildRequest(booking, departure, orderId, intentMinutes));

        Payment payment;
        if (existing.isPresent()) {
            payment = existing.get();
            String previousOrderId = payment.getOrderId();
            boolean supersededOpenOrder = payment.getStatus() == PaymentStatus.PENDING && payment.getGatewayToken() != null;
            payment.startNewAttempt(orderId);
            if (supersededOpenOrder) {
                cancelSupersededOrder(previousOrderId);
            }
        } else {
            payment = Payment.builder()
                    .bookingId(booking.getId())
                    .orderId(orderId)
                    .amount(booking.getTotalAmount())
                    .status(PaymentStatus.PENDING)
                    .attempt(1)
                    .build();
        }
        payment.setGatewayToken(response.token());
        payment.setRedirectUrl(response.redirectUrl());
        payment.setExpiredAt(now.plusMinutes(intentMinutes));
        payment.setRawResponse(toJson(response));
        Payment saved = paymentRepository.save(payment);

        log.info("Payment intent opened for booking {}: order {}, attempt {}, expires {}",
                bookingCode, saved.getOrderId(), saved.getAttempt(), saved.getExpiredAt());
        return toIntentResponse(saved, false);
    }

    @Transactional(readOnly = true)
    public PaymentResponse getPayment(String bookingCode, Actor actor) {
        Booking booking = bookingRepository.findByBookingCode(bookingCode)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingCode));
        if (!actor.owns(booking.getAccountId()) && !actor.isOperator()) {
            throw new ForbiddenActionException("You can only view your own payments");
        }
        Payment payment = paymentRepository.findByBookingId(booking.getId())
                .orElseThrow(() -> new ResourceNotFoundException("No payment has been started for booking " + bookingCode));
        return PaymentResponse.from(bookingCode, payment);
    }

    private SnapTransactionRequest buildRequest(Booking booking, Departure departure, String orderId, long intentMinutes) {
        BigDecimal grossAmount = booking.getTotalAmount().setScale(2, RoundingMode.UNNECESSARY);
        Passenger lead = booking.getPassengers().isEmpty() ? null : booking.getPassengers().get(0);
        String itemName = departure.getOriginPort() + " - " + departure.getDestinationPort();
        return new SnapTransactionRequest(
                new SnapTransactionRequest.TransactionDetails(orderId, grossAmount),
                lead == null ? null : new SnapTransactionRequest.CustomerDetails(lead.getFullName(), lead.getPhone()),
                List.of(itemDetail(departure.getRouteCode(), truncate(itemName, 50), grossAmount, booking.getPassengerCount())),
                new SnapTransactionRequest.Expiry(
                        ZonedDateTime.now(clock).format(GATEWAY_TIME), "minute", (int) intentMinutes),
                finishUrl == null || finishUrl.isBlank() ? null : new SnapTransactionRequest.Callbacks(finishUrl)
        );
    }

    /**
     * One line per passenger at the booked unit price. Falls back to a single line for the whole amount when the
     * total does not split evenly, so the items always add up to the gross amount.
     */
    private static SnapTransactionRequest.ItemDetail itemDetail(String id, String name, BigDecimal grossAmount, int passengers) {
        BigDecimal quantity = BigDecimal.valueOf(passengers);
        BigDecimal unitPrice = grossAmount.divide(quantity, 2, RoundingMode.DOWN);
        if (unitPrice.multiply(quantity).compareTo(grossAmount) == 0) {
            return new SnapTransactionRequest.ItemDetail(id, unitPrice, passengers, name);
        }
        return new SnapTransactionRequest.ItemDetail(id, grossAmount, 1, name);
    }

    private void cancelSupersededOrder(String orderId) {
        try {
            gatewayAdapter.cancel(orderId);
        } catch (BusinessException e) {
            // The superseded order expires on its own at the gateway.
            log.warn("Could not cancel superseded gateway order {}: {}", orderId, e.getMessage());
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize gateway response: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static PaymentIntentResponse toIntentResponse(Payment payment, boolean reused) {
        return new PaymentIntentResponse(payment.getGatewayToken(), payment.getRedirectUrl(),
                payment.getOrderId(), payment.getExpiredAt(), reused);
    }
}
