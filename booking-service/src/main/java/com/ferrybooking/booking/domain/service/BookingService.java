package com.ferrybooking.booking.domain.service;

import com.ferrybooking.booking.api.dto.BookingResponse;
import com.ferrybooking.booking.api.dto.CreateBookingRequest;
import com.ferrybooking.booking.api.dto.PassengerRequest;
import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.model.Passenger;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.booking.events.BookingCancelledEvent;
import com.ferrybooking.common.exception.ConflictException;
import com.ferrybooking.common.exception.ForbiddenActionException;
import com.ferrybooking.common.exception.ResourceNotFoundException;
import com.ferrybooking.common.exception.ValidationException;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.inventory.domain.model.Departure;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import com.ferrybooking.inventory.domain.service.InventoryLedger;
import com.ferrybooking.inventory.domain.service.ReservationOutcome;
import com.ferrybooking.payment.domain.model.Payment;
import com.ferrybooking.payment.domain.model.PaymentStatus;
import com.ferrybooking.payment.domain.repository.PaymentRepository;
import com.ferrybooking.ticket.domain.repository.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Creates and cancels bookings. Expiry lives in {@link BookingExpiryService}; confirmation is
 * driven by payment reconciliation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final BookingRepository bookingRepository;
    private final DepartureRepository departureRepository;
    private final PaymentRepository paymentRepository;
    private final TicketRepository ticketRepository;
    private final InventoryLedger inventoryLedger;
    private final SeatHoldReleaser seatHoldReleaser;
    private final BookingCodeGenerator bookingCodeGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${booking.hold.duration-minutes:15}")
    private int holdMinutes = 15;

    @Value("${booking.hold.max-minutes:15}")
    private int maxHoldMinutes = 15;

    @Value("${booking.max-passengers:50}")
    private int maxPassengers = 50;

    @Value("${booking.cancellation.lead-time-hours:24}")
    private int cancellationLeadTimeHours = 24;

    /**
     * Holds seats and records a PENDING booking with its passengers. Nothing is written
     * when the seats cannot be held.
     */
    @Transactional
    public BookingResponse createBooking(CreateBookingRequest request, Actor actor) {
        List<PassengerRequest> passengers = request.passengers();
        validatePassengers(passengers);

        Departure departure = departureRepository.findById(request.departureId())
                .orElseThrow(() -> new ResourceNotFoundException("Departure", request.departureId()));

        int seats = passengers.size();
        ReservationOutcome outcome = inventoryLedger.reserve(departure.getId(), seats);
        if (outcome == ReservationOutcome.INSUFFICIENT_SEATS) {
            throw new ConflictException("Not enough seats available on this departure");
        }
        if (outcome == ReservationOutcome.DEPARTURE_NOT_BOOKABLE) {
            throw new ConflictException("This departure is no longer open for booking");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Booking booking = Booking.builder()
                .bookingCode(bookingCodeGenerator.nextUniqueCode())
                .departureId(departure.getId())
                .accountId(actor.accountId())
                .passengerCount(seats)
                .totalAmount(departure.getFare().multiply(BigDecimal.valueOf(seats)).setScale(2, RoundingMode.HALF_UP))
                .status(BookingStatus.PENDING)
                .expiresAt(now.plusMinutes(Math.min(holdMinutes, maxHoldMinutes)))
                .build();
        for (PassengerRequest p : passengers) {
            booking.addPassenger(Passenger.builder()
                    .fullName(p.fullName().trim())
                    .identityType(p.identityType())
                    .identityNumber(p.identityNumber().toUpperCase(Locale.ROOT))
                    .category(p.category() == null ? Passenger.PassengerCategory.ADULT : p.category())
                    .phone(p.phone() == null || p.phone().isBlank() ? null : p.phone())
                    .build());
        }

        Booking saved = bookingRepository.save(booking);
        log.info("Booking {} created for account {}: {} seat(s) on departure {}, hold until {}",
                saved.getBookingCode(), actor.accountId(), seats, departure.getId(), saved.getExpiresAt());
        return BookingResponse.from(saved);
    }

    /**
     * Cancels a PENDING or CONFIRMED booking, gives the seats back once, voids issued tickets
     * and settles the payment record: PENDING becomes CANCELLED, SUCCESS becomes REFUNDED.
     */
    @Transactional
    public BookingResponse cancelBooking(String bookingCode, Actor actor, String reason) {
        Booking booking = bookingRepository.findByBookingCodeForUpdate(bookingCode)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingCode));
        LocalDateTime now = LocalDateTime.now(clock);

        authorizeCancellation(booking, actor, now);
        booking.transitionTo(BookingStatus.CANCELLED);
        booking.setCancelledAt(now);
        booking.setCancelledBy(actor.accountId());
        booking.setCancellationReason(reason != null && !reason.isBlank()
                ? reason.trim()
                : (actor.isAdmin() ? "Cancelled by administrator" : "Cancelled by customer"));

        seatHoldReleaser.releaseOnce(booking);
        int ticketsCancelled = ticketRepository.cancelValidTickets(booking.getId(), now);
        boolean refunded = settlePaymentOnCancel(booking);

        log.info("Booking {} cancelled by account {} (tickets voided={}, refunded={})",
                bookingCode, actor.accountId(), ticketsCancelled, refunded);
        eventPublisher.publishEvent(new BookingCancelledEvent(
                booking.getBookingCode(), booking.getAccountId(), actor.accountId(),
                booking.getCancellationReason(), refunded, Instant.now(clock)));
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public BookingResponse getBooking(String bookingCode, Actor actor) {
        Booking booking = bookingRepository.findByBookingCode(bookingCode)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingCode));
        if (!actor.owns(booking.getAccountId()) && !actor.isOperator()) {
            throw new ForbiddenActionException("You can only view your own bookings");
        }
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> getBookingsForAccount(Actor actor) {
        return bookingRepository.findByAccountIdOrderByCreatedAtDesc(actor.accountId()).stream()
                .map(BookingResponse::from)
                .toList();
    }

    private void authorizeCancellation(Booking booking, Actor actor, LocalDateTime now) {
        if (actor.isAdmin()) {
            return;
        }
        if (!actor.owns(booking.getAccountId())) {
            throw new ForbiddenActionException("You can only cancel your own bookings");
        }
        if (booking.getStatus() == BookingStatus.CONFIRMED) {
            Departure departure = departureRepository.findById(booking.getDepartureId())
                    .orElseThrow(() -> new ResourceNotFoundException("Departure", booking.getDepartureId()));
            if (!now.plusHours(cancellationLeadTimeHours).isBefore(departure.getDepartureTime())) {
                throw new ForbiddenActionException(String.format(
                        "Confirmed bookings can only be cancelled more than %d hours before departure",
                        cancellationLeadTimeHours));
            }
        }
    }

    private boolean settlePaymentOnCancel(Booking booking) {
        Optional<Payment> locked = paymentRepository.findByBookingIdForUpdate(booking.getId());
        if (locked.isEmpty()) {
            return false;
        }
        Payment payment = locked.get();
        if (payment.getStatus() == PaymentStatus.SUCCESS) {
            payment.transitionTo(PaymentStatus.REFUNDED);
            booking.transitionTo(BookingStatus.REFUNDED);
            log.info("Payment {} of cancelled booking {} marked refunded", payment.getOrderId(), booking.getBookingCode());
            return true;
        }
        if (payment.getStatus() == PaymentStatus.PENDING) {
            payment.transitionTo(PaymentStatus.CANCELLED);
        } else {
            log.info("Payment {} left in {} for cancelled booking {}",
                    payment.getOrderId(), payment.getStatus(), booking.getBookingCode());
        }
        return false;
    }

    private void validatePassengers(List<PassengerRequest> passengers) {
        if (passengers == null || passengers.isEmpty()) {
            throw new ValidationException("At least one passenger is required");
        }
        if (passengers.size() > maxPassengers) {
            throw new ValidationException("A booking can hold at most " + maxPassengers + " passengers");
        }
        Set<String> identities = new HashSet<>();
        for (PassengerRequest p : passengers) {
            String identity = p.identityType() + ":" + p.identityNumber().toUpperCase(Locale.ROOT);
            if (!identities.add(identity)) {
                throw new ValidationException("Each passenger needs a distinct identity number");
            }
        }
    }
}
