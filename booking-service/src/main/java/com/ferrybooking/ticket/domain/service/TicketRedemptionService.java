package com.ferrybooking.ticket.domain.service;

import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.inventory.domain.model.Departure;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import com.ferrybooking.ticket.api.dto.CheckInResult;
import com.ferrybooking.ticket.api.dto.TicketDetails;
import com.ferrybooking.ticket.api.dto.TicketValidationResult;
import com.ferrybooking.ticket.domain.model.Ticket;
import com.ferrybooking.ticket.domain.model.TicketStatus;
import com.ferrybooking.ticket.domain.repository.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * Gate-side validation and check-in. Every rejection carries a reason an operator can read
 * out to the passenger; nothing here throws for an unusable ticket.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketRedemptionService {

    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm", Locale.ENGLISH);

    private final TicketRepository ticketRepository;
    private final BookingRepository bookingRepository;
    private final DepartureRepository departureRepository;
    private final QrPayloadCodec qrPayloadCodec;
    private final Clock clock;

    @Value("${ticket.check-in.opens-hours-before:3}")
    private int opensHoursBefore = 3;

    @Value("${ticket.check-in.closes-hours-after:1}")
    private int closesHoursAfter = 1;

    /**
     * Read-only preview of what {@link #checkIn} would do.
     */
    @Transactional(readOnly = true)
    public TicketValidationResult validate(String codeOrQr) {
        return evaluate(codeOrQr).toValidationResult();
    }

    /**
     * Marks the ticket USED. Of two concurrent scans of the same ticket exactly one succeeds;
     * the other is told the ticket was already used.
     */
    @Transactional
    public CheckInResult checkIn(String codeOrQr, Actor operator) {
        operator.requireOperator();
        Evaluation evaluation = evaluate(codeOrQr);
        if (evaluation.reason() != null) {
            return CheckInResult.rejected(evaluation.reason(), evaluation.details());
        }

        Ticket ticket = evaluation.ticket();
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = ticketRepository.markUsedIfValid(ticket.getTicketCode(), operator.accountId(), now);
        if (updated == 0) {
            Ticket current = ticketRepository.findByTicketCode(ticket.getTicketCode()).orElse(ticket);
            log.info("Ticket {} was redeemed concurrently", ticket.getTicketCode());
            return CheckInResult.rejected(alreadyUsed(current), details(current, evaluation.booking(), evaluation.departure()));
        }

        if (ticketRepository.countByBookingIdAndStatus(ticket.getBookingId(), TicketStatus.VALID) == 0
                && bookingRepository.completeIfConfirmed(ticket.getBookingId(), now) == 1) {
            log.info("Booking {} completed, every ticket checked in", evaluation.booking().getBookingCode());
        }

        Ticket used = ticketRepository.findByTicketCode(ticket.getTicketCode()).orElse(ticket);
        log.info("Ticket {} checked in by operator {}", used.getTicketCode(), operator.accountId());
        return CheckInResult.success(details(used, evaluation.booking(), evaluation.departure()));
    }

    private Evaluation evaluate(String codeOrQr) {
        String input = codeOrQr == null ? "" : codeOrQr.trim();
        Optional<QrClaims> claims = Optional.empty();
        String ticketCode = input.toUpperCase(Locale.ROOT);
        if (QrPayloadCodec.looksLikePayload(input)) {
            claims = qrPayloadCodec.decode(input);
            if (claims.isEmpty()) {
                return Evaluation.rejected("Invalid QR code");
            }
            ticketCode = claims.get().ticketCode();
        }

        Optional<Ticket> found = ticketCode == null ? Optional.empty() : ticketRepository.findByTicketCode(ticketCode);
        if (found.isEmpty()) {
            return Evaluation.rejected("Ticket not found");
        }
        Ticket ticket = found.get();
        Booking booking = bookingRepository.findById(ticket.getBookingId()).orElse(null);
        Departure departure = booking == null ? null : departureRepository.findById(booking.getDepartureId()).orElse(null);
        TicketDetails details = details(ticket, booking, departure);

        if (claims.isPresent() && !claimsMatch(claims.get(), ticket, booking, departure)) {
            return new Evaluation(ticket, booking, departure, details, "QR code does not match this ticket");
        }
        if (ticket.getStatus() == TicketStatus.USED) {
            return new Evaluation(ticket, booking, departure, details, alreadyUsed(ticket));
        }
        if (ticket.getStatus() == TicketStatus.CANCELLED) {
            return new Evaluation(ticket, booking, departure, details, "Ticket has been cancelled");
        }
        if (booking == null || booking.getStatus() != BookingStatus.CONFIRMED) {
            return new Evaluation(ticket, booking, departure, details, "Booking is not confirmed");
        }
        if (departure == null || departure.getStatus() == Departure.DepartureStatus.CANCELLED) {
            return new Evaluation(ticket, booking, departure, details, "Departure has been cancelled");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime opensAt = departure.getDepartureTime().minusHours(opensHoursBefore);
        LocalDateTime closesAt = departure.getDepartureTime().plusHours(closesHoursAfter);
        if (now.isBefore(opensAt)) {
            long minutes = Duration.between(now, opensAt).toMinutes();
            long hours = Math.max(1, (minutes + 59) / 60);
            return new Evaluation(ticket, booking, departure, details,
                    "Check-in opens in " + hours + (hours == 1 ? " hour" : " hours"));
        }
        if (now.isAfter(closesAt)) {
            return new Evaluation(ticket, booking, departure, details, "Check-in window has closed");
        }
        return new Evaluation(ticket, booking, departure, details, null);
    }

    private static boolean claimsMatch(QrClaims claims, Ticket ticket, Booking booking, Departure departure) {
        return booking != null && departure != null
                && booking.getBookingCode().equals(claims.bookingCode())
                && ticket.getPassengerName().equals(claims.passengerName())
                && departure.getId().equals(claims.departureId());
    }

    private static String alreadyUsed(Ticket ticket) {
        return ticket.getCheckedInAt() == null
                ? "Ticket already used"
                : "Ticket already used at " + ticket.getCheckedInAt().format(DISPLAY_TIME);
    }

    private static TicketDetails details(Ticket ticket, Booking booking, Departure departure) {
        return new TicketDetails(
                ticket.getTicketCode(),
                booking == null ? null : booking.getBookingCode(),
                ticket.getPassengerName(),
                ticket.getSeatLabel(),
                ticket.getStatus().name(),
                departure == null ? null : departure.getId(),
                departure == null ? null : departure.getOriginPort() + " - " + departure.getDestinationPort(),
                departure == null ? null : departure.getDepartureTime(),
                ticket.getCheckedInAt());
    }

    private record Evaluation(Ticket ticket, Booking booking, Departure departure, TicketDetails details, String reason) {

        static Evaluation rejected(String reason) {
            return new Evaluation(null, null, null, null, reason);
        }

        TicketValidationResult toValidationResult() {
            return reason == null ? TicketValidationResult.valid(details) : TicketValidationResult.rejected(reason, details);
        }
    }
}
