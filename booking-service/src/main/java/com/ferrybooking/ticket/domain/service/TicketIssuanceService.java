package com.ferrybooking.ticket.domain.service;

import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.model.Passenger;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.common.exception.ConflictException;
import com.ferrybooking.common.exception.ForbiddenActionException;
import com.ferrybooking.common.exception.ResourceNotFoundException;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.inventory.domain.model.Departure;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import com.ferrybooking.ticket.api.dto.TicketResponse;
import com.ferrybooking.ticket.domain.model.Ticket;
import com.ferrybooking.ticket.domain.model.TicketStatus;
import com.ferrybooking.ticket.domain.repository.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Issues one ticket per passenger of a confirmed booking. Re-running it for the same booking
 * only fills in passengers that have no ticket yet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketIssuanceService {

    private static final int SEATS_PER_ROW = 10;

    private final BookingRepository bookingRepository;
    private final DepartureRepository departureRepository;
    private final TicketRepository ticketRepository;
    private final TicketCodeGenerator ticketCodeGenerator;
    private final QrPayloadCodec qrPayloadCodec;

    @Transactional
    public List<Ticket> issueForBooking(Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            throw new ConflictException("Tickets can only be issued for a confirmed booking, "
                    + booking.getBookingCode() + " is " + booking.getStatus());
        }
        Departure departure = departureRepository.findById(booking.getDepartureId())
                .orElseThrow(() -> new ResourceNotFoundException("Departure", booking.getDepartureId()));

        Set<Long> ticketed = ticketRepository.findByBookingIdOrderByIdAsc(bookingId).stream()
                .map(Ticket::getPassengerId)
                .collect(Collectors.toSet());
        Set<String> batchCodes = new HashSet<>();
        List<Ticket> issued = new ArrayList<>();
        List<Passenger> passengers = booking.getPassengers();
        for (int i = 0; i < passengers.size(); i++) {
            Passenger passenger = passengers.get(i);
            if (ticketed.contains(passenger.getId())) {
                continue;
            }
            String code = ticketCodeGenerator.nextUniqueCode(batchCodes);
            String qr = qrPayloadCodec.encode(new QrClaims(code, booking.getBookingCode(), passenger.getFullName(),
                    departure.getId(), departure.getDepartureTime().toString()));
            issued.add(Ticket.builder()
                    .ticketCode(code)
                    .bookingId(bookingId)
                    .passengerId(passenger.getId())
                    .passengerName(passenger.getFullName())
                    .seatLabel(seatLabel(i))
                    .qrPayload(qr)
                    .status(TicketStatus.VALID)
                    .build());
        }

        if (issued.isEmpty()) {
            log.debug("All passengers of booking {} already hold tickets", booking.getBookingCode());
            return List.of();
        }
        List<Ticket> saved = ticketRepository.saveAll(issued);
        log.info("Issued {} ticket(s) for booking {}", saved.size(), booking.getBookingCode());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<TicketResponse> getTickets(String bookingCode, Actor actor) {
        Booking booking = bookingRepository.findByBookingCode(bookingCode)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingCode));
        if (!actor.owns(booking.getAccountId()) && !actor.isOperator()) {
            throw new ForbiddenActionException("You can only view tickets of your own bookings");
        }
        return ticketRepository.findByBookingIdOrderByIdAsc(booking.getId()).stream()
                .map(TicketResponse::from)
                .toList();
    }

    /** A1..A10, B1..B10 and so on, by passenger position within the booking. */
    static String seatLabel(int index) {
        return String.valueOf((char) ('A' + index / SEATS_PER_ROW)) + (index % SEATS_PER_ROW + 1);
    }
}
