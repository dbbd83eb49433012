package com.ferrybooking.booking.domain.service;

import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.common.exception.ConflictException;
import com.ferrybooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Produces {@code FRB-yyyyMMdd-XXXXX} codes. The suffix comes from {@link SecureRandom}
 * so codes cannot be guessed from neighbouring bookings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCodeGenerator {

    private static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int SUFFIX_LENGTH = 5;
    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final BookingRepository bookingRepository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Value("${booking.code.max-attempts:5}")
    private int maxAttempts = 5;

    public String nextUniqueCode() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = generate();
            if (!bookingRepository.existsByBookingCode(candidate)) {
                return candidate;
            }
            log.warn("Booking code collision on attempt {}: {}", attempt, candidate);
        }
        throw new ConflictException("Could not generate a unique booking code, please try again");
    }

    String generate() {
        StringBuilder code = new StringBuilder(Constants.BOOKING_CODE_PREFIX)
                .append('-')
                .append(LocalDate.now(clock).format(DATE))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
