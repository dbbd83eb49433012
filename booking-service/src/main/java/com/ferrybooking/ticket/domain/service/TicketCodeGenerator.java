package com.ferrybooking.ticket.domain.service;

import com.ferrybooking.common.exception.ConflictException;
import com.ferrybooking.common.util.Constants;
import com.ferrybooking.ticket.domain.repository.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Locale;
import java.util.Set;

/**
 * Produces {@code TKT-<base36 millis>-XXXX} codes, unique in the store and within the batch
 * being issued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketCodeGenerator {

    private static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int SUFFIX_LENGTH = 4;

    private final TicketRepository ticketRepository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Value("${ticket.code.max-attempts:5}")
    private int maxAttempts = 5;

    /**
     * @param reserved codes already handed out in the current batch; the new code is added to it
     */
    public String nextUniqueCode(Set<String> reserved) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = generate();
            if (!reserved.contains(candidate) && !ticketRepository.existsByTicketCode(candidate)) {
                reserved.add(candidate);
                return candidate;
            }
            log.warn("Ticket code collision on attempt {}: {}", attempt, candidate);
        }
        throw new ConflictException("Could not generate a unique ticket code, please try again");
    }

    String generate() {
        StringBuilder code = new StringBuilder(Constants.TICKET_CODE_PREFIX)
                .append('-')
                .append(Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
}
