package com.ferrybooking.booking.job;

import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.booking.domain.service.BookingExpiryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reclaims seats held by PENDING bookings whose hold ran out without a settled payment.
 * Each booking is expired in its own transaction; one failure never stops the batch.
 * Safe to run on several instances at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirySweeper {

    private final BookingRepository bookingRepository;
    private final BookingExpiryService bookingExpiryService;
    private final Clock clock;

    @Value("${booking.expiry.sweep-enabled:true}")
    private boolean sweepEnabled = true;

    @Value("${booking.expiry.batch-size:200}")
    private int batchSize = 200;

    @Scheduled(fixedDelayString = "${booking.expiry.sweep-interval-ms:60000}")
    public void runScheduled() {
        if (!sweepEnabled) return;
        sweep();
    }

    public SweepSummary sweep() {
        List<Long> candidates = bookingRepository.findExpiredPendingIds(
                BookingStatus.PENDING, LocalDateTime.now(clock), PageRequest.of(0, batchSize));
        if (candidates.isEmpty()) {
            return SweepSummary.empty();
        }

        int expired = 0;
        int skipped = 0;
        List<Long> failed = new ArrayList<>();
        for (Long bookingId : candidates) {
            try {
                if (bookingExpiryService.expireIfOverdue(bookingId)) {
                    expired++;
                } else {
                    skipped++;
                }
            } catch (Exception e) {
                log.error("Expiry failed for booking {}", bookingId, e);
                failed.add(bookingId);
            }
        }

        SweepSummary summary = new SweepSummary(candidates.size(), expired, skipped, List.copyOf(failed));
        log.info("Expiry sweep: examined={}, expired={}, skipped={}, failed={}",
                summary.examined(), summary.expired(), summary.skipped(), summary.failedBookingIds());
        return summary;
    }
}
