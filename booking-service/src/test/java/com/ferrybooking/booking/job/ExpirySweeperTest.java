package com.ferrybooking.booking.job;

import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.booking.domain.service.BookingExpiryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpirySweeperTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T02:00:00Z"), ZoneId.of("Asia/Jakarta"));

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private BookingExpiryService bookingExpiryService;

    private ExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        sweeper = new ExpirySweeper(bookingRepository, bookingExpiryService, CLOCK);
    }

    @Test
    @DisplayName("one failing booking does not stop the batch and is reported in the summary")
    void failureIsIsolatedPerBooking() {
        when(bookingRepository.findExpiredPendingIds(eq(BookingStatus.PENDING), any(), any(Pageable.class)))
                .thenReturn(List.of(1L, 2L, 3L));
        when(bookingExpiryService.expireIfOverdue(1L)).thenReturn(true);
        when(bookingExpiryService.expireIfOverdue(2L)).thenThrow(new CannotAcquireLockException("lock timeout"));
        when(bookingExpiryService.expireIfOverdue(3L)).thenReturn(false);

        SweepSummary summary = sweeper.sweep();

        assertThat(summary.examined()).isEqualTo(3);
        assertThat(summary.expired()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.failedBookingIds()).containsExactly(2L);
        verify(bookingExpiryService).expireIfOverdue(3L);
    }

    @Test
    void nothingOverdue_returnsEmptySummary() {
        when(bookingRepository.findExpiredPendingIds(eq(BookingStatus.PENDING), any(), any(Pageable.class)))
                .thenReturn(List.of());

        assertThat(sweeper.sweep()).isEqualTo(SweepSummary.empty());
        verifyNoInteractions(bookingExpiryService);
    }

    @Test
    void disabledSchedule_doesNotQuery() {
        ReflectionTestUtils.setField(sweeper, "sweepEnabled", false);

        sweeper.runScheduled();

        verify(bookingRepository, never()).findExpiredPendingIds(any(), any(), any());
    }
}
