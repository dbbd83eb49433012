package com.ferrybooking.payment.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.common.exception.ConflictException;
import com.ferrybooking.common.exception.ForbiddenActionException;
import com.ferrybooking.common.exception.GatewayException;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.common.security.ActorRole;
import com.ferrybooking.inventory.domain.model.Departure;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import com.ferrybooking.payment.api.dto.PaymentIntentResponse;
import com.ferrybooking.payment.client.PaymentGatewayAdapter;
import com.ferrybooking.payment.client.dto.SnapTransactionRequest;
import com.ferrybooking.payment.client.dto.SnapTransactionResponse;
import com.ferrybooking.payment.domain.model.Payment;
import com.ferrybooking.payment.domain.model.PaymentStatus;
import com.ferrybooking.payment.domain.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentIntentServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T02:00:00Z"), ZoneId.of("Asia/Jakarta"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final String CODE = "FRB-20261019-ABCDE";
    private static final Actor OWNER = Actor.of(100L, ActorRole.USER);

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private DepartureRepository departureRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private PaymentGatewayAdapter gatewayAdapter;

    private PaymentIntentService service;

    @BeforeEach
    void setUp() {
        service = new PaymentIntentService(bookingRepository, departureRepository, paymentRepository,
                gatewayAdapter, new ObjectMapper(), CLOCK);
    }

    private Booking pendingBooking(LocalDateTime expiresAt) {
        return Booking.builder()
                .id(1L).bookingCode(CODE).departureId(10L).accountId(100L)
                .passengerCount(2).totalAmount(new BigDecimal("300000.00"))
                .status(BookingStatus.PENDING).expiresAt(expiresAt).build();
    }

    private Departure departure() {
        return Departure.builder()
                .id(10L).routeCode("MRK-BKH").originPort("Merak").destinationPort("Bakauheni")
                .vesselName("KMP Legundi").departureTime(NOW.plusDays(2))
                .totalSeats(5).availableSeats(3).fare(new BigDecimal("150000.00"))
                .status(Departure.DepartureStatus.SCHEDULED).build();
    }

    private Payment payment(PaymentStatus status, String token, LocalDateTime expiredAt) {
        return Payment.builder()
                .id(7L).bookingId(1L).orderId(CODE).amount(new BigDecimal("300000.00"))
                .status(status).attempt(1).gatewayToken(token).expiredAt(expiredAt).build();
    }

    private void stubGateway(String token) {
        when(departureRepository.findById(10L)).thenReturn(Optional.of(departure()));
        when(gatewayAdapter.createTransaction(any())).thenReturn(new SnapTransactionResponse(token, "https://pay/" + token));
        when(paymentRepository.save(any(Payment.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("first intent uses the booking code as order id and never outlives the seat hold")
    void firstIntent_usesBookingCodeAndHoldDeadline() {
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(pendingBooking(NOW.plusMinutes(10))));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.empty());
        stubGateway("tok-1");

        PaymentIntentResponse response = service.createIntent(CODE, OWNER, false);

        assertThat(response.orderId()).isEqualTo(CODE);
        assertThat(response.token()).isEqualTo("tok-1");
        assertThat(response.reused()).isFalse();
        assertThat(response.expiredAt()).isEqualTo(NOW.plusMinutes(10));

        ArgumentCaptor<SnapTransactionRequest> captor = ArgumentCaptor.forClass(SnapTransactionRequest.class);
        verify(gatewayAdapter).createTransaction(captor.capture());
        assertThat(captor.getValue().transactionDetails().grossAmount()).isEqualByComparingTo("300000");
        assertThat(captor.getValue().expiry().duration()).isEqualTo(10);
        assertThat(captor.getValue().itemDetails().get(0).quantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("fares with cents are charged exactly and the line items add up to the gross amount")
    void fareWithCents_chargedExactly() {
        Booking booking = pendingBooking(NOW.plusMinutes(10));
        booking.setPassengerCount(3);
        booking.setTotalAmount(new BigDecimal("31.50"));
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(booking));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.empty());
        when(departureRepository.findById(10L)).thenReturn(Optional.of(departure()));
        when(gatewayAdapter.createTransaction(any())).thenReturn(new SnapTransactionResponse("tok-1", "https://pay/tok-1"));
        ArgumentCaptor<Payment> saved = ArgumentCaptor.forClass(Payment.class);
        when(paymentRepository.save(saved.capture())).thenAnswer(inv -> inv.getArgument(0));

        service.createIntent(CODE, OWNER, false);

        ArgumentCaptor<SnapTransactionRequest> captor = ArgumentCaptor.forClass(SnapTransactionRequest.class);
        verify(gatewayAdapter).createTransaction(captor.capture());
        SnapTransactionRequest request = captor.getValue();
        SnapTransactionRequest.ItemDetail item = request.itemDetails().get(0);
        assertThat(request.transactionDetails().grossAmount()).isEqualByComparingTo("31.50");
        assertThat(item.price()).isEqualByComparingTo("10.50");
        assertThat(item.quantity()).isEqualTo(3);
        assertThat(item.price().multiply(BigDecimal.valueOf(item.quantity())))
                .isEqualByComparingTo(request.transactionDetails().grossAmount());
        assertThat(saved.getValue().getAmount()).isEqualByComparingTo(request.transactionDetails().grossAmount());
    }

    @Test
    void totalThatDoesNotSplitEvenly_isSentAsOneLine() {
        Booking booking = pendingBooking(NOW.plusMinutes(10));
        booking.setPassengerCount(3);
        booking.setTotalAmount(new BigDecimal("100.00"));
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(booking));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.empty());
        stubGateway("tok-1");

        service.createIntent(CODE, OWNER, false);

        ArgumentCaptor<SnapTransactionRequest> captor = ArgumentCaptor.forClass(SnapTransactionRequest.class);
        verify(gatewayAdapter).createTransaction(captor.capture());
        SnapTransactionRequest.ItemDetail item = captor.getValue().itemDetails().get(0);
        assertThat(item.quantity()).isEqualTo(1);
        assertThat(item.price()).isEqualByComparingTo("100.00");
        assertThat(captor.getValue().transactionDetails().grossAmount()).isEqualByComparingTo("100.00");
    }

    @Test
    void validToken_isReusedWithoutCallingGateway() {
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(pendingBooking(NOW.plusMinutes(10))));
        when(paymentRepository.findByBookingIdForUpdate(1L))
                .thenReturn(Optional.of(payment(PaymentStatus.PENDING, "tok-1", NOW.plusMinutes(5))));

        PaymentIntentResponse response = service.createIntent(CODE, OWNER, false);

        assertThat(response.reused()).isTrue();
        assertThat(response.token()).isEqualTo("tok-1");
        verify(gatewayAdapter, never()).createTransaction(any());
    }

    @Test
    void failedAttempt_opensNewOrderWithAttemptSuffix() {
        Payment failed = payment(PaymentStatus.FAILED, "tok-1", NOW.minusMinutes(1));
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(pendingBooking(NOW.plusMinutes(14))));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.of(failed));
        stubGateway("tok-2");

        PaymentIntentResponse response = service.createIntent(CODE, OWNER, false);

        assertThat(response.orderId()).isEqualTo(CODE + "-2");
        assertThat(failed.getAttempt()).isEqualTo(2);
        assertThat(failed.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(failed.getAmount()).isEqualByComparingTo("300000.00");
        verify(gatewayAdapter, never()).cancel(any());
    }

    @Test
    void forcedIntent_cancelsSupersededOpenOrder() {
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(pendingBooking(NOW.plusMinutes(14))));
        when(paymentRepository.findByBookingIdForUpdate(1L))
                .thenReturn(Optional.of(payment(PaymentStatus.PENDING, "tok-1", NOW.plusMinutes(5))));
        stubGateway("tok-2");
        when(gatewayAdapter.cancel(CODE)).thenThrow(new GatewayException("timeout", true));

        PaymentIntentResponse response = service.createIntent(CODE, OWNER, true);

        assertThat(response.orderId()).isEqualTo(CODE + "-2");
        assertThat(response.token()).isEqualTo("tok-2");
        verify(gatewayAdapter).cancel(CODE);
    }

    @Test
    void expiredHold_isRejected() {
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(pendingBooking(NOW.minusSeconds(1))));

        assertThatThrownBy(() -> service.createIntent(CODE, OWNER, false))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("expired");
        verify(gatewayAdapter, never()).createTransaction(any());
    }

    @Test
    void challengedPayment_cannotBeReopened() {
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(pendingBooking(NOW.plusMinutes(10))));
        when(paymentRepository.findByBookingIdForUpdate(1L))
                .thenReturn(Optional.of(payment(PaymentStatus.CHALLENGE, "tok-1", NOW.plusMinutes(5))));

        assertThatThrownBy(() -> service.createIntent(CODE, OWNER, true))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void otherAccount_isForbidden() {
        when(bookingRepository.findByBookingCodeForUpdate(CODE)).thenReturn(Optional.of(pendingBooking(NOW.plusMinutes(10))));

        assertThatThrownBy(() -> service.createIntent(CODE, Actor.of(999L, ActorRole.USER), false))
                .isInstanceOf(ForbiddenActionException.class);
    }
}
