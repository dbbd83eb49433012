package com.ferrybooking.payment.client;

import com.ferrybooking.common.exception.GatewayException;
import com.ferrybooking.common.exception.ResourceNotFoundException;
import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;
import com.ferrybooking.payment.client.dto.SnapTransactionRequest;
import com.ferrybooking.payment.client.dto.SnapTransactionResponse;
import feign.FeignException;
import feign.Request;
import feign.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentGatewayAdapterTest {

    @Mock
    private GatewaySnapClient snapClient;
    @Mock
    private GatewayCoreClient coreClient;

    private PaymentGatewayAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new PaymentGatewayAdapter(snapClient, coreClient);
    }

    private static FeignException httpError(int status) {
        Request request = Request.create(Request.HttpMethod.GET, "https://gateway.test/v2/FRB-1/status",
                Map.of(), null, StandardCharsets.UTF_8, null);
        Response response = Response.builder()
                .status(status)
                .reason("error")
                .request(request)
                .headers(Map.of())
                .body(new byte[0])
                .build();
        return FeignException.errorStatus("GatewayCoreClient#getStatus(String)", response);
    }

    private static SnapTransactionRequest request(String orderId) {
        return new SnapTransactionRequest(
                new SnapTransactionRequest.TransactionDetails(orderId, BigDecimal.valueOf(300000L)),
                null,
                List.of(new SnapTransactionRequest.ItemDetail("MRK-BKH", BigDecimal.valueOf(150000L), 2, "Merak - Bakauheni")),
                new SnapTransactionRequest.Expiry("2026-10-19 09:00:00 +0700", "minute", 15),
                null);
    }

    @Test
    void createTransaction_returnsToken() {
        when(snapClient.createTransaction(any())).thenReturn(new SnapTransactionResponse("tok-1", "https://pay/tok-1"));

        SnapTransactionResponse response = adapter.createTransaction(request("FRB-1"));

        assertThat(response.token()).isEqualTo("tok-1");
    }

    @Test
    void createTransaction_withoutToken_isPermanentFailure() {
        when(snapClient.createTransaction(any())).thenReturn(new SnapTransactionResponse(" ", null));

        assertThatThrownBy(() -> adapter.createTransaction(request("FRB-1")))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).isTransientFailure()).isFalse());
    }

    @Test
    void serverError_isTransient() {
        when(coreClient.getStatus("FRB-1")).thenThrow(httpError(503));

        assertThatThrownBy(() -> adapter.fetchStatus("FRB-1"))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).isTransientFailure()).isTrue());
    }

    @Test
    void clientError_isNotTransient() {
        when(snapClient.createTransaction(any())).thenThrow(httpError(400));

        assertThatThrownBy(() -> adapter.createTransaction(request("FRB-1")))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).isTransientFailure()).isFalse());
    }

    @Test
    void httpNotFound_isUnknownOrder() {
        when(coreClient.getStatus("FRB-1")).thenThrow(httpError(404));

        assertThatThrownBy(() -> adapter.fetchStatus("FRB-1"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void notFoundStatusCodeInBody_isUnknownOrder() {
        when(coreClient.getStatus("FRB-1")).thenReturn(new GatewayTransactionStatus(
                null, "404", null, null, null, null, null, null, null, "Transaction doesn't exist."));

        assertThatThrownBy(() -> adapter.fetchStatus("FRB-1"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void retryPredicate_onlyAcceptsTransientGatewayFailures() {
        TransientGatewayFailure predicate = new TransientGatewayFailure();

        assertThat(predicate.test(new GatewayException("timeout", true))).isTrue();
        assertThat(predicate.test(new GatewayException("bad request", false))).isFalse();
        assertThat(predicate.test(new ResourceNotFoundException("Gateway transaction", "FRB-1"))).isFalse();
    }
}
