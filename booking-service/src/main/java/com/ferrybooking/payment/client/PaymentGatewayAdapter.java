package com.ferrybooking.payment.client;

import com.ferrybooking.common.exception.GatewayException;
import com.ferrybooking.common.exception.ResourceNotFoundException;
import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;
import com.ferrybooking.payment.client.dto.SnapTransactionRequest;
import com.ferrybooking.payment.client.dto.SnapTransactionResponse;
import feign.FeignException;
import feign.RetryableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single entry point to the payment gateway. Translates transport failures into
 * {@link GatewayException}, flagged transient when a later attempt may succeed.
 * <p>
 * Transaction creation is never retried here: a timed-out create may still have opened the
 * order on the gateway side, and the caller decides whether to start a new attempt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGatewayAdapter {

    private static final String GATEWAY = "payment-gateway";

    private final GatewaySnapClient snapClient;
    private final GatewayCoreClient coreClient;

    @CircuitBreaker(name = GATEWAY, fallbackMethod = "createTransactionUnavailable")
    public SnapTransactionResponse createTransaction(SnapTransactionRequest request) {
        String orderId = request.transactionDetails().orderId();
        SnapTransactionResponse response;
        try {
            response = snapClient.createTransaction(request);
        } catch (FeignException e) {
            throw translate("create transaction for " + orderId, e);
        }
        if (response == null || response.token() == null || response.token().isBlank()) {
            throw new GatewayException("Payment gateway returned no token for order " + orderId, false);
        }
        log.info("Gateway transaction created for order {}", orderId);
        return response;
    }

    /**
     * Current status of an order. Unknown orders surface as {@link ResourceNotFoundException},
     * whether the gateway answers with HTTP 404 or with status_code "404" in the body.
     */
    @Retry(name = GATEWAY)
    @CircuitBreaker(name = GATEWAY, fallbackMethod = "fetchStatusUnavailable")
    public GatewayTransactionStatus fetchStatus(String orderId) {
        GatewayTransactionStatus status;
        try {
            status = coreClient.getStatus(orderId);
        } catch (FeignException.NotFound e) {
            throw new ResourceNotFoundException("Gateway transaction", orderId);
        } catch (FeignException e) {
            throw translate("fetch status of " + orderId, e);
        }
        if (status == null) {
            throw new GatewayException("Payment gateway returned an empty status for order " + orderId, true);
        }
        if ("404".equals(status.statusCode())) {
            throw new ResourceNotFoundException("Gateway transaction", orderId);
        }
        return status;
    }

    @Retry(name = GATEWAY)
    @CircuitBreaker(name = GATEWAY, fallbackMethod = "cancelUnavailable")
    public GatewayTransactionStatus cancel(String orderId) {
        try {
            GatewayTransactionStatus status = coreClient.cancel(orderId);
            log.info("Gateway order {} cancelled", orderId);
            return status;
        } catch (FeignException.NotFound e) {
            throw new ResourceNotFoundException("Gateway transaction", orderId);
        } catch (FeignException e) {
            throw translate("cancel " + orderId, e);
        }
    }

    private GatewayException translate(String action, FeignException e) {
        boolean transientFailure = e instanceof RetryableException || e.status() >= 500 || e.status() == 429;
        log.warn("Payment gateway failed to {}: HTTP {} (transient={})", action, e.status(), transientFailure);
        return new GatewayException("Payment gateway failed to " + action, e, transientFailure);
    }

    private SnapTransactionResponse createTransactionUnavailable(SnapTransactionRequest request, CallNotPermittedException e) {
        throw circuitOpen();
    }

    private GatewayTransactionStatus fetchStatusUnavailable(String orderId, CallNotPermittedException e) {
        throw circuitOpen();
    }

    private GatewayTransactionStatus cancelUnavailable(String orderId, CallNotPermittedException e) {
        throw circuitOpen();
    }

    private GatewayException circuitOpen() {
        log.warn("Payment gateway circuit is open, failing fast");
        return new GatewayException("Payment gateway is temporarily unavailable, please retry shortly", true);
    }
}
