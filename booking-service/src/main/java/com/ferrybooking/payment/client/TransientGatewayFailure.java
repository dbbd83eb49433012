package com.ferrybooking.payment.client;

import com.ferrybooking.common.exception.GatewayException;

import java.util.function.Predicate;

/**
 * Retry predicate for the payment-gateway retry instance: only failures the gateway may
 * recover from on its own (timeouts, 5xx) are retried.
 */
public class TransientGatewayFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof GatewayException ge && ge.isTransientFailure();
    }
}
