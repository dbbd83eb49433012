package com.ferrybooking.payment.client;

import com.ferrybooking.payment.client.dto.SnapTransactionRequest;
import com.ferrybooking.payment.client.dto.SnapTransactionResponse;
import com.ferrybooking.payment.config.GatewayFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Hosted checkout endpoint of the payment gateway: turns an order into a payment token.
 */
@FeignClient(name = "payment-gateway-snap", url = "${payment.gateway.snap-url}", configuration = GatewayFeignConfig.class)
public interface GatewaySnapClient {

    @PostMapping("/snap/v1/transactions")
    SnapTransactionResponse createTransaction(@RequestBody SnapTransactionRequest request);
}
