package com.ferrybooking.payment.client;

import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;
import com.ferrybooking.payment.config.GatewayFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;

/**
 * Core API of the payment gateway, used for status queries and cancelling open orders.
 */
@FeignClient(name = "payment-gateway-core", url = "${payment.gateway.api-url}", configuration = GatewayFeignConfig.class)
public interface GatewayCoreClient {

    @GetMapping("/v2/{orderId}/status")
    GatewayTransactionStatus getStatus(@PathVariable("orderId") String orderId);

    @PostMapping("/v2/{orderId}/cancel")
    GatewayTransactionStatus cancel(@PathVariable("orderId") String orderId);
}
