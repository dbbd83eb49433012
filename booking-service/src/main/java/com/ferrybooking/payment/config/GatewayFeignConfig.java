package com.ferrybooking.payment.config;

import feign.auth.BasicAuthRequestInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;

/**
 * Per-client Feign configuration for the payment gateway. Not a {@code @Configuration}:
 * the server key must only be attached to gateway clients.
 */
public class GatewayFeignConfig {

    @Bean
    public BasicAuthRequestInterceptor gatewayBasicAuth(@Value("${payment.gateway.server-key}") String serverKey) {
        return new BasicAuthRequestInterceptor(serverKey, "");
    }
}
