package com.ferrybooking.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Transaction status as the gateway reports it, both in HTTP notifications and in answers
 * to a status query. Every field is a string on the wire, including the amount.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayTransactionStatus(
        @JsonProperty("order_id") String orderId,
        @JsonProperty("status_code") String statusCode,
        @JsonProperty("gross_amount") String grossAmount,
        @JsonProperty("signature_key") String signatureKey,
        @JsonProperty("transaction_status") String transactionStatus,
        @JsonProperty("fraud_status") String fraudStatus,
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("payment_type") String paymentType,
        @JsonProperty("transaction_time") String transactionTime,
        @JsonProperty("status_message") String statusMessage
) {
}
