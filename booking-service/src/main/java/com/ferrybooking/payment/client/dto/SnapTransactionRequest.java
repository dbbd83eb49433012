package com.ferrybooking.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Body of the gateway's "create transaction" call. Item price times quantity must add up to {@code gross_amount}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SnapTransactionRequest(
        @JsonProperty("transaction_details") TransactionDetails transactionDetails,
        @JsonProperty("customer_details") CustomerDetails customerDetails,
        @JsonProperty("item_details") List<ItemDetail> itemDetails,
        Expiry expiry,
        Callbacks callbacks
) {
    public record TransactionDetails(
            @JsonProperty("order_id") String orderId,
            @JsonProperty("gross_amount") BigDecimal grossAmount
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CustomerDetails(
            @JsonProperty("first_name") String firstName,
            String phone
    ) {
    }

    public record ItemDetail(
            String id,
            BigDecimal price,
            int quantity,
            String name
    ) {
    }

    /** {@code start_time} uses the gateway's "yyyy-MM-dd HH:mm:ss Z" format. */
    public record Expiry(
            @JsonProperty("start_time") String startTime,
            String unit,
            int duration
    ) {
    }

    public record Callbacks(String finish) {
    }
}
