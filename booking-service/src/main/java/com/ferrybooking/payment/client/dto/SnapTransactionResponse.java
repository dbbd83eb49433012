package com.ferrybooking.payment.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapTransactionResponse(
        String token,
        @JsonProperty("redirect_url") String redirectUrl
) {
}
