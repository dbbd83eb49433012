package com.ferrybooking.payment.api.controller;

import com.ferrybooking.common.dto.BaseResponse;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.common.security.ActorRole;
import com.ferrybooking.common.util.Constants;
import com.ferrybooking.payment.api.dto.CreatePaymentIntentRequest;
import com.ferrybooking.payment.api.dto.PaymentIntentResponse;
import com.ferrybooking.payment.api.dto.PaymentResponse;
import com.ferrybooking.payment.domain.service.PaymentIntentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentIntentService paymentIntentService;

    @PostMapping("/intents")
    public ResponseEntity<BaseResponse<PaymentIntentResponse>> createIntent(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @Valid @RequestBody CreatePaymentIntentRequest request) {
        PaymentIntentResponse response = paymentIntentService.createIntent(
                request.bookingCode(), Actor.of(accountId, role), request.force());
        return ResponseEntity.ok(BaseResponse.success(
                response.reused() ? "Existing payment session returned" : "Payment session created", response));
    }

    @GetMapping("/{bookingCode}")
    public ResponseEntity<BaseResponse<PaymentResponse>> getPayment(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @PathVariable String bookingCode) {
        return ResponseEntity.ok(BaseResponse.success(
                paymentIntentService.getPayment(bookingCode, Actor.of(accountId, role))));
    }
}
