package com.ferrybooking.reconciliation.api.controller;

import com.ferrybooking.common.dto.BaseResponse;
import com.ferrybooking.reconciliation.domain.service.ProcessingResult;
import com.ferrybooking.reconciliation.domain.service.WebhookReconciler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway callback. Authenticated by the payload signature, not by caller headers. The body is
 * taken as a raw string so the audit keeps exactly what was delivered.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentNotificationController {

    private final WebhookReconciler webhookReconciler;

    @PostMapping(value = "/notifications", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BaseResponse<ProcessingResult>> receive(@RequestBody String rawPayload) {
        ProcessingResult result = webhookReconciler.ingest(rawPayload);
        return ResponseEntity.ok(BaseResponse.success(result.outcome().name(), result));
    }
}
