package com.ferrybooking.reconciliation.api.controller;

import com.ferrybooking.common.dto.BaseResponse;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.common.security.ActorRole;
import com.ferrybooking.common.util.Constants;
import com.ferrybooking.reconciliation.api.dto.ResyncRequest;
import com.ferrybooking.reconciliation.api.dto.WebhookAuditResponse;
import com.ferrybooking.reconciliation.domain.service.ProcessingResult;
import com.ferrybooking.reconciliation.domain.service.WebhookAuditService;
import com.ferrybooking.reconciliation.domain.service.WebhookReconciler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/payments")
@RequiredArgsConstructor
public class PaymentResyncController {

    private final WebhookReconciler webhookReconciler;
    private final WebhookAuditService webhookAuditService;

    @PostMapping("/resync")
    public ResponseEntity<BaseResponse<ProcessingResult>> resync(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @Valid @RequestBody ResyncRequest request) {
        ProcessingResult result = webhookReconciler.resync(request.bookingCode(), Actor.of(accountId, role));
        return ResponseEntity.ok(BaseResponse.success(result.outcome().name(), result));
    }

    @GetMapping("/{bookingCode}/notifications")
    public ResponseEntity<BaseResponse<List<WebhookAuditResponse>>> notifications(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role,
            @PathVariable String bookingCode) {
        return ResponseEntity.ok(BaseResponse.success(
                webhookAuditService.history(bookingCode, Actor.of(accountId, role))));
    }
}
