package com.ferrybooking.booking.api.controller;

import com.ferrybooking.booking.job.ExpirySweeper;
import com.ferrybooking.booking.job.SweepSummary;
import com.ferrybooking.common.dto.BaseResponse;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.common.security.ActorRole;
import com.ferrybooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for an external scheduler (cron) to run the expiry sweep on demand.
 */
@RestController
@RequestMapping("/api/v1/admin/maintenance")
@RequiredArgsConstructor
public class MaintenanceController {

    private final ExpirySweeper expirySweeper;

    @PostMapping("/expire-bookings")
    public ResponseEntity<BaseResponse<SweepSummary>> expireBookings(
            @RequestHeader(Constants.HEADER_ACCOUNT_ID) Long accountId,
            @RequestHeader(value = Constants.HEADER_ACCOUNT_ROLE, defaultValue = "USER") ActorRole role) {
        Actor.of(accountId, role).requireAdmin();
        return ResponseEntity.ok(BaseResponse.success("Expiry sweep finished", expirySweeper.sweep()));
    }
}
