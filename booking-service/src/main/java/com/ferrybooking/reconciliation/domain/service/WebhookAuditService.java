package com.ferrybooking.reconciliation.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ferrybooking.common.exception.ReplayDetectedException;
import com.ferrybooking.common.exception.ServiceUnavailableException;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.common.util.Constants;
import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;
import com.ferrybooking.reconciliation.api.dto.WebhookAuditResponse;
import com.ferrybooking.reconciliation.domain.model.NotificationSource;
import com.ferrybooking.reconciliation.domain.model.WebhookAudit;
import com.ferrybooking.reconciliation.domain.model.WebhookOutcome;
import com.ferrybooking.reconciliation.domain.repository.WebhookAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Webhook audit store and replay guard. The database row is the source of truth; Redis only
 * short-cuts the lookup for settled notifications and is skipped when absent or failing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookAuditService {

    private static final int MAX_MESSAGE_LENGTH = 500;
    private static final int MAX_ID_LENGTH = 64;
    private static final int MAX_STATUS_LENGTH = 32;
    private static final int MAX_STATUS_CODE_LENGTH = 8;
    private static final int MAX_AMOUNT_LENGTH = 32;

    private final WebhookAuditRepository webhookAuditRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${reconciliation.replay-cache.redis-enabled:true}")
    private boolean redisEnabled = true;

    @Value("${reconciliation.replay-cache.ttl-hours:72}")
    private long redisTtlHours = 72;

    /**
     * Throws {@link ReplayDetectedException} carrying the earlier {@link ProcessingResult} when the
     * key was already settled, after counting the redelivery on the settling row. The redelivery
     * count commits even though the call ends with that exception.
     */
    @Transactional(noRollbackFor = ReplayDetectedException.class)
    public void assertNotReplayed(String notificationKey) {
        Optional<ProcessingResult> previous = readFromRedis(notificationKey)
                .or(() -> readFromDb(notificationKey));
        if (previous.isEmpty()) {
            return;
        }
        ProcessingResult result = previous.get();
        if (result.auditId() != null) {
            webhookAuditRepository.recordRedelivery(result.auditId(), LocalDateTime.now(clock));
        }
        log.warn("Replayed notification {} for order {}, returning recorded {}",
                notificationKey, result.orderId(), result.outcome());
        throw new ReplayDetectedException("Notification already processed", result.asReplay());
    }

    /**
     * Stores the audit row inside the caller's transaction, so a settled outcome commits
     * together with the state change it describes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ProcessingResult record(AuditEntry entry, ProcessingResult result) {
        WebhookAudit audit = webhookAuditRepository.save(entry.toAudit(result, LocalDateTime.now(clock)));
        ProcessingResult stored = result.withAuditId(audit.getId());
        audit.setResultJson(toJson(stored));
        if (result.outcome().isSettled() && entry.notificationKey() != null) {
            warmRedisAfterCommit(entry.notificationKey(), audit.getResultJson());
        }
        return stored;
    }

    /**
     * Audits a notification that was turned away before or outside the state-changing
     * transaction (bad signature, unreadable body, unexpected failure).
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ProcessingResult recordRejection(AuditEntry entry, ProcessingResult result) {
        return record(entry, result);
    }

    @Transactional(readOnly = true)
    public List<WebhookAuditResponse> history(String bookingCode, Actor actor) {
        actor.requireAdmin();
        return webhookAuditRepository.findByOrderIdStartingWithOrderByIdAsc(bookingCode).stream()
                .map(WebhookAuditResponse::from)
                .toList();
    }

    private Optional<ProcessingResult> readFromRedis(String notificationKey) {
        if (!redisEnabled || stringRedisTemplate == null) {
            return Optional.empty();
        }
        try {
            String json = stringRedisTemplate.opsForValue().get(Constants.REDIS_SETTLED_NOTIFICATION_PREFIX + notificationKey);
            if (json != null) {
                log.debug("Replay cache hit in Redis for {}", notificationKey);
                return Optional.of(objectMapper.readValue(json, ProcessingResult.class));
            }
        } catch (Exception e) {
            log.debug("Redis replay lookup missed or failed, falling back to DB: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<ProcessingResult> readFromDb(String notificationKey) {
        try {
            return webhookAuditRepository
                    .findFirstByNotificationKeyAndOutcomeInOrderByIdAsc(notificationKey, WebhookOutcome.SETTLED)
                    .map(this::storedResult);
        } catch (DataAccessException e) {
            log.warn("Webhook audit store unavailable for {}", notificationKey, e);
            throw new ServiceUnavailableException("Notification store temporarily unavailable, please redeliver", e);
        }
    }

    private ProcessingResult storedResult(WebhookAudit audit) {
        if (audit.getResultJson() != null) {
            try {
                return objectMapper.readValue(audit.getResultJson(), ProcessingResult.class);
            } catch (JsonProcessingException e) {
                log.warn("Unreadable stored result on audit {}, rebuilding from columns", audit.getId());
            }
        }
        return new ProcessingResult(audit.getId(), audit.getOrderId(), audit.getOutcome(),
                null, null, 0, audit.getMessage(), false);
    }

    private void warmRedisAfterCommit(String notificationKey, String json) {
        if (!redisEnabled || stringRedisTemplate == null || json == null) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    stringRedisTemplate.opsForValue().set(Constants.REDIS_SETTLED_NOTIFICATION_PREFIX + notificationKey,
                            json, Duration.ofHours(redisTtlHours));
                } catch (Exception e) {
                    log.warn("Failed to warm Redis replay cache for {} (non-fatal)", notificationKey, e);
                }
            }
        });
    }

    private String toJson(ProcessingResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize processing result for order {}", result.orderId());
            return null;
        }
    }

    /**
     * What is known about a notification when its audit row is written.
     */
    public record AuditEntry(
            String notificationKey,
            GatewayTransactionStatus notification,
            String rawPayload,
            NotificationSource source,
            boolean signatureValid
    ) {
        WebhookAudit toAudit(ProcessingResult result, LocalDateTime now) {
            GatewayTransactionStatus n = notification;
            // Gateway fields are untrusted; the column copies are clipped, raw_payload keeps the full text.
            return WebhookAudit.builder()
                    .notificationKey(notificationKey)
                    .orderId(clip(n == null ? result.orderId() : n.orderId(), MAX_ID_LENGTH))
                    .transactionId(clip(n == null ? null : n.transactionId(), MAX_ID_LENGTH))
                    .transactionStatus(clip(n == null ? null : n.transactionStatus(), MAX_STATUS_LENGTH))
                    .fraudStatus(clip(n == null ? null : n.fraudStatus(), MAX_STATUS_LENGTH))
                    .statusCode(clip(n == null ? null : n.statusCode(), MAX_STATUS_CODE_LENGTH))
                    .grossAmount(clip(n == null ? null : n.grossAmount(), MAX_AMOUNT_LENGTH))
                    .source(source)
                    .signatureValid(signatureValid)
                    .outcome(result.outcome())
                    .message(clip(result.message(), MAX_MESSAGE_LENGTH))
                    .rawPayload(rawPayload)
                    .deliveryCount(1)
                    .receivedAt(now)
                    .build();
        }

        private static String clip(String value, int max) {
            return value != null && value.length() > max ? value.substring(0, max) : value;
        }
    }
}
