package com.ferrybooking.reconciliation.domain.repository;

import com.ferrybooking.reconciliation.domain.model.WebhookAudit;
import com.ferrybooking.reconciliation.domain.model.WebhookOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WebhookAuditRepository extends JpaRepository<WebhookAudit, Long> {

    /** The row that settled a notification key, if any. Later rows for the same key are no-ops. */
    Optional<WebhookAudit> findFirstByNotificationKeyAndOutcomeInOrderByIdAsc(String notificationKey,
                                                                              Collection<WebhookOutcome> outcomes);

    /** Audit trail of every order id a booking has used ({@code <code>} and {@code <code>-<attempt>}). */
    List<WebhookAudit> findByOrderIdStartingWithOrderByIdAsc(String bookingCode);

    @Modifying(flushAutomatically = true)
    @Query("""
           UPDATE WebhookAudit w
           SET w.deliveryCount = w.deliveryCount + 1,
               w.lastDeliveredAt = :now
           WHERE w.id = :id
           """)
    int recordRedelivery(@Param("id") Long id, @Param("now") LocalDateTime now);
}
