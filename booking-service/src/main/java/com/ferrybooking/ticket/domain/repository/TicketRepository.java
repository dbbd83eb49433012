package com.ferrybooking.ticket.domain.repository;

import com.ferrybooking.ticket.domain.model.Ticket;
import com.ferrybooking.ticket.domain.model.TicketStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface TicketRepository extends JpaRepository<Ticket, Long> {

    Optional<Ticket> findByTicketCode(String ticketCode);

    List<Ticket> findByBookingIdOrderByIdAsc(Long bookingId);

    boolean existsByTicketCode(String ticketCode);

    long countByBookingIdAndStatus(Long bookingId, TicketStatus status);

    /**
     * VALID to USED, conditioned on the ticket still being VALID. Of two concurrent scans
     * of one code exactly one gets 1 back. Clears the persistence context so a following
     * read sees the winner's check-in stamp.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           UPDATE Ticket t
           SET t.status = com.ferrybooking.ticket.domain.model.TicketStatus.USED,
               t.checkedInAt = :now,
               t.checkedInBy = :operatorId,
               t.updatedAt = :now
           WHERE t.ticketCode = :ticketCode
             AND t.status = com.ferrybooking.ticket.domain.model.TicketStatus.VALID
           """)
    int markUsedIfValid(@Param("ticketCode") String ticketCode,
                        @Param("operatorId") Long operatorId,
                        @Param("now") LocalDateTime now);

    /**
     * VALID to CANCELLED for every ticket of a booking. USED tickets stay USED.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
           UPDATE Ticket t
           SET t.status = com.ferrybooking.ticket.domain.model.TicketStatus.CANCELLED,
               t.updatedAt = :now
           WHERE t.bookingId = :bookingId
             AND t.status = com.ferrybooking.ticket.domain.model.TicketStatus.VALID
           """)
    int cancelValidTickets(@Param("bookingId") Long bookingId, @Param("now") LocalDateTime now);
}
