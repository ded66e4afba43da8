package com.codegym.backend.repositories;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.codegym.backend.entities.Invoice;
import com.codegym.backend.services.revenue.RevenueEntry;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

    @Query("""
            SELECT i FROM Invoice i
            JOIN FETCH i.member m
            JOIN FETCH i.membershipPackage p
            WHERE (:memberId IS NULL OR m.id = :memberId)
            AND (cast(:start as timestamp) IS NULL OR i.createdAt >= :start)
            AND (cast(:endExclusive as timestamp) IS NULL OR i.createdAt < :endExclusive)
            ORDER BY i.createdAt DESC
            """)
    List<Invoice> search(
            @Param("memberId") UUID memberId,
            @Param("start") LocalDateTime start,
            @Param("endExclusive") LocalDateTime endExclusive
    );

    @Query("""
            SELECT new com.codegym.backend.services.revenue.RevenueEntry(i.amount, i.createdAt)
            FROM Invoice i
            WHERE i.createdAt >= :start AND i.createdAt < :end
            """)
    List<RevenueEntry> findRevenueEntries(
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    boolean existsByMembershipPackageId(UUID packageId);

    long countByMemberId(UUID memberId);

    // most recent invoice of every member still active on the given day
    @Query("""
            SELECT i FROM Invoice i
            JOIN FETCH i.membershipPackage p
            JOIN FETCH i.member m
            WHERE m.activeUntil >= :today
            AND i.createdAt = (
                SELECT max(i2.createdAt) FROM Invoice i2 WHERE i2.member = i.member
            )
            """)
    List<Invoice> findLatestInvoicesOfActiveMembers(@Param("today") LocalDate today);
}
