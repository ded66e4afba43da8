package com.codegym.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.dto.dashboard.ActiveMembersDTO;
import com.codegym.backend.dto.dashboard.AdminDashboardSummaryDTO;
import com.codegym.backend.dto.dashboard.PackageMemberCountDTO;
import com.codegym.backend.dto.revenue.RevenueReportDTO;
import com.codegym.backend.entities.Invoice;
import com.codegym.backend.repositories.ExerciseRepository;
import com.codegym.backend.repositories.InvoiceRepository;
import com.codegym.backend.repositories.MemberRepository;
import com.codegym.backend.repositories.MembershipPackageRepository;
import com.codegym.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class AdminDashboardService {

    private final UserRepository userRepository;
    private final MembershipPackageRepository packageRepository;
    private final ExerciseRepository exerciseRepository;
    private final MemberRepository memberRepository;
    private final InvoiceRepository invoiceRepository;
    private final RevenueService revenueService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AdminDashboardSummaryDTO summary() {
        return AdminDashboardSummaryDTO.builder()
                .userCount(userRepository.count())
                .packageCount(packageRepository.count())
                .exerciseCount(exerciseRepository.count())
                .memberCount(memberRepository.count())
                .build();
    }

    public RevenueReportDTO currentYearRevenue() {
        return revenueService.monthlyRevenue(null);
    }

    @Transactional(readOnly = true)
    public ActiveMembersDTO activeMembers() {
        LocalDate today = LocalDate.now(clock);
        return new ActiveMembersDTO(today, memberRepository.countByActiveUntilGreaterThanEqual(today));
    }

    /**
     * Active members grouped by the package on their most recent invoice,
     * largest group first.
     */
    @Transactional(readOnly = true)
    public List<PackageMemberCountDTO> membersPerPackage() {
        LocalDate today = LocalDate.now(clock);

        // two invoices can share the latest timestamp; keep one per member
        Map<UUID, Invoice> latestByMember = new LinkedHashMap<>();
        for (Invoice invoice : invoiceRepository.findLatestInvoicesOfActiveMembers(today)) {
            latestByMember.putIfAbsent(invoice.getMember().getId(), invoice);
        }

        Map<String, Long> counts = latestByMember.values().stream()
                .collect(Collectors.groupingBy(i -> i.getMembershipPackage().getName(), Collectors.counting()));

        return counts.entrySet().stream()
                .map(e -> new PackageMemberCountDTO(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(PackageMemberCountDTO::getMemberCount).reversed()
                        .thenComparing(PackageMemberCountDTO::getPackageName))
                .toList();
    }
}
