package com.codegym.backend.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.codegym.backend.dto.dashboard.ActiveMembersDTO;
import com.codegym.backend.dto.dashboard.PackageMemberCountDTO;
import com.codegym.backend.entities.Invoice;
import com.codegym.backend.entities.Member;
import com.codegym.backend.entities.MembershipPackage;
import com.codegym.backend.repositories.ExerciseRepository;
import com.codegym.backend.repositories.InvoiceRepository;
import com.codegym.backend.repositories.MemberRepository;
import com.codegym.backend.repositories.MembershipPackageRepository;
import com.codegym.backend.repositories.UserRepository;

@ExtendWith(MockitoExtension.class)
class AdminDashboardServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Mock
    private UserRepository userRepository;

    @Mock
    private MembershipPackageRepository packageRepository;

    @Mock
    private ExerciseRepository exerciseRepository;

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private InvoiceRepository invoiceRepository;

    @Mock
    private RevenueService revenueService;

    private AdminDashboardService dashboardService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T03:00:00Z"), ZoneId.of("Asia/Ho_Chi_Minh"));
        dashboardService = new AdminDashboardService(userRepository, packageRepository, exerciseRepository,
                memberRepository, invoiceRepository, revenueService, clock);
    }

    private static MembershipPackage pkg(String name) {
        MembershipPackage p = new MembershipPackage();
        p.setId(UUID.randomUUID());
        p.setName(name);
        p.setDurationMonths(1);
        p.setPrice(BigDecimal.ONE);
        return p;
    }

    private static Invoice invoice(Member member, MembershipPackage pkg) {
        Invoice invoice = new Invoice();
        invoice.setMember(member);
        invoice.setMembershipPackage(pkg);
        invoice.setAmount(pkg.getPrice());
        invoice.setCreatedAt(LocalDateTime.of(2024, 3, 1, 9, 0));
        return invoice;
    }

    private static Member member() {
        Member m = new Member();
        m.setId(UUID.randomUUID());
        return m;
    }

    @Test
    void activeMembers_countsAgainstToday() {
        when(memberRepository.countByActiveUntilGreaterThanEqual(TODAY)).thenReturn(42L);

        ActiveMembersDTO dto = dashboardService.activeMembers();

        assertEquals(TODAY, dto.getAsOf());
        assertEquals(42L, dto.getActiveMembers());
    }

    @Test
    void membersPerPackage_groupsByLatestInvoiceLargestFirst() {
        MembershipPackage monthly = pkg("1 Month");
        MembershipPackage yearly = pkg("12 Months");
        MembershipPackage quarterly = pkg("3 Months");

        Member a = member();
        Member b = member();
        Member c = member();
        Member d = member();

        when(invoiceRepository.findLatestInvoicesOfActiveMembers(TODAY)).thenReturn(List.of(
                invoice(a, yearly),
                invoice(b, yearly),
                invoice(c, monthly),
                invoice(d, quarterly),
                // same timestamp as the member's other latest invoice; counted once
                invoice(a, monthly)
        ));

        List<PackageMemberCountDTO> counts = dashboardService.membersPerPackage();

        assertEquals(3, counts.size());
        assertEquals(new PackageMemberCountDTO("12 Months", 2), counts.get(0));
        assertEquals(new PackageMemberCountDTO("1 Month", 1), counts.get(1));
        assertEquals(new PackageMemberCountDTO("3 Months", 1), counts.get(2));
    }
}
