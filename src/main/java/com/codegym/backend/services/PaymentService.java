package com.codegym.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.audit.Auditable;
import com.codegym.backend.dto.payment.PaymentRequestDTO;
import com.codegym.backend.dto.payment.PaymentResponseDTO;
import com.codegym.backend.entities.Invoice;
import com.codegym.backend.entities.Member;
import com.codegym.backend.entities.MembershipPackage;
import com.codegym.backend.mappers.InvoiceMapper;
import com.codegym.backend.repositories.InvoiceRepository;
import com.codegym.backend.repositories.MemberRepository;
import com.codegym.backend.services.membership.MembershipExtension;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final MemberService memberService;
    private final MembershipPackageService packageService;
    private final MemberRepository memberRepository;
    private final InvoiceRepository invoiceRepository;
    private final MembershipExtension membershipExtension;
    private final Clock clock;

    /**
     * Sells a package to an existing member: one new invoice at the package
     * price and the membership extended from its current expiry, or from
     * today if it has lapsed. Both writes commit together.
     */
    @Auditable(action = "PAYMENT_RECORDED", entityType = "Invoice")
    @Transactional
    public PaymentResponseDTO recordPayment(PaymentRequestDTO request) {
        Member member = memberService.findById(request.getMemberId());
        MembershipPackage pkg = packageService.findById(request.getPackageId());

        LocalDate today = LocalDate.now(clock);
        LocalDate previous = member.getActiveUntil();
        LocalDate extended = membershipExtension.extend(previous, pkg.getDurationMonths(), today);

        Invoice invoice = new Invoice();
        invoice.setMember(member);
        invoice.setMembershipPackage(pkg);
        invoice.setAmount(pkg.getPrice());
        invoice.setCreatedAt(LocalDateTime.now(clock));
        Invoice saved = invoiceRepository.save(invoice);

        member.setActiveUntil(extended);
        memberRepository.save(member);

        log.info("Payment for member {}: package '{}', active until {} -> {}",
                member.getId(), pkg.getName(), previous, extended);

        return PaymentResponseDTO.builder()
                .invoice(InvoiceMapper.toResponseDTO(saved))
                .previousActiveUntil(previous)
                .activeUntil(extended)
                .build();
    }
}
