package com.codegym.backend.services;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.audit.Auditable;
import com.codegym.backend.dto.member.MemberRegistrationRequestDTO;
import com.codegym.backend.dto.member.MemberRegistrationResponseDTO;
import com.codegym.backend.dto.member.MemberResponseDTO;
import com.codegym.backend.email.events.MemberRegisteredEvent;
import com.codegym.backend.entities.Invoice;
import com.codegym.backend.entities.Member;
import com.codegym.backend.entities.MembershipPackage;
import com.codegym.backend.exceptions.ResourceNotFoundException;
import com.codegym.backend.exceptions.ValidationErrorsException;
import com.codegym.backend.mappers.InvoiceMapper;
import com.codegym.backend.mappers.MemberMapper;
import com.codegym.backend.repositories.MemberRepository;
import com.codegym.backend.repositories.MembershipPackageRepository;
import com.codegym.backend.services.membership.MembershipExtension;
import com.codegym.backend.services.util.EntityIds;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class MemberService {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final MemberRepository memberRepository;
    private final MembershipPackageRepository packageRepository;
    private final MembershipExtension membershipExtension;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<MemberResponseDTO> listMembers() {
        LocalDate today = LocalDate.now(clock);
        return memberRepository.findAllByOrderByRegistrationDateDesc().stream()
                .map(m -> MemberMapper.toResponseDTO(m, today))
                .toList();
    }

    public Member findById(String id) {
        UUID uuid = EntityIds.parseExisting(id, "Member");
        return memberRepository.findById(uuid)
                .orElseThrow(() -> new ResourceNotFoundException("Member not found"));
    }

    /**
     * Stores a new member together with the invoice for the chosen package.
     * All form problems are collected and reported at once; nothing is
     * written unless the form is clean. The confirmation email goes out
     * after commit and cannot fail the registration.
     */
    @Auditable(action = "MEMBER_REGISTERED", entityType = "Member")
    @Transactional
    public MemberRegistrationResponseDTO register(MemberRegistrationRequestDTO request) {
        List<String> errors = new ArrayList<>();

        String fullName = required(request.getFullName(), "Full name is required", errors);
        String gender = required(request.getGender(), "Gender is required", errors);
        String rawBirthDate = required(request.getBirthDate(), "Date of birth is required", errors);
        String phone = required(request.getPhone(), "Phone is required", errors);
        String rawEmail = required(request.getEmail(), "Email is required", errors);
        String rawPackageId = required(request.getPackageId(), "Package is required", errors);

        LocalDate today = LocalDate.now(clock);

        LocalDate birthDate = null;
        if (rawBirthDate != null) {
            try {
                birthDate = LocalDate.parse(rawBirthDate);
                if (birthDate.isAfter(today)) {
                    errors.add("Date of birth cannot be in the future");
                }
            } catch (DateTimeParseException e) {
                errors.add("Date of birth must use the yyyy-MM-dd format");
            }
        }

        String email = rawEmail == null ? null : rawEmail.toLowerCase(Locale.ROOT);
        if (email != null) {
            if (!EMAIL_PATTERN.matcher(email).matches()) {
                errors.add("Email is invalid");
            } else if (memberRepository.existsByEmailIgnoreCase(email)) {
                errors.add("Email is already registered");
            }
        }

        MembershipPackage pkg = null;
        if (rawPackageId != null) {
            pkg = findPackage(rawPackageId).orElse(null);
            if (pkg == null) {
                errors.add("Selected package does not exist");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationErrorsException(errors);
        }

        LocalDateTime now = LocalDateTime.now(clock);

        Member member = new Member();
        member.setFullName(fullName);
        member.setGender(gender);
        member.setBirthDate(birthDate);
        member.setPhone(phone);
        member.setEmail(email);
        member.setRegistrationDate(now);
        member.setActiveUntil(membershipExtension.extend(null, pkg.getDurationMonths(), today));

        Invoice invoice = new Invoice();
        invoice.setMember(member);
        invoice.setMembershipPackage(pkg);
        invoice.setAmount(pkg.getPrice());
        invoice.setCreatedAt(now);
        member.getInvoices().add(invoice);

        Member saved = memberRepository.save(member);
        log.info("Member {} registered with package '{}', active until {}",
                saved.getId(), pkg.getName(), saved.getActiveUntil());

        eventPublisher.publishEvent(new MemberRegisteredEvent(
                saved.getId(),
                saved.getFullName(),
                saved.getEmail(),
                pkg.getName(),
                pkg.getDurationMonths(),
                invoice.getAmount(),
                saved.getActiveUntil()
        ));

        return new MemberRegistrationResponseDTO(
                MemberMapper.toResponseDTO(saved, today),
                InvoiceMapper.toResponseDTO(invoice)
        );
    }

    private Optional<MembershipPackage> findPackage(String rawId) {
        try {
            return packageRepository.findById(UUID.fromString(rawId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String required(String value, String message, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(message);
            return null;
        }
        return value.trim();
    }
}
