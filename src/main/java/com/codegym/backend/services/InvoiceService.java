package com.codegym.backend.services;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.dto.invoice.InvoiceResponseDTO;
import com.codegym.backend.exceptions.BadRequestException;
import com.codegym.backend.mappers.InvoiceMapper;
import com.codegym.backend.repositories.InvoiceRepository;
import com.codegym.backend.services.util.EntityIds;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;

    /**
     * Invoice history, newest first. Every filter is optional; dates are
     * {@code yyyy-MM-dd} and the end date includes the whole day.
     */
    @Transactional(readOnly = true)
    public List<InvoiceResponseDTO> search(String memberId, String startDate, String endDate) {
        UUID member = EntityIds.parseOptional(memberId, "member id");
        LocalDate start = parseDate(startDate, "start date");
        LocalDate end = parseDate(endDate, "end date");

        if (start != null && end != null && start.isAfter(end)) {
            throw new BadRequestException("Start date must not be after end date");
        }

        LocalDateTime from = start != null ? start.atStartOfDay() : null;
        // half-open so no sub-second end time reaches the database
        LocalDateTime until = end != null ? end.plusDays(1).atStartOfDay() : null;

        return invoiceRepository.search(member, from, until).stream()
                .map(InvoiceMapper::toResponseDTO)
                .toList();
    }

    private LocalDate parseDate(String raw, String label) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new BadRequestException("Invalid " + label + " '" + raw + "', expected yyyy-MM-dd");
        }
    }
}
