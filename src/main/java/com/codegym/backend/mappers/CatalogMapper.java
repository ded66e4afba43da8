package com.codegym.backend.mappers;

import com.codegym.backend.dto.catalog.ExerciseRequestDTO;
import com.codegym.backend.dto.catalog.ExerciseResponseDTO;
import com.codegym.backend.dto.catalog.MembershipPackageRequestDTO;
import com.codegym.backend.dto.catalog.MembershipPackageResponseDTO;
import com.codegym.backend.entities.Exercise;
import com.codegym.backend.entities.MembershipPackage;
import com.codegym.backend.services.util.CurrencyFormatter;

/**
 * Packages and exercises, the two admin-maintained catalogs.
 */
public class CatalogMapper {

    private CatalogMapper() {
    }

    // copies request fields onto an existing or new entity
    public static void apply(MembershipPackageRequestDTO dto, MembershipPackage target) {
        target.setName(dto.getName().trim());
        target.setDurationMonths(dto.getDurationMonths());
        target.setPrice(dto.getPrice());
        target.setDescription(trimToNull(dto.getDescription()));
    }

    public static MembershipPackageResponseDTO toResponseDTO(MembershipPackage p) {
        if (p == null) return null;

        MembershipPackageResponseDTO dto = new MembershipPackageResponseDTO();
        dto.setId(p.getId() != null ? p.getId().toString() : null);
        dto.setName(p.getName());
        dto.setDurationMonths(p.getDurationMonths());
        dto.setPrice(p.getPrice());
        dto.setFormattedPrice(CurrencyFormatter.formatVnd(p.getPrice()));
        dto.setDescription(p.getDescription());
        return dto;
    }

    public static void apply(ExerciseRequestDTO dto, Exercise target) {
        target.setName(dto.getName().trim());
        target.setDescription(trimToNull(dto.getDescription()));
        target.setBodyPart(trimToNull(dto.getBodyPart()));
    }

    public static ExerciseResponseDTO toResponseDTO(Exercise e) {
        if (e == null) return null;

        ExerciseResponseDTO dto = new ExerciseResponseDTO();
        dto.setId(e.getId() != null ? e.getId().toString() : null);
        dto.setName(e.getName());
        dto.setDescription(e.getDescription());
        dto.setBodyPart(e.getBodyPart());
        return dto;
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
