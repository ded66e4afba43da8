package com.codegym.backend.mappers;

import java.time.LocalDate;

import com.codegym.backend.dto.member.MemberResponseDTO;
import com.codegym.backend.dto.plan.TrainerMemberDTO;
import com.codegym.backend.entities.Member;

public class MemberMapper {

    private MemberMapper() {
    }

    public static MemberResponseDTO toResponseDTO(Member m, LocalDate today) {
        if (m == null) return null;

        MemberResponseDTO dto = new MemberResponseDTO();
        dto.setId(m.getId() != null ? m.getId().toString() : null);
        dto.setFullName(m.getFullName());
        dto.setGender(m.getGender());
        dto.setBirthDate(m.getBirthDate());
        dto.setPhone(m.getPhone());
        dto.setEmail(m.getEmail());
        dto.setRegistrationDate(m.getRegistrationDate());
        dto.setActiveUntil(m.getActiveUntil());
        dto.setActive(m.isActiveOn(today));
        return dto;
    }

    public static TrainerMemberDTO toTrainerDTO(Member m, LocalDate today, long planCount) {
        if (m == null) return null;

        TrainerMemberDTO dto = new TrainerMemberDTO();
        dto.setId(m.getId().toString());
        dto.setFullName(m.getFullName());
        dto.setEmail(m.getEmail());
        dto.setPhone(m.getPhone());
        dto.setActiveUntil(m.getActiveUntil());
        dto.setActive(m.isActiveOn(today));
        dto.setPlanCount(planCount);
        dto.setHasPlan(planCount > 0);
        return dto;
    }
}
