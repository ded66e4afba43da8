package com.codegym.backend.dto.member;

import java.time.LocalDate;
import java.time.LocalDateTime;

import lombok.Data;

@Data
public class MemberResponseDTO {
    private String id;
    private String fullName;
    private String gender;
    private LocalDate birthDate;
    private String phone;
    private String email;
    private LocalDateTime registrationDate;
    private LocalDate activeUntil;
    private boolean active;
}
