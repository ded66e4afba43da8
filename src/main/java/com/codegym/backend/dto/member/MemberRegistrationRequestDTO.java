package com.codegym.backend.dto.member;

import lombok.Data;

/**
 * Registration form. Fields are checked together by the service so that
 * every problem is reported in one response; the birth date arrives as text
 * in {@code yyyy-MM-dd} form.
 */
@Data
public class MemberRegistrationRequestDTO {
    private String fullName;
    private String gender;
    private String birthDate;
    private String phone;
    private String email;
    private String packageId;
}
