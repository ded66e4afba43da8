package com.codegym.backend.dto.plan;

import java.time.LocalDate;

import lombok.Data;

@Data
public class TrainerMemberDTO {
    private String id;
    private String fullName;
    private String email;
    private String phone;
    private LocalDate activeUntil;
    private boolean active;

    // plans written by the requesting trainer
    private boolean hasPlan;
    private long planCount;
}
