package com.codegym.backend.dto.dashboard;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActiveMembersDTO {
    private LocalDate asOf;
    private long activeMembers;
}
