package com.codegym.backend.dto.admin;

import java.util.List;

import com.codegym.backend.dto.auth.StaffUserResponseDTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdminUserUpdateResultDTO {
    private StaffUserResponseDTO user;
    private List<String> warnings;

    public String getId() {
        return user != null ? user.getId() : null;
    }
}
