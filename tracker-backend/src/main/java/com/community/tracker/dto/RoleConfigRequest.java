package com.community.tracker.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoleConfigRequest {

    @NotBlank
    @Size(max = 50)
    private String tierKey;

    @NotNull
    private Long externalRoleId;
}
