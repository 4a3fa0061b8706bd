package com.kidsmap.datablock.dto.migration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MigrationRequest {

    @Valid
    @NotNull
    private MigrationConfig config;

    private MigrationFilter filter;
}
