package com.kidsmap.datablock.dto.block;

import com.kidsmap.datablock.entity.BlockStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {

    @NotNull
    private BlockStatus status;
}
