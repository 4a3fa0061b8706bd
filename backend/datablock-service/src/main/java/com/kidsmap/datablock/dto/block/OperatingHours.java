package com.kidsmap.datablock.dto.block;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperatingHours {

    private String weekday;

    private String saturday;

    private String sunday;

    /** 휴무일 */
    private String closedDays;
}
