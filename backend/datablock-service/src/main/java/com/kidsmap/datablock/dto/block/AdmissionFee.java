package com.kidsmap.datablock.dto.block;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 입장료 (금액 단위: 원)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdmissionFee {

    private Boolean isFree;

    private Integer adult;

    private Integer child;

    private Integer infant;

    private String description;
}
