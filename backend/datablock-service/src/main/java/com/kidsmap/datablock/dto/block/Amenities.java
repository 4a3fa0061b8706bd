package com.kidsmap.datablock.dto.block;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 편의시설 정보
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Amenities {

    /** 유모차 접근 */
    private Boolean strollerAccess;

    /** 수유실 */
    private Boolean nursingRoom;

    private Boolean parking;

    private Boolean restaurant;

    private Boolean restroom;

    private Boolean wheelchairAccess;
}
