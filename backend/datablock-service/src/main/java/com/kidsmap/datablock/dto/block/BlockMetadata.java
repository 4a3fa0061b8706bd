package com.kidsmap.datablock.dto.block;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 블록 메타데이터. version 은 update/updateStatus 마다 1씩 증가한다.
 * JSON 컬럼이므로 변경 시 새 인스턴스로 교체해야 dirty checking 에 잡힌다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BlockMetadata implements Serializable {

    private String source;

    private String sourceId;

    @Builder.Default
    private int version = 1;

    @Builder.Default
    private boolean verified = false;

    private String verifiedBy;

    private LocalDateTime verifiedAt;

    private List<String> enrichedFrom;

    public BlockMetadata nextVersion() {
        return toBuilder().version(version + 1).build();
    }
}
