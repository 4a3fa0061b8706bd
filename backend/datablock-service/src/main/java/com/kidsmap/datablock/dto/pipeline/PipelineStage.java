package com.kidsmap.datablock.dto.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineStage {
    EXTRACT,
    TRANSFORM,
    LOAD;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
