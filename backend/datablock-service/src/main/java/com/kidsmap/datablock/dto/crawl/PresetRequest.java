package com.kidsmap.datablock.dto.crawl;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 프리셋 작업 요청 (region: regionCodes, content: keywords)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PresetRequest {

    private List<String> regionCodes;

    private List<String> keywords;
}
