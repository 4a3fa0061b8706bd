package com.kidsmap.datablock.service.quality;

import com.kidsmap.datablock.entity.QualityGrade;

/**
 * 단일 레코드의 식별 해시와 품질 평가 결과
 */
public record QualityAssessment(
        String dedupeHash,
        int completeness,
        QualityGrade grade
) {
}
