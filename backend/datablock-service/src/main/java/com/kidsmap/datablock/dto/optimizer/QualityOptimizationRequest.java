package com.kidsmap.datablock.dto.optimizer;

import com.kidsmap.datablock.entity.QualityGrade;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QualityOptimizationRequest {

    private List<QualityGrade> archiveGrades;

    private Boolean refreshStale;
}
