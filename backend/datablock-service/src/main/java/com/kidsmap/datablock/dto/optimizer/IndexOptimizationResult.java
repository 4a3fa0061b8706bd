package com.kidsmap.datablock.dto.optimizer;

import java.util.List;

public record IndexOptimizationResult(boolean executed, List<String> tables, String message) {
}
