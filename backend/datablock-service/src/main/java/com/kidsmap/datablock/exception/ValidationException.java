package com.kidsmap.datablock.exception;

import java.util.List;

/**
 * 잘못된 작업 설정 등 입력 검증 실패. 작업은 큐에 들어가지 않는다.
 */
public class ValidationException extends DataBlockException {

    private final List<String> violations;

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
        this.violations = List.of(message);
    }

    public ValidationException(List<String> violations) {
        super("VALIDATION_ERROR", "Invalid request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
