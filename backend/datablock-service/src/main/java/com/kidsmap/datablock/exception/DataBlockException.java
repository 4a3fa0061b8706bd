package com.kidsmap.datablock.exception;

/**
 * 데이터 블록 서비스 예외 기본 클래스
 */
public class DataBlockException extends RuntimeException {

    private final String errorCode;

    public DataBlockException(String message) {
        super(message);
        this.errorCode = "DATABLOCK_ERROR";
    }

    public DataBlockException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DataBlockException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 재시도해도 결과가 같은 외부 소스 오류 (4xx 등)
     */
    public static DataBlockException sourceError(String source, String message, Throwable cause) {
        return new DataBlockException("SOURCE_ERROR", source + ": " + message, cause);
    }
}
