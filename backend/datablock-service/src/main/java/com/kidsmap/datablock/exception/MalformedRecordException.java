package com.kidsmap.datablock.exception;

/**
 * 소스 레코드가 스키마 검증을 통과하지 못함. Extract 단계 내부에서만 사용된다.
 */
public class MalformedRecordException extends DataBlockException {

    public MalformedRecordException(String message) {
        super("MALFORMED_RECORD", message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super("MALFORMED_RECORD", message, cause);
    }
}
