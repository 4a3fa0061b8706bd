package com.kidsmap.datablock.exception;

/**
 * 네트워크/타임아웃 등 일시적 오류. 작업 재시도 정책에 따라 재시도된다.
 */
public class TransientNetworkException extends DataBlockException {

    public TransientNetworkException(String message) {
        super("TRANSIENT_NETWORK_ERROR", message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super("TRANSIENT_NETWORK_ERROR", message, cause);
    }

    public static TransientNetworkException retriesExhausted(String source, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown";
        return new TransientNetworkException(source + " unreachable after retries: " + detail, cause);
    }
}
