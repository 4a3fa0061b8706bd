package com.kidsmap.datablock.exception;

/**
 * 허용되지 않는 상태 전이. 호출자는 상태를 다시 확인해야 한다.
 */
public class InvalidTransitionException extends DataBlockException {

    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }

    public static InvalidTransitionException of(String entity, String id, Object from, Object to) {
        return new InvalidTransitionException(
                String.format("%s %s cannot transition from %s to %s", entity, id, from, to));
    }
}
