package com.kidsmap.datablock.exception;

public class BlockNotFoundException extends DataBlockException {

    public BlockNotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static BlockNotFoundException of(String kind, Object id) {
        return new BlockNotFoundException(kind + " not found: " + id);
    }
}
