package com.kidsmap.datablock.exception;

/**
 * 업데이트 권한 없이 dedupe hash 가 충돌한 경우
 */
public class DuplicateBlockException extends DataBlockException {

    private final String dedupeHash;

    public DuplicateBlockException(String dedupeHash, String message) {
        super("DUPLICATE_KEY", message);
        this.dedupeHash = dedupeHash;
    }

    public DuplicateBlockException(String dedupeHash, String message, Throwable cause) {
        super("DUPLICATE_KEY", message, cause);
        this.dedupeHash = dedupeHash;
    }

    public String getDedupeHash() {
        return dedupeHash;
    }

    public static DuplicateBlockException place(String dedupeHash, String name) {
        return new DuplicateBlockException(dedupeHash, "Duplicate place block: " + name);
    }

    public static DuplicateBlockException content(String dedupeHash, String title) {
        return new DuplicateBlockException(dedupeHash, "Duplicate content block: " + title);
    }
}
