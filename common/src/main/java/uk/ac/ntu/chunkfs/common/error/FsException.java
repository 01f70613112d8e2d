package uk.ac.ntu.chunkfs.common.error;

import java.util.Objects;

public final class FsException extends Exception {
    private final ErrorCode code;

    public FsException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code);
    }

    public FsException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code);
    }

    public ErrorCode code() { return code; }

    public boolean is(ErrorCode other) { return code == other; }

    @Override
    public String toString() {
        return "FsException[" + code + "]: " + getMessage();
    }
}
