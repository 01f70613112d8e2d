package uk.ac.ntu.chunkfs.common.error;

/** Failure kinds every chunkfs call can report, with the HTTP status the carrier uses. */
public enum ErrorCode {
    ALREADY_EXISTS(409),
    UNKNOWN_FILE(404),
    UNKNOWN_CHUNK(404),
    INSUFFICIENT_REPLICAS(503),
    CHUNK_UNAVAILABLE(503),
    CHUNK_EXISTS(409),
    CHUNK_NOT_FOUND(404),
    CHUNK_FULL(413),
    REPLICATION_FAILED(502),
    // transport level: the peer could not be reached or answered garbage
    UNREACHABLE(504);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() { return httpStatus; }
}
