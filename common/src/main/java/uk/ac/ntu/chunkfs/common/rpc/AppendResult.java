package uk.ac.ntu.chunkfs.common.rpc;

/** {@code offset} is where the bytes landed inside the chunk, {@code chunkSize} the size after the write. */
public record AppendResult(long handle, int offset, int chunkSize) {}
