package uk.ac.ntu.chunkfs.common.rpc;

public enum AppendRole {
    PRIMARY,
    SECONDARY
}
