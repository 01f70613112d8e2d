package uk.ac.ntu.chunkfs.common;

public final class Version {
    private Version() {}

    public static final String NAME = "chunkfs";
    public static final String VERSION = "0.1.0";
}
