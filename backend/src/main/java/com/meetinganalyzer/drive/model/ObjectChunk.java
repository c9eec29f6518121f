package com.meetinganalyzer.drive.model;

/**
 * One ranged read of a remote object. {@code totalSize} is the full object size
 * reported by the store, or {@link #UNKNOWN_TOTAL} when the store did not say.
 */
public record ObjectChunk(byte[] data, long totalSize) {

    public static final long UNKNOWN_TOTAL = -1L;

    public ObjectChunk {
        data = data == null ? new byte[0] : data;
    }

    public int length() {
        return data.length;
    }

    public boolean totalKnown() {
        return totalSize >= 0;
    }
}
