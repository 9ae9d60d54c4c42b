package com.tasflow.ingest;

/**
 * Video region a movie was recorded for.
 */
public enum RegionType {
    UNKNOWN,
    NTSC,
    PAL,
    DENDY;

    /**
     * Region code as stored on frame rate records.
     */
    public String code() {
        return name();
    }
}
