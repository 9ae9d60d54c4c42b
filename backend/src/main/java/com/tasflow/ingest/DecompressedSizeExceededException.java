package com.tasflow.ingest;

/**
 * Thrown when an upload expands past the configured ceiling.
 */
public class DecompressedSizeExceededException extends RuntimeException {

    public DecompressedSizeExceededException(long maxSize, long attempted) {
        super(String.format(
            "Decompressed data exceeds maximum allowed size of %,d bytes (attempted %,d bytes)",
            maxSize, attempted));
    }
}
