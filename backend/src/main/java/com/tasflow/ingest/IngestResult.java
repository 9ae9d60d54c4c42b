package com.tasflow.ingest;

/**
 * Parse result together with the bytes to store, always a zip archive.
 * {@code movieFileBytes} is null when the upload was rejected before parsing.
 */
public record IngestResult(ParseResult parseResult, byte[] movieFileBytes) {

    public boolean success() {
        return parseResult.success() && movieFileBytes != null;
    }
}
