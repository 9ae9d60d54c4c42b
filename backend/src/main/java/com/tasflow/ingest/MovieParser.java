package com.tasflow.ingest;

/**
 * Byte-level movie format parsers.
 */
public interface MovieParser {

    /**
     * Parse a single movie file; the format is chosen from the file name extension.
     */
    ParseResult parseFile(String fileName, byte[] content);

    /**
     * Parse the first movie file found in a zip archive.
     */
    ParseResult parseZip(byte[] content);
}
