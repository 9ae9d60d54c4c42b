package com.tasflow.integration;

import com.tasflow.ingest.MovieParser;
import com.tasflow.ingest.ParseResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback used when no format parser bean is deployed. Rejects every file.
 */
@Slf4j
public class UnconfiguredMovieParser implements MovieParser {

    private static final String MESSAGE = "No movie parser is configured";

    @Override
    public ParseResult parseFile(String fileName, byte[] content) {
        log.warn("{}, rejecting {}", MESSAGE, fileName);
        return ParseResult.failure(MESSAGE);
    }

    @Override
    public ParseResult parseZip(byte[] content) {
        log.warn("{}, rejecting zip upload", MESSAGE);
        return ParseResult.failure(MESSAGE);
    }
}
