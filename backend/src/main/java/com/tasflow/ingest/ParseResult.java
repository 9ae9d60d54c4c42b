package com.tasflow.ingest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of parsing a movie file.
 *
 * @param success           whether the file could be parsed
 * @param fileExtension     movie format extension without the dot, e.g. "bk2"
 * @param systemCode        system the movie targets, e.g. "NES"
 * @param frames            movie length in frames
 * @param rerecordCount     number of rerecords
 * @param region            region the movie was recorded for
 * @param frameRateOverride exact frame rate when the format records one, otherwise null
 * @param hashes            ROM hashes in the order the format lists them
 * @param annotations       free-form author annotations
 * @param warnings          non-fatal issues found while parsing
 * @param errors            reasons parsing failed
 */
public record ParseResult(
    boolean success,
    String fileExtension,
    String systemCode,
    int frames,
    int rerecordCount,
    RegionType region,
    Double frameRateOverride,
    Map<HashType, String> hashes,
    String annotations,
    List<String> warnings,
    List<String> errors
) {

    public ParseResult {
        hashes = hashes == null ? Map.of() : new LinkedHashMap<>(hashes);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
        region = region == null ? RegionType.UNKNOWN : region;
    }

    public static ParseResult failure(String error) {
        return new ParseResult(false, null, null, 0, 0, RegionType.UNKNOWN, null,
            Map.of(), null, List.of(), List.of(error));
    }

    /**
     * First hash the format reported, which is the one stored on the submission.
     */
    public Optional<Map.Entry<HashType, String>> primaryHash() {
        return hashes.entrySet().stream().findFirst();
    }
}
