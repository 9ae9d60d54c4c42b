package com.tasflow.ingest;

import com.tasflow.model.game.GameSystem;
import com.tasflow.model.game.GameSystemFrameRate;

/**
 * Parse result resolved against the system catalog.
 *
 * @param systemFrameRate null when the system has no frame rate for the parsed region
 */
public record ParsedSubmissionData(
    int frames,
    int rerecordCount,
    String movieExtension,
    GameSystem system,
    GameSystemFrameRate systemFrameRate,
    String annotations,
    String warnings
) {
}
