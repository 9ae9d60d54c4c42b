package com.tasflow.ingest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Movie formats that are no longer accepted for new movie files.
 */
@Component
public class MovieFormatDeprecator {

    private final Set<String> deprecatedExtensions;

    public MovieFormatDeprecator(@Value("${tasflow.ingest.deprecated-extensions:}") String[] deprecatedExtensions) {
        this.deprecatedExtensions = Arrays.stream(deprecatedExtensions)
            .map(MovieFormatDeprecator::normalize)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isDeprecated(String extension) {
        return extension != null && deprecatedExtensions.contains(normalize(extension));
    }

    private static String normalize(String extension) {
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}
