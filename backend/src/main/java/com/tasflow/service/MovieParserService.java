package com.tasflow.service;

import com.tasflow.ingest.DecompressedSizeExceededException;
import com.tasflow.ingest.IngestResult;
import com.tasflow.ingest.LimitedOutputStream;
import com.tasflow.ingest.MovieParser;
import com.tasflow.ingest.ParseResult;
import com.tasflow.ingest.ParsedSubmissionData;
import com.tasflow.ingest.UploadedMovie;
import com.tasflow.model.game.GameSystem;
import com.tasflow.model.game.GameSystemFrameRate;
import com.tasflow.repository.GameSystemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Turns an uploaded movie into a parse result plus the archive to store,
 * and maps parse results onto the system catalog.
 */
@Service
@Slf4j
public class MovieParserService {

    private static final int ANNOTATIONS_MAX_LENGTH = 3500;
    private static final int WARNINGS_MAX_LENGTH = 500;

    private final MovieParser movieParser;
    private final GameSystemRepository systemRepository;
    private final GameSystemFrameRateService frameRateService;
    private final long maxDecompressedBytes;

    public MovieParserService(
            MovieParser movieParser,
            GameSystemRepository systemRepository,
            GameSystemFrameRateService frameRateService,
            @Value("${tasflow.ingest.max-decompressed-bytes:52428800}") long maxDecompressedBytes) {
        this.movieParser = movieParser;
        this.systemRepository = systemRepository;
        this.frameRateService = frameRateService;
        this.maxDecompressedBytes = maxDecompressedBytes;
    }

    /**
     * Parse an upload that is either a single movie file or a zip holding one,
     * either of which may arrive gzip compressed.
     */
    public IngestResult parseMovieFileOrZip(UploadedMovie upload) {
        byte[] fileBytes;
        try {
            fileBytes = decompressOrTakeRaw(upload.content());
        } catch (DecompressedSizeExceededException e) {
            log.warn("Rejected movie upload {}: {}", upload.fileName(), e.getMessage());
            return new IngestResult(ParseResult.failure(e.getMessage()), null);
        }

        if (isZip(fileBytes)) {
            return new IngestResult(movieParser.parseZip(fileBytes), fileBytes);
        }

        String fileName = stripGzipSuffix(upload.fileName());
        ParseResult parseResult = movieParser.parseFile(fileName, fileBytes);
        return new IngestResult(parseResult, zipFile(fileBytes, fileName));
    }

    /**
     * Resolve the parsed system code to a system and frame rate.
     *
     * @return empty when the system code is unknown
     */
    public Optional<ParsedSubmissionData> mapParsedResult(ParseResult parseResult) {
        if (!parseResult.success()) {
            throw new IllegalArgumentException("Cannot map a failed parse result.");
        }

        Optional<GameSystem> found = Optional.ofNullable(parseResult.systemCode())
            .flatMap(systemRepository::findByCodeIgnoreCase);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        GameSystem system = found.get();

        String regionCode = parseResult.region().code();
        GameSystemFrameRate frameRate = parseResult.frameRateOverride() != null
            ? frameRateService.findOrCreate(system, parseResult.frameRateOverride(), regionCode)
            : frameRateService.findDefault(system, regionCode).orElse(null);

        String warnings = parseResult.warnings().isEmpty()
            ? null
            : cap(String.join(",", parseResult.warnings()), WARNINGS_MAX_LENGTH);

        return Optional.of(new ParsedSubmissionData(
            parseResult.frames(),
            parseResult.rerecordCount(),
            parseResult.fileExtension(),
            system,
            frameRate,
            capAndEllipse(parseResult.annotations(), ANNOTATIONS_MAX_LENGTH),
            warnings));
    }

    /**
     * Gunzip the payload, or return it untouched when it is not gzip data.
     */
    byte[] decompressOrTakeRaw(byte[] content) {
        if (content.length > maxDecompressedBytes) {
            throw new DecompressedSizeExceededException(maxDecompressedBytes, content.length);
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(content));
             LimitedOutputStream limited = new LimitedOutputStream(buffer, maxDecompressedBytes)) {
            gzip.transferTo(limited);
        } catch (IOException e) {
            // some clients send uncompressed payloads
            log.debug("Upload is not gzip data ({}), using raw bytes", e.getMessage());
            return content;
        }
        return buffer.toByteArray();
    }

    static boolean isZip(byte[] bytes) {
        return bytes.length >= 4
            && bytes[0] == 'P' && bytes[1] == 'K' && bytes[2] == 3 && bytes[3] == 4;
    }

    static byte[] zipFile(byte[] content, String entryName) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(content);
            zip.closeEntry();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to zip movie file " + entryName, e);
        }
        return buffer.toByteArray();
    }

    private static String stripGzipSuffix(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "movie";
        }
        return fileName.toLowerCase(Locale.ROOT).endsWith(".gz")
            ? fileName.substring(0, fileName.length() - 3)
            : fileName;
    }

    private static String cap(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private static String capAndEllipse(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - 3) + "...";
    }
}
