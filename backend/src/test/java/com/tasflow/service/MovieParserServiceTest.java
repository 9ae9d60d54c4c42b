package com.tasflow.service;

import com.tasflow.ingest.HashType;
import com.tasflow.ingest.IngestResult;
import com.tasflow.ingest.MovieParser;
import com.tasflow.ingest.ParseResult;
import com.tasflow.ingest.ParsedSubmissionData;
import com.tasflow.ingest.RegionType;
import com.tasflow.ingest.UploadedMovie;
import com.tasflow.model.game.GameSystem;
import com.tasflow.model.game.GameSystemFrameRate;
import com.tasflow.repository.GameSystemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MovieParserServiceTest {

    private static final long MAX_BYTES = 1024;
    private static final byte[] MOVIE = "version 3\nemuVersion 20000\n|0|........|".getBytes(StandardCharsets.US_ASCII);

    private MovieParser movieParser;
    private GameSystemRepository systemRepository;
    private GameSystemFrameRateService frameRateService;
    private MovieParserService service;

    private final GameSystem nes = GameSystem.builder().id(1L).code("NES").displayName("Nintendo").build();

    @BeforeEach
    void setup() {
        movieParser = mock(MovieParser.class);
        systemRepository = mock(GameSystemRepository.class);
        frameRateService = mock(GameSystemFrameRateService.class);
        service = new MovieParserService(movieParser, systemRepository, frameRateService, MAX_BYTES);

        when(movieParser.parseFile(anyString(), any())).thenReturn(parsed(null, "notes"));
        when(movieParser.parseZip(any())).thenReturn(parsed(null, "notes"));
    }

    @Test
    void singleFileIsParsedAndZipped() {
        IngestResult result = service.parseMovieFileOrZip(new UploadedMovie("run.fm2", null, MOVIE));

        verify(movieParser).parseFile("run.fm2", MOVIE);
        assertThat(result.success()).isTrue();
        assertThat(MovieParserService.isZip(result.movieFileBytes())).isTrue();
    }

    @Test
    void gzippedFileIsDecompressedFirst() throws IOException {
        IngestResult result = service.parseMovieFileOrZip(new UploadedMovie("run.fm2.gz", null, gzip(MOVIE)));

        verify(movieParser).parseFile("run.fm2", MOVIE);
        assertThat(result.success()).isTrue();
    }

    @Test
    void zipIsHandedToZipParserUnchanged() {
        byte[] zip = MovieParserService.zipFile(MOVIE, "run.fm2");

        IngestResult result = service.parseMovieFileOrZip(new UploadedMovie("run.zip", null, zip));

        verify(movieParser).parseZip(zip);
        verify(movieParser, never()).parseFile(anyString(), any());
        assertThat(result.movieFileBytes()).isEqualTo(zip);
    }

    @Test
    void decompressionBombIsRejected() throws IOException {
        byte[] bomb = gzip(new byte[(int) MAX_BYTES * 8]);

        IngestResult result = service.parseMovieFileOrZip(new UploadedMovie("bomb.gz", null, bomb));

        assertThat(result.success()).isFalse();
        assertThat(result.movieFileBytes()).isNull();
        assertThat(result.parseResult().errors()).singleElement().asString().contains("exceeds");
        verifyNoInteractions(movieParser);
    }

    @Test
    void oversizedRawUploadIsRejected() {
        IngestResult result = service.parseMovieFileOrZip(new UploadedMovie("big.fm2", null, new byte[(int) MAX_BYTES + 1]));

        assertThat(result.success()).isFalse();
        verifyNoInteractions(movieParser);
    }

    @Test
    void unknownSystemMapsToEmpty() {
        when(systemRepository.findByCodeIgnoreCase("NES")).thenReturn(Optional.empty());

        assertThat(service.mapParsedResult(parsed(null, null))).isEmpty();
    }

    @Test
    void frameRateOverrideIsFoundOrCreated() {
        GameSystemFrameRate rate = GameSystemFrameRate.builder().id(9L).system(nes).frameRate(60.1).regionCode("NTSC").build();
        when(systemRepository.findByCodeIgnoreCase("NES")).thenReturn(Optional.of(nes));
        when(frameRateService.findOrCreate(nes, 60.1, "NTSC")).thenReturn(rate);

        ParsedSubmissionData data = service.mapParsedResult(parsed(60.1, null)).orElseThrow();

        assertThat(data.systemFrameRate()).isSameAs(rate);
        verify(frameRateService, never()).findDefault(any(), anyString());
    }

    @Test
    void regionDefaultUsedWithoutOverride() {
        GameSystemFrameRate rate = GameSystemFrameRate.builder().id(3L).system(nes).frameRate(60.0988).regionCode("NTSC").build();
        when(systemRepository.findByCodeIgnoreCase("NES")).thenReturn(Optional.of(nes));
        when(frameRateService.findDefault(nes, "NTSC")).thenReturn(Optional.of(rate));

        ParsedSubmissionData data = service.mapParsedResult(parsed(null, null)).orElseThrow();

        assertThat(data.system()).isSameAs(nes);
        assertThat(data.systemFrameRate()).isSameAs(rate);
        assertThat(data.frames()).isEqualTo(3600);
        verify(frameRateService, never()).findOrCreate(any(), anyDouble(), anyString());
    }

    @Test
    void longAnnotationsAreCapped() {
        when(systemRepository.findByCodeIgnoreCase("NES")).thenReturn(Optional.of(nes));
        when(frameRateService.findDefault(eq(nes), anyString())).thenReturn(Optional.empty());

        ParsedSubmissionData data = service.mapParsedResult(parsed(null, "x".repeat(5000))).orElseThrow();

        assertThat(data.annotations()).hasSize(3500).endsWith("...");
        assertThat(data.warnings()).isEqualTo("late start");
    }

    @Test
    void failedParseCannotBeMapped() {
        assertThatThrownBy(() -> service.mapParsedResult(ParseResult.failure("bad header")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ParseResult parsed(Double frameRateOverride, String annotations) {
        return new ParseResult(true, "fm2", "NES", 3600, 1234, RegionType.NTSC, frameRateOverride,
            Map.of(HashType.MD5, "d41d8cd98f00b204e9800998ecf8427e"), annotations, List.of("late start"), List.of());
    }

    private static byte[] gzip(byte[] content) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(content);
        }
        return buffer.toByteArray();
    }
}
