package org.faultscan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.faultscan.config.AppConfig;
import org.faultscan.io.LoadResult;
import org.faultscan.io.LogCsvLoader;
import org.faultscan.io.ReportWriter;
import org.faultscan.processing.ProgressListener;
import org.faultscan.stats.PerformanceStats;
import org.faultscan.util.TestDataGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FaultScanTest {

    @TempDir
    Path tempDir;

    @Mock
    private LogCsvLoader mockLoader;

    @Mock
    private ReportWriter mockWriter;

    private AppConfig config(Path input, int threads) {
        return new AppConfig(input, tempDir.resolve("out"), threads, 10, 100, null, null);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testExecute_endToEnd() throws IOException {
        Path input = TestDataGenerator.writeCsv(tempDir.resolve("logs.csv"), 250);
        AppConfig config = config(input, 4);
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        ReportWriter writer = new ReportWriter(new PrintStream(console, true, StandardCharsets.UTF_8));

        Optional<PerformanceStats> result =
                new FaultScan(config, new LogCsvLoader(), writer, ProgressListener.none()).execute();

        PerformanceStats stats = result.orElseThrow();
        assertEquals(250, stats.totalLogs());
        assertEquals(4, stats.numThreads());
        assertTrue(stats.correctPredictions() > 0 && stats.correctPredictions() <= 250);
        assertTrue(stats.peakMemoryMb() >= 0);

        assertTrue(Files.exists(config.statsPath()));
        JsonNode json = new ObjectMapper().readTree(config.statsPath().toFile());
        assertEquals(250, json.path("metadata").path("total_logs_processed").asInt());
        assertEquals(stats.correctPredictions(), json.path("accuracy").path("correct").asInt());

        List<String> lines = Files.readAllLines(config.resultsPath(), StandardCharsets.UTF_8);
        assertEquals(251, lines.size());
        assertTrue(lines.get(0).startsWith("LineId,GroundTruth,PredictedLabel"));

        String printed = console.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("PERFORMANCE ANALYSIS SUMMARY"));
        assertTrue(printed.contains("--- Label Distribution ---"));
    }

    @Test
    void testExecute_headerOnlyInputWritesNothing() throws IOException {
        Path input = TestDataGenerator.writeCsv(tempDir.resolve("header.csv"), 0);
        AppConfig config = config(input, 2);

        Optional<PerformanceStats> result =
                new FaultScan(config, new LogCsvLoader(), mockWriter, ProgressListener.none()).execute();

        assertTrue(result.isEmpty());
        assertFalse(Files.exists(config.statsPath()));
        assertFalse(Files.exists(config.resultsPath()));
        verifyNoInteractions(mockWriter);
    }

    @Test
    void testExecute_emptyLoadSkipsProcessing() throws IOException {
        Path input = tempDir.resolve("any.csv");
        when(mockLoader.load(input)).thenReturn(new LoadResult(List.of(), 3));

        Optional<PerformanceStats> result =
                new FaultScan(config(input, 2), mockLoader, mockWriter, ProgressListener.none()).execute();

        assertTrue(result.isEmpty());
        verify(mockLoader).load(input);
        verifyNoInteractions(mockWriter);
    }

    @Test
    void testExecute_missingInputPropagatesIOException() {
        AppConfig config = config(tempDir.resolve("missing.csv"), 2);
        FaultScan scan = new FaultScan(config, new LogCsvLoader(), mockWriter, ProgressListener.none());

        assertThrows(IOException.class, scan::execute);
        verifyNoInteractions(mockWriter);
    }
}
