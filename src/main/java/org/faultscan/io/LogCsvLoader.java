package org.faultscan.io;

import org.faultscan.model.LogEntry;
import org.faultscan.util.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads labelled log lines from a structured CSV export. The first line is a header:
 * <pre>
 * LineId,Label,Timestamp,Date,Node,Time,NodeRepeat,Type,Component,Level,Content,EventId,EventTemplate
 * </pre>
 * Malformed lines are skipped and counted; they never abort the load.
 */
public class LogCsvLoader {

    private static final Logger LOGGER = Logger.getLogger(LogCsvLoader.class.getName());

    static final int FIELD_COUNT = 13;

    private static final int LINE_ID = 0;
    private static final int LABEL = 1;
    private static final int TIMESTAMP = 2;
    private static final int DATE = 3;
    private static final int NODE = 4;
    private static final int TIME = 5;
    // 6 NodeRepeat and 7 Type are not used
    private static final int COMPONENT = 8;
    private static final int LEVEL = 9;
    private static final int CONTENT = 10;
    // 11 EventId is not used
    private static final int EVENT_TEMPLATE = 12;

    public LoadResult load(final Path inputFile) throws IOException {
        final List<LogEntry> entries = new ArrayList<>();
        int skipped = 0;
        int lineCount = 0;

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(inputFile), lenientUtf8()))) {
            final String header = reader.readLine();
            if (header == null) {
                LOGGER.warning("Input file is empty: " + inputFile);
                return new LoadResult(List.of(), 0);
            }

            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                lineCount++;
                try {
                    entries.add(parseLine(line));
                } catch (final IllegalArgumentException e) {
                    skipped++;
                    LOGGER.log(Level.WARNING, "Failed to parse line {0}: {1}", new Object[]{lineCount, e.getMessage()});
                }
            }
        }

        LOGGER.info(String.format("Loaded %d logs from %s (%d malformed lines skipped)", entries.size(), inputFile, skipped));
        return new LoadResult(List.copyOf(entries), skipped);
    }

    // undecodable bytes become U+FFFD instead of failing the whole file
    private static CharsetDecoder lenientUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    static LogEntry parseLine(final String line) {
        final List<String> fields = Utils.splitCsvLine(line);
        if (fields.size() < FIELD_COUNT) {
            throw new IllegalArgumentException("expected " + FIELD_COUNT + " fields but found " + fields.size());
        }
        final int lineId;
        try {
            lineId = Integer.parseInt(fields.get(LINE_ID).trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("invalid LineId '" + fields.get(LINE_ID) + "'", e);
        }
        return new LogEntry(lineId, fields.get(LABEL), fields.get(TIMESTAMP), fields.get(DATE), fields.get(NODE),
                fields.get(TIME), fields.get(COMPONENT), fields.get(LEVEL), fields.get(CONTENT),
                fields.get(EVENT_TEMPLATE));
    }
}
