package org.faultscan.io;

import org.faultscan.model.LogEntry;

import java.util.List;

/**
 * Entries read from an input file plus the number of malformed lines that were skipped.
 */
public record LoadResult(List<LogEntry> entries, int skipped) {

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
