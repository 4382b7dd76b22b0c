package org.faultscan.processing;

import org.faultscan.model.LogEntry;

/**
 * Full per-record unit of work run by a batch worker. Implementations write their outputs
 * into the entry and must not touch any other entry.
 */
@FunctionalInterface
public interface RecordProcessor {

    void process(LogEntry entry);
}
