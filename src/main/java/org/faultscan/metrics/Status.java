package org.faultscan.metrics;

/**
 * Represents the status of a batch run.
 */
public enum Status {
    PASS, // Every record processed
    FAIL,  // Run could not complete
    PARTIAL // Some records failed and carry default outputs
}
