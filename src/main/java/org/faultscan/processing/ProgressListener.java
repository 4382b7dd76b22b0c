package org.faultscan.processing;

/**
 * Receives progress notifications from a {@link BatchRunner}. Calls are serialized by the runner.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param index position in the batch of the record that triggered the notification
     * @param total batch size
     */
    void onProgress(int index, int total);

    static ProgressListener console() {
        return (index, total) -> System.out.printf("  Processed: %d/%d%n", index, total);
    }

    static ProgressListener none() {
        return (index, total) -> {
        };
    }
}
