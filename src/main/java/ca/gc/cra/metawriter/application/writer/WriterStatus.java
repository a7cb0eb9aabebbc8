package ca.gc.cra.metawriter.application.writer;

/**
 * Point-in-time view of an {@link AcquisitionWriter}, readable while the writer runs.
 *
 * @param name writer name
 * @param filePath path of the current or last store file; {@code null} before the first run
 * @param storeOpen whether a store is open
 * @param activeProducers producers that announced start but not yet stop
 * @param writeCount write-frame messages processed since the store was created
 * @param finished whether the last run was closed
 * @param writeTimeoutCount write-timeout counter, reset by every write-frame message
 * @param expectedFrameCount declared frame count of the open run; {@code -1} when idle
 * @since 0.1.0
 */
public record WriterStatus(
    String name,
    String filePath,
    boolean storeOpen,
    int activeProducers,
    long writeCount,
    boolean finished,
    long writeTimeoutCount,
    int expectedFrameCount) {
}
