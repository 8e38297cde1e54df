package prism.worker.collect;

import prism.coordinator.model.Configuration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs one trace on one device and brings the artifact back to the host.
 */
public interface TraceCollector {

    /**
     * Collect a trace.
     *
     * @param durationSeconds how long to trace; the collector gives up a little after it
     * @throws IOException when the tool fails, times out or produces nothing
     */
    CollectedTrace collect(String serial, Configuration configuration, int durationSeconds) throws IOException;

    /**
     * A local artifact.
     *
     * @param extension file extension for the stored object, without the dot
     */
    record CollectedTrace(Path file, String extension) {
    }
}
