package prism.coordinator.storage;

import java.io.IOException;
import java.io.InputStream;

/**
 * Bucketed blob storage for trace artifacts.
 */
public interface ObjectStore {

    /** Bucket that holds collected traces */
    String TRACES_BUCKET = "traces";

    /**
     * Store an object, replacing any object with the same name.
     */
    void upload(String bucket, String objectName, byte[] content) throws IOException;

    boolean exists(String bucket, String objectName);

    /**
     * Open an object for reading. Caller closes the stream.
     *
     * @throws java.io.FileNotFoundException if the object does not exist
     */
    InputStream open(String bucket, String objectName) throws IOException;
}
