package solver.errors;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A persisted artifact could not be read or written. Always recoverable:
 * callers fall back to computing on demand.
 */
public class CacheUnavailableException extends IOException {

    private final Path path;

    public CacheUnavailableException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** The artifact that could not be read or written. */
    public Path getPath() {
        return path;
    }
}
