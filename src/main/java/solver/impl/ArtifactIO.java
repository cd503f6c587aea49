package solver.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.errors.CacheUnavailableException;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * JSON read/write for the persisted artifacts (pattern cache, opening book).
 *
 * <ul>
 *   <li>files ending in {@code .gz} are gzip-compressed transparently</li>
 *   <li>writes go to a sibling temp file that is then moved over the target, so a
 *       crash never leaves a half-written artifact behind</li>
 *   <li>every failure surfaces as {@link CacheUnavailableException}</li>
 * </ul>
 */
public final class ArtifactIO {

    private static final Logger log = LoggerFactory.getLogger(ArtifactIO.class);

    private static final int BUFFER = 64 * 1024;

    private final ObjectMapper mapper;

    public ArtifactIO() {
        this(new ObjectMapper()
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public ArtifactIO(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public <T> T read(Path path, Class<T> type) throws CacheUnavailableException {
        try (InputStream in = open(path)) {
            T value = mapper.readValue(in, type);
            if (value == null) throw new CacheUnavailableException(path, "Empty artifact", null);
            return value;
        } catch (NoSuchFileException e) {
            throw new CacheUnavailableException(path, "Artifact not found", e);
        } catch (IOException e) {
            if (e instanceof CacheUnavailableException cue) throw cue;
            throw new CacheUnavailableException(path, "Artifact corrupted or incompatible", e);
        }
    }

    public void write(Path path, Object value) throws CacheUnavailableException {
        Path target = path.toAbsolutePath();
        Path tmp = null;
        try {
            Path dir = target.getParent();
            if (dir != null) Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");

            try (OutputStream out = create(tmp, isGzip(target))) {
                mapper.writeValue(out, value);
            }
            move(tmp, target);
            tmp = null;
        } catch (IOException e) {
            throw new CacheUnavailableException(path, "Could not write artifact", e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    log.debug("Could not delete temp file {}", tmp, cleanup);
                }
            }
        }
    }

    /* ── helpers ─────────────────────────────────────────────── */

    private static InputStream open(Path path) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path), BUFFER);
        return isGzip(path) ? new GZIPInputStream(in, BUFFER) : in;
    }

    private static OutputStream create(Path path, boolean gzip) throws IOException {
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(path), BUFFER);
        return gzip ? new GZIPOutputStream(out, BUFFER) : out;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isGzip(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().endsWith(".gz");
    }
}
