package info.isaksson.erland.vbform.parser.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves resource references against companion files on disk, relative to the form's directory.
 *
 * <p>Each companion file is read once and kept in memory when caching is on. Instances are not
 * thread-safe; use one per parse.</p>
 */
public final class FileResourceResolver implements ResourceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(FileResourceResolver.class);

    private final Path baseDir;
    private final boolean cache;
    private final Map<Path, byte[]> buffers = new HashMap<>();

    public FileResourceResolver(Path baseDir) {
        this(baseDir, true);
    }

    public FileResourceResolver(Path baseDir, boolean cache) {
        if (baseDir == null) throw new IllegalArgumentException("baseDir must not be null");
        this.baseDir = baseDir;
        this.cache = cache;
    }

    @Override
    public byte[] resolve(String companionFile, int offset) throws IOException {
        if (companionFile == null || companionFile.isBlank()) {
            throw new IOException("Resource reference has no file name");
        }
        return ResourceRecords.resolve(load(locate(companionFile)), offset);
    }

    /**
     * Forms written on Windows may use backslashes. The file must lie inside {@link #baseDir}:
     * absolute names and names climbing out of it with {@code ..} are rejected.
     */
    Path locate(String companionFile) throws IOException {
        String normalized = companionFile.replace('\\', '/');
        Path p;
        try {
            p = Path.of(normalized);
        } catch (InvalidPathException e) {
            throw new IOException("Invalid resource file name '" + companionFile + "': " + e.getReason(), e);
        }
        if (p.isAbsolute() || normalized.startsWith("/")) {
            throw new IOException("Resource file '" + companionFile + "' must be relative to the form directory");
        }
        Path root = baseDir.toAbsolutePath().normalize();
        Path file = root.resolve(p).normalize();
        if (!file.startsWith(root)) {
            throw new IOException("Resource file '" + companionFile + "' lies outside the form directory " + root);
        }
        return file;
    }

    private byte[] load(Path file) throws IOException {
        byte[] cached = buffers.get(file);
        if (cached != null) return cached;
        byte[] data = Files.readAllBytes(file);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Loaded companion file {} ({} bytes)", file, data.length);
        }
        if (cache) buffers.put(file, data);
        return data;
    }
}
