package info.isaksson.erland.vbform.parser.resource;

import java.io.IOException;

/**
 * Resolves a {@code "file.frx":offset} reference to the bytes of the record stored there.
 *
 * <p>The parser calls this synchronously while reading a form. Implementations backed by real files
 * use {@link FileResourceResolver}; tests usually pass a lambda over an in-memory buffer.</p>
 */
@FunctionalInterface
public interface ResourceResolver {

    /**
     * @param companionFile file name exactly as written in the form (usually relative)
     * @param offset        byte offset of the record inside that file
     * @return the record payload, never {@code null}
     */
    byte[] resolve(String companionFile, int offset) throws IOException;

    /** A resolver over one in-memory companion buffer, whatever file name the form uses. */
    static ResourceResolver ofBuffer(byte[] buffer) {
        if (buffer == null) throw new IllegalArgumentException("buffer must not be null");
        byte[] copy = buffer.clone();
        return (file, offset) -> ResourceRecords.resolve(copy, offset);
    }
}
