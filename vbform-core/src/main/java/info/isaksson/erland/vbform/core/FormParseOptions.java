package info.isaksson.erland.vbform.core;

import java.nio.file.Path;

/**
 * Options for {@link FormParserService}.
 */
public final class FormParseOptions {
    /**
     * Directory that relative companion-file names are resolved against. When {@code null}, the
     * directory of the form file is used, or the working directory if the file name has none.
     */
    public Path resourceBaseDir = null;

    /** Deepest allowed nesting of {@code Begin} blocks, and separately of {@code BeginProperty} blocks. */
    public int maxNestingDepth = 256;

    /** Read each companion file once per parse instead of once per reference. */
    public boolean cacheResources = true;
}
