package info.isaksson.erland.vbform.core;

import info.isaksson.erland.vbform.model.FormDocument;
import info.isaksson.erland.vbform.model.json.FormJson;
import info.isaksson.erland.vbform.parser.FormParseException;
import info.isaksson.erland.vbform.parser.FormParser;
import info.isaksson.erland.vbform.parser.ParsedForm;
import info.isaksson.erland.vbform.parser.resource.FileResourceResolver;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point for parsing VB6 form files.
 *
 * <p>Callers decode the {@code .frm} bytes themselves (the IDE writes windows-1252) and pass the
 * text together with the file name. Companion {@code .frx} files are read through a
 * {@link ResourceResolver}.</p>
 */
public final class FormParserService {
    private static final Logger LOG = LoggerFactory.getLogger(FormParserService.class);

    private final FormParseOptions options;

    public FormParserService() {
        this(new FormParseOptions());
    }

    public FormParserService(FormParseOptions options) {
        this.options = options == null ? new FormParseOptions() : options;
    }

    /** Parses with companion files read from disk, relative to {@link FormParseOptions#resourceBaseDir}. */
    public FormParseResult parse(String fileName, String text) throws FormParseException {
        if (fileName == null) throw new IllegalArgumentException("fileName must not be null");
        return parseWithResolver(fileName, text, new FileResourceResolver(baseDir(fileName), options.cacheResources));
    }

    /** Parses with an injected resolver, e.g. an in-memory companion buffer. */
    public FormParseResult parseWithResolver(String fileName, String text, ResourceResolver resolver) throws FormParseException {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        if (resolver == null) throw new IllegalArgumentException("resolver must not be null");

        long started = System.nanoTime();
        ParsedForm parsed = new FormParser(resolver, options.maxNestingDepth).parse(fileName, text);
        long elapsed = (System.nanoTime() - started) / 1_000_000L;

        FormDocument doc = parsed.document;
        LOG.info("Parsed {}: {} {} with {} controls, {} menus, {} object references in {} ms",
                fileName, doc.root.kind.type().name(), doc.root.name,
                doc.root.kind.children().size(), doc.root.kind.menus().size(), doc.objects.size(), elapsed);
        return new FormParseResult(doc, parsed.codeOffset, elapsed);
    }

    public String toJson(FormDocument document) throws IOException {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        return FormJson.toJsonString(document);
    }

    public void writeJson(FormDocument document, Path out) throws IOException {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        if (out == null) throw new IllegalArgumentException("out must not be null");
        FormJson.write(document, out);
    }

    private Path baseDir(String fileName) {
        if (options.resourceBaseDir != null) return options.resourceBaseDir;
        Path parent = Paths.get(fileName.replace('\\', '/')).getParent();
        return parent != null ? parent : Paths.get("");
    }
}
