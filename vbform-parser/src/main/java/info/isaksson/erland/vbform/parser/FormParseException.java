package info.isaksson.erland.vbform.parser;

/**
 * A fatal error in a form file, located by offset and by the line that contains it.
 *
 * <p>Offsets are character offsets into the text handed to the parser. Form text is single-byte
 * (windows-1252), so they equal byte offsets in the original file.</p>
 */
public class FormParseException extends Exception {
    private final FormErrorKind kind;
    private final String fileName;
    private final int offset;
    private final int lineStart;
    private final int lineEnd;
    private final int lineNumber;
    private final String detail;

    public FormParseException(FormErrorKind kind, String fileName, int offset, int lineStart, int lineEnd,
                              int lineNumber, String detail, Throwable cause) {
        super(format(kind, fileName, lineNumber, detail), cause);
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        this.kind = kind;
        this.fileName = fileName == null ? "" : fileName;
        this.offset = offset;
        this.lineStart = lineStart;
        this.lineEnd = lineEnd;
        this.lineNumber = lineNumber;
        this.detail = detail == null ? "" : detail;
    }

    private static String format(FormErrorKind kind, String fileName, int lineNumber, String detail) {
        StringBuilder sb = new StringBuilder();
        sb.append(fileName == null || fileName.isEmpty() ? "<form>" : fileName);
        if (lineNumber > 0) sb.append(':').append(lineNumber);
        sb.append(": ").append(kind == null ? "?" : kind.description());
        if (detail != null && !detail.isEmpty()) sb.append(": ").append(detail);
        return sb.toString();
    }

    public FormErrorKind getKind() {
        return kind;
    }

    public String getFileName() {
        return fileName;
    }

    public int getOffset() {
        return offset;
    }

    /** Offset of the first character of the offending line. */
    public int getLineStart() {
        return lineStart;
    }

    /** Offset just past the last character of the offending line, line terminator excluded. */
    public int getLineEnd() {
        return lineEnd;
    }

    /** 1-based line number. */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getDetail() {
        return detail;
    }
}
