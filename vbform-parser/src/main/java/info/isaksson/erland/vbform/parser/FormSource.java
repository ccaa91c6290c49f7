package info.isaksson.erland.vbform.parser;

/**
 * Form text split into lines on demand. Accepts {@code \r\n}, {@code \n} and a lone {@code \r}
 * as terminators.
 */
public final class FormSource {

    /** One physical line. {@link #end} excludes the terminator; {@link #next} is where the next line starts. */
    public static final class Line {
        public final int start;
        public final int end;
        public final int next;
        public final int number;
        public final boolean terminated;
        private final String text;

        private Line(String source, int start, int end, int next, int number) {
            this.start = start;
            this.end = end;
            this.next = next;
            this.number = number;
            this.terminated = next > end;
            this.text = source.substring(start, end);
        }

        public String text() {
            return text;
        }

        public boolean isBlank() {
            return text.isBlank();
        }

        @Override public String toString() {
            return number + ": " + text;
        }
    }

    private final String fileName;
    private final String text;
    private int position;
    private int lineNumber;
    private Line last;

    public FormSource(String fileName, String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        this.fileName = fileName == null ? "" : fileName;
        this.text = text;
    }

    public String fileName() {
        return fileName;
    }

    public String text() {
        return text;
    }

    /** Offset of the first character not yet consumed. */
    public int position() {
        return position;
    }

    public boolean atEnd() {
        return position >= text.length();
    }

    /** Consumes and returns the next line, or {@code null} at end of input. */
    public Line nextLine() {
        Line line = peekLine();
        if (line != null) {
            position = line.next;
            lineNumber = line.number;
            last = line;
        }
        return line;
    }

    /** The next line without consuming it, or {@code null} at end of input. */
    public Line peekLine() {
        if (atEnd()) return null;
        int end = position;
        while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r') end++;
        int next = end;
        if (next < text.length()) {
            next += (text.charAt(next) == '\r' && next + 1 < text.length() && text.charAt(next + 1) == '\n') ? 2 : 1;
        }
        return new Line(text, position, end, next, lineNumber + 1);
    }

    /** Consumes lines up to the next non-blank one and returns it, or {@code null} at end of input. */
    public Line nextNonBlankLine() {
        Line line = nextLine();
        while (line != null && line.isBlank()) line = nextLine();
        return line;
    }

    public FormParseException error(FormErrorKind kind, Line line, String detail) {
        return error(kind, line, detail, null);
    }

    public FormParseException error(FormErrorKind kind, Line line, String detail, Throwable cause) {
        return new FormParseException(kind, fileName, line.start, line.start, line.end, line.number, detail, cause);
    }

    /** Error located at a column inside {@code line}. */
    public FormParseException errorAt(FormErrorKind kind, Line line, int column, String detail) {
        return new FormParseException(kind, fileName, line.start + column, line.start, line.end, line.number, detail, null);
    }

    /** Error located at the end of input, on the last line read. */
    public FormParseException errorAtEnd(FormErrorKind kind, String detail) {
        int lineStart = last == null ? 0 : last.start;
        int lineEnd = last == null ? 0 : last.end;
        return new FormParseException(kind, fileName, text.length(), lineStart, lineEnd, Math.max(lineNumber, 1), detail, null);
    }
}
