package info.isaksson.erland.vbform.core;

import info.isaksson.erland.vbform.model.FormDocument;

/** Result of parsing one form file. */
public final class FormParseResult {
    public final FormDocument document;

    /** Offset in the form text where the code section starts. */
    public final int codeOffset;

    public final long elapsedMillis;

    FormParseResult(FormDocument document, int codeOffset, long elapsedMillis) {
        this.document = document;
        this.codeOffset = codeOffset;
        this.elapsedMillis = elapsedMillis;
    }

    /** Code section of {@code text}, the same text that was parsed. */
    public String code(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        return text.substring(Math.min(codeOffset, text.length()));
    }
}
