package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.FormDocument;

/** A parsed form and where its code section starts. */
public final class ParsedForm {
    public final FormDocument document;
    /** Offset of the first character after the attribute block; the text length if there is no code. */
    public final int codeOffset;

    public ParsedForm(FormDocument document, int codeOffset) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        this.document = document;
        this.codeOffset = codeOffset;
    }
}
