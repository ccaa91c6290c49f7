package info.isaksson.erland.vbform.model.props;

/** Database driver named by the Data control {@code Connect} property. */
public enum Connection implements TextCodedEnum {
    ACCESS("Access"),
    DBASE_III("dBase III"),
    DBASE_IV("dBase IV"),
    DBASE_5_0("dBase 5.0"),
    EXCEL_3_0("Excel 3.0"),
    EXCEL_4_0("Excel 4.0"),
    EXCEL_5_0("Excel 5.0"),
    EXCEL_8_0("Excel 8.0"),
    FOXPRO_2_0("FoxPro 2.0"),
    FOXPRO_2_5("FoxPro 2.5"),
    FOXPRO_2_6("FoxPro 2.6"),
    FOXPRO_3_0("FoxPro 3.0"),
    LOTUS_WK1("Lotus WK1"),
    LOTUS_WK3("Lotus WK3"),
    LOTUS_WK4("Lotus WK4"),
    PARADOX_3_X("Paradox 3.X"),
    PARADOX_4_X("Paradox 4.X"),
    PARADOX_5_X("Paradox 5.X"),
    TEXT("Text");

    private final String text;

    Connection(String text) {
        this.text = text;
    }

    @Override public String text() {
        return text;
    }
}
