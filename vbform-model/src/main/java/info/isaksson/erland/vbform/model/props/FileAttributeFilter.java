package info.isaksson.erland.vbform.model.props;

/** Whether a file list box shows files with a given attribute. */
public enum FileAttributeFilter implements VbEnum {
    EXCLUDE(0, "Exclude"),
    INCLUDE(-1, "Include");

    private final int code;
    private final String label;

    FileAttributeFilter(int code, String label) {
        this.code = code;
        this.label = label;
    }

    @Override public int code() {
        return code;
    }

    @Override public String label() {
        return label;
    }
}
