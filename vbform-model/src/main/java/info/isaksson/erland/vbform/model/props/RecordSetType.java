package info.isaksson.erland.vbform.model.props;

public enum RecordSetType implements VbEnum {
    TABLE(0, "Table"),
    DYNASET(1, "Dynaset"),
    SNAPSHOT(2, "Snapshot");

    private final int code;
    private final String label;

    RecordSetType(int code, String label) {
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
