package info.isaksson.erland.vbform.model.props;

public enum WindowState implements VbEnum {
    NORMAL(0, "Normal"),
    MINIMIZED(1, "Minimized"),
    MAXIMIZED(2, "Maximized");

    private final int code;
    private final String label;

    WindowState(int code, String label) {
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
