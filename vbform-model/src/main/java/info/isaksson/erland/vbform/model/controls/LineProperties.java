package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.props.DrawMode;
import info.isaksson.erland.vbform.model.props.DrawStyle;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

/** A line drawn between two points. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LineProperties {
    public final Color borderColor;
    public final DrawStyle borderStyle;
    public final int borderWidth;
    public final DrawMode drawMode;
    public final Visibility visible;
    public final int x1;
    public final int y1;
    public final int x2;
    public final int y2;

    /** All properties at their IDE defaults. */
    public LineProperties() {
        this(new Builder());
    }

    private LineProperties(Builder b) {
        this.borderColor = b.borderColor;
        this.borderStyle = b.borderStyle;
        this.borderWidth = b.borderWidth;
        this.drawMode = b.drawMode;
        this.visible = b.visible;
        this.x1 = b.x1;
        this.y1 = b.y1;
        this.x2 = b.x2;
        this.y2 = b.y2;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineProperties)) return false;
        LineProperties that = (LineProperties) o;
        return Objects.equals(borderColor, that.borderColor)
                && Objects.equals(borderStyle, that.borderStyle)
                && borderWidth == that.borderWidth
                && Objects.equals(drawMode, that.drawMode)
                && Objects.equals(visible, that.visible)
                && x1 == that.x1
                && y1 == that.y1
                && x2 == that.x2
                && y2 == that.y2;
    }

    @Override public int hashCode() {
        return Objects.hash(borderColor, borderStyle, borderWidth, drawMode, visible, x1, y1, x2, y2);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Color borderColor = Color.WINDOW_TEXT;
        public DrawStyle borderStyle = DrawStyle.SOLID;
        public int borderWidth = 1;
        public DrawMode drawMode = DrawMode.COPY_PEN;
        public Visibility visible = Visibility.VISIBLE;
        public int x1 = 0;
        public int y1 = 0;
        public int x2 = 100;
        public int y2 = 100;

        public LineProperties build() {
            return new LineProperties(this);
        }
    }
}
