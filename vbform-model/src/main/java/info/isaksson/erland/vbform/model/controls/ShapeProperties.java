package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.props.BackStyle;
import info.isaksson.erland.vbform.model.props.DrawMode;
import info.isaksson.erland.vbform.model.props.DrawStyle;
import info.isaksson.erland.vbform.model.props.ShapeType;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ShapeProperties {
    public final Color backColor;
    public final BackStyle backStyle;
    public final Color borderColor;
    public final DrawStyle borderStyle;
    public final int borderWidth;
    public final DrawMode drawMode;
    public final Color fillColor;
    public final DrawStyle fillStyle;
    public final ShapeType shape;
    public final Visibility visible;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public ShapeProperties() {
        this(new Builder());
    }

    private ShapeProperties(Builder b) {
        this.backColor = b.backColor;
        this.backStyle = b.backStyle;
        this.borderColor = b.borderColor;
        this.borderStyle = b.borderStyle;
        this.borderWidth = b.borderWidth;
        this.drawMode = b.drawMode;
        this.fillColor = b.fillColor;
        this.fillStyle = b.fillStyle;
        this.shape = b.shape;
        this.visible = b.visible;
        this.height = b.height;
        this.left = b.left;
        this.top = b.top;
        this.width = b.width;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapeProperties)) return false;
        ShapeProperties that = (ShapeProperties) o;
        return Objects.equals(backColor, that.backColor)
                && Objects.equals(backStyle, that.backStyle)
                && Objects.equals(borderColor, that.borderColor)
                && Objects.equals(borderStyle, that.borderStyle)
                && borderWidth == that.borderWidth
                && Objects.equals(drawMode, that.drawMode)
                && Objects.equals(fillColor, that.fillColor)
                && Objects.equals(fillStyle, that.fillStyle)
                && Objects.equals(shape, that.shape)
                && Objects.equals(visible, that.visible)
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(backColor, backStyle, borderColor, borderStyle, borderWidth, drawMode, fillColor,
                fillStyle, shape, visible, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Color backColor = Color.WINDOW_BACKGROUND;
        public BackStyle backStyle = BackStyle.TRANSPARENT;
        public Color borderColor = Color.WINDOW_TEXT;
        public DrawStyle borderStyle = DrawStyle.SOLID;
        public int borderWidth = 1;
        public DrawMode drawMode = DrawMode.COPY_PEN;
        public Color fillColor = Color.BLACK;
        public DrawStyle fillStyle = DrawStyle.TRANSPARENT;
        public ShapeType shape = ShapeType.RECTANGLE;
        public Visibility visible = Visibility.VISIBLE;
        public int height = 355;
        public int left = 30;
        public int top = 200;
        public int width = 355;

        public ShapeProperties build() {
            return new ShapeProperties(this);
        }
    }
}
