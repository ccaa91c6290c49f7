package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.BorderStyle;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.OleDragMode;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ImageProperties {
    public final Appearance appearance;
    public final BorderStyle borderStyle;
    public final String dataField;
    public final String dataFormat;
    public final String dataMember;
    public final String dataSource;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final OleDragMode oleDragMode;
    public final OleDropMode oleDropMode;
    public final PropertyValue picture;
    public final boolean stretch;
    public final String toolTipText;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public ImageProperties() {
        this(new Builder());
    }

    private ImageProperties(Builder b) {
        this.appearance = b.appearance;
        this.borderStyle = b.borderStyle;
        this.dataField = b.dataField;
        this.dataFormat = b.dataFormat;
        this.dataMember = b.dataMember;
        this.dataSource = b.dataSource;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.oleDragMode = b.oleDragMode;
        this.oleDropMode = b.oleDropMode;
        this.picture = b.picture;
        this.stretch = b.stretch;
        this.toolTipText = b.toolTipText;
        this.visible = b.visible;
        this.whatsThisHelpId = b.whatsThisHelpId;
        this.height = b.height;
        this.left = b.left;
        this.top = b.top;
        this.width = b.width;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageProperties)) return false;
        ImageProperties that = (ImageProperties) o;
        return Objects.equals(appearance, that.appearance)
                && Objects.equals(borderStyle, that.borderStyle)
                && Objects.equals(dataField, that.dataField)
                && Objects.equals(dataFormat, that.dataFormat)
                && Objects.equals(dataMember, that.dataMember)
                && Objects.equals(dataSource, that.dataSource)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(oleDragMode, that.oleDragMode)
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(picture, that.picture)
                && stretch == that.stretch
                && Objects.equals(toolTipText, that.toolTipText)
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(appearance, borderStyle, dataField, dataFormat, dataMember, dataSource, dragIcon,
                dragMode, enabled, mouseIcon, mousePointer, oleDragMode, oleDropMode, picture, stretch,
                toolTipText, visible, whatsThisHelpId, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Appearance appearance = Appearance.THREE_D;
        public BorderStyle borderStyle = BorderStyle.NONE;
        public String dataField = "";
        public String dataFormat = "";
        public String dataMember = "";
        public String dataSource = "";
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public OleDragMode oleDragMode = OleDragMode.MANUAL;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public PropertyValue picture;
        public boolean stretch = false;
        public String toolTipText = "";
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int height = 975;
        public int left = 1080;
        public int top = 960;
        public int width = 615;

        public ImageProperties build() {
            return new ImageProperties(this);
        }
    }
}
