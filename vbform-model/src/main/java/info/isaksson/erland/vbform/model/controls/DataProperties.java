package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Align;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.BofAction;
import info.isaksson.erland.vbform.model.props.Connection;
import info.isaksson.erland.vbform.model.props.DatabaseDriverType;
import info.isaksson.erland.vbform.model.props.DefaultCursorType;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.EofAction;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.RecordSetType;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

/** The DAO Data control. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DataProperties {
    public final Align align;
    public final Appearance appearance;
    public final Color backColor;
    public final BofAction bofAction;
    public final String caption;
    /** The {@code Connect} property. */
    public final Connection connection;
    public final String databaseName;
    public final DefaultCursorType defaultCursorType;
    public final DatabaseDriverType defaultType;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final EofAction eofAction;
    public final boolean exclusive;
    public final Color foreColor;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final boolean negotiate;
    public final OleDropMode oleDropMode;
    public final int options;
    public final boolean readOnly;
    public final RecordSetType recordSetType;
    public final String recordSource;
    public final TextDirection rightToLeft;
    public final String toolTipText;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public DataProperties() {
        this(new Builder());
    }

    private DataProperties(Builder b) {
        this.align = b.align;
        this.appearance = b.appearance;
        this.backColor = b.backColor;
        this.bofAction = b.bofAction;
        this.caption = b.caption;
        this.connection = b.connection;
        this.databaseName = b.databaseName;
        this.defaultCursorType = b.defaultCursorType;
        this.defaultType = b.defaultType;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.eofAction = b.eofAction;
        this.exclusive = b.exclusive;
        this.foreColor = b.foreColor;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.negotiate = b.negotiate;
        this.oleDropMode = b.oleDropMode;
        this.options = b.options;
        this.readOnly = b.readOnly;
        this.recordSetType = b.recordSetType;
        this.recordSource = b.recordSource;
        this.rightToLeft = b.rightToLeft;
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
        if (!(o instanceof DataProperties)) return false;
        DataProperties that = (DataProperties) o;
        return Objects.equals(align, that.align)
                && Objects.equals(appearance, that.appearance)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(bofAction, that.bofAction)
                && Objects.equals(caption, that.caption)
                && Objects.equals(connection, that.connection)
                && Objects.equals(databaseName, that.databaseName)
                && Objects.equals(defaultCursorType, that.defaultCursorType)
                && Objects.equals(defaultType, that.defaultType)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && Objects.equals(eofAction, that.eofAction)
                && exclusive == that.exclusive
                && Objects.equals(foreColor, that.foreColor)
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && negotiate == that.negotiate
                && Objects.equals(oleDropMode, that.oleDropMode)
                && options == that.options
                && readOnly == that.readOnly
                && Objects.equals(recordSetType, that.recordSetType)
                && Objects.equals(recordSource, that.recordSource)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && Objects.equals(toolTipText, that.toolTipText)
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(align, appearance, backColor, bofAction, caption, connection, databaseName,
                defaultCursorType, defaultType, dragIcon, dragMode, enabled, eofAction, exclusive, foreColor,
                mouseIcon, mousePointer, negotiate, oleDropMode, options, readOnly, recordSetType,
                recordSource, rightToLeft, toolTipText, visible, whatsThisHelpId, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Align align = Align.NONE;
        public Appearance appearance = Appearance.THREE_D;
        public Color backColor = Color.WINDOW_BACKGROUND;
        public BofAction bofAction = BofAction.MOVE_FIRST;
        public String caption = "";
        public Connection connection = Connection.ACCESS;
        public String databaseName = "";
        public DefaultCursorType defaultCursorType = DefaultCursorType.DEFAULT_CURSOR;
        public DatabaseDriverType defaultType = DatabaseDriverType.USE_JET;
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public EofAction eofAction = EofAction.MOVE_LAST;
        public boolean exclusive = false;
        public Color foreColor = Color.WINDOW_TEXT;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public boolean negotiate = false;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public int options = 0;
        public boolean readOnly = false;
        public RecordSetType recordSetType = RecordSetType.DYNASET;
        public String recordSource = "";
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public String toolTipText = "";
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int height = 1215;
        public int left = 480;
        public int top = 840;
        public int width = 1140;

        public DataProperties build() {
            return new DataProperties(this);
        }
    }
}
