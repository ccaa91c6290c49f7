package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.AutoActivate;
import info.isaksson.erland.vbform.model.props.BackStyle;
import info.isaksson.erland.vbform.model.props.BorderStyle;
import info.isaksson.erland.vbform.model.props.CausesValidation;
import info.isaksson.erland.vbform.model.props.DisplayType;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.OleTypeAllowed;
import info.isaksson.erland.vbform.model.props.SizeMode;
import info.isaksson.erland.vbform.model.props.TabStop;
import info.isaksson.erland.vbform.model.props.UpdateOptions;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

/** The OLE container control. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OleProperties {
    public final Appearance appearance;
    public final AutoActivate autoActivate;
    public final boolean autoVerbMenu;
    public final Color backColor;
    public final BackStyle backStyle;
    public final BorderStyle borderStyle;
    public final CausesValidation causesValidation;
    /** The {@code Class} property; {@code null} when the container is empty. */
    public final String oleClass;
    public final String dataField;
    public final String dataSource;
    public final DisplayType displayType;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final int helpContextId;
    public final String hostName;
    public final int miscFlags;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final boolean oleDropAllowed;
    public final OleTypeAllowed oleTypeAllowed;
    public final SizeMode sizeMode;
    public final String sourceDoc;
    public final String sourceItem;
    public final int tabIndex;
    public final TabStop tabStop;
    public final UpdateOptions updateOptions;
    public final int verb;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public OleProperties() {
        this(new Builder());
    }

    private OleProperties(Builder b) {
        this.appearance = b.appearance;
        this.autoActivate = b.autoActivate;
        this.autoVerbMenu = b.autoVerbMenu;
        this.backColor = b.backColor;
        this.backStyle = b.backStyle;
        this.borderStyle = b.borderStyle;
        this.causesValidation = b.causesValidation;
        this.oleClass = b.oleClass;
        this.dataField = b.dataField;
        this.dataSource = b.dataSource;
        this.displayType = b.displayType;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.helpContextId = b.helpContextId;
        this.hostName = b.hostName;
        this.miscFlags = b.miscFlags;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.oleDropAllowed = b.oleDropAllowed;
        this.oleTypeAllowed = b.oleTypeAllowed;
        this.sizeMode = b.sizeMode;
        this.sourceDoc = b.sourceDoc;
        this.sourceItem = b.sourceItem;
        this.tabIndex = b.tabIndex;
        this.tabStop = b.tabStop;
        this.updateOptions = b.updateOptions;
        this.verb = b.verb;
        this.visible = b.visible;
        this.whatsThisHelpId = b.whatsThisHelpId;
        this.height = b.height;
        this.left = b.left;
        this.top = b.top;
        this.width = b.width;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OleProperties)) return false;
        OleProperties that = (OleProperties) o;
        return Objects.equals(appearance, that.appearance)
                && Objects.equals(autoActivate, that.autoActivate)
                && autoVerbMenu == that.autoVerbMenu
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(backStyle, that.backStyle)
                && Objects.equals(borderStyle, that.borderStyle)
                && Objects.equals(causesValidation, that.causesValidation)
                && Objects.equals(oleClass, that.oleClass)
                && Objects.equals(dataField, that.dataField)
                && Objects.equals(dataSource, that.dataSource)
                && Objects.equals(displayType, that.displayType)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && helpContextId == that.helpContextId
                && Objects.equals(hostName, that.hostName)
                && miscFlags == that.miscFlags
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && oleDropAllowed == that.oleDropAllowed
                && Objects.equals(oleTypeAllowed, that.oleTypeAllowed)
                && Objects.equals(sizeMode, that.sizeMode)
                && Objects.equals(sourceDoc, that.sourceDoc)
                && Objects.equals(sourceItem, that.sourceItem)
                && tabIndex == that.tabIndex
                && Objects.equals(tabStop, that.tabStop)
                && Objects.equals(updateOptions, that.updateOptions)
                && verb == that.verb
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(appearance, autoActivate, autoVerbMenu, backColor, backStyle, borderStyle,
                causesValidation, oleClass, dataField, dataSource, displayType, dragIcon, dragMode, enabled,
                helpContextId, hostName, miscFlags, mouseIcon, mousePointer, oleDropAllowed, oleTypeAllowed,
                sizeMode, sourceDoc, sourceItem, tabIndex, tabStop, updateOptions, verb, visible,
                whatsThisHelpId, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Appearance appearance = Appearance.THREE_D;
        public AutoActivate autoActivate = AutoActivate.DOUBLE_CLICK;
        public boolean autoVerbMenu = true;
        public Color backColor = Color.WINDOW_BACKGROUND;
        public BackStyle backStyle = BackStyle.OPAQUE;
        public BorderStyle borderStyle = BorderStyle.FIXED_SINGLE;
        public CausesValidation causesValidation = CausesValidation.YES;
        public String oleClass = null;
        public String dataField = "";
        public String dataSource = "";
        public DisplayType displayType = DisplayType.CONTENT;
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public int helpContextId = 0;
        public String hostName = "";
        public int miscFlags = 0;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public boolean oleDropAllowed = false;
        public OleTypeAllowed oleTypeAllowed = OleTypeAllowed.EITHER;
        public SizeMode sizeMode = SizeMode.CLIP;
        public String sourceDoc = "";
        public String sourceItem = "";
        public int tabIndex = 0;
        public TabStop tabStop = TabStop.INCLUDED;
        public UpdateOptions updateOptions = UpdateOptions.AUTOMATIC;
        public int verb = 0;
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int height = 375;
        public int left = 600;
        public int top = 1200;
        public int width = 1335;

        public OleProperties build() {
            return new OleProperties(this);
        }
    }
}
