package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.CausesValidation;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.FileAttributeFilter;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.MultiSelect;
import info.isaksson.erland.vbform.model.props.OleDragMode;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.TabStop;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FileListBoxProperties {
    public final Appearance appearance;
    public final FileAttributeFilter archive;
    public final Color backColor;
    public final CausesValidation causesValidation;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final Color foreColor;
    public final int helpContextId;
    public final FileAttributeFilter hidden;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final MultiSelect multiSelect;
    public final FileAttributeFilter normal;
    public final OleDragMode oleDragMode;
    public final OleDropMode oleDropMode;
    public final String pattern;
    public final FileAttributeFilter readOnly;
    public final FileAttributeFilter system;
    public final int tabIndex;
    public final TabStop tabStop;
    public final String toolTipText;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public FileListBoxProperties() {
        this(new Builder());
    }

    private FileListBoxProperties(Builder b) {
        this.appearance = b.appearance;
        this.archive = b.archive;
        this.backColor = b.backColor;
        this.causesValidation = b.causesValidation;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.foreColor = b.foreColor;
        this.helpContextId = b.helpContextId;
        this.hidden = b.hidden;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.multiSelect = b.multiSelect;
        this.normal = b.normal;
        this.oleDragMode = b.oleDragMode;
        this.oleDropMode = b.oleDropMode;
        this.pattern = b.pattern;
        this.readOnly = b.readOnly;
        this.system = b.system;
        this.tabIndex = b.tabIndex;
        this.tabStop = b.tabStop;
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
        if (!(o instanceof FileListBoxProperties)) return false;
        FileListBoxProperties that = (FileListBoxProperties) o;
        return Objects.equals(appearance, that.appearance)
                && Objects.equals(archive, that.archive)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(causesValidation, that.causesValidation)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && Objects.equals(foreColor, that.foreColor)
                && helpContextId == that.helpContextId
                && Objects.equals(hidden, that.hidden)
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(multiSelect, that.multiSelect)
                && Objects.equals(normal, that.normal)
                && Objects.equals(oleDragMode, that.oleDragMode)
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(pattern, that.pattern)
                && Objects.equals(readOnly, that.readOnly)
                && Objects.equals(system, that.system)
                && tabIndex == that.tabIndex
                && Objects.equals(tabStop, that.tabStop)
                && Objects.equals(toolTipText, that.toolTipText)
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(appearance, archive, backColor, causesValidation, dragIcon, dragMode, enabled,
                foreColor, helpContextId, hidden, mouseIcon, mousePointer, multiSelect, normal, oleDragMode,
                oleDropMode, pattern, readOnly, system, tabIndex, tabStop, toolTipText, visible,
                whatsThisHelpId, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Appearance appearance = Appearance.THREE_D;
        public FileAttributeFilter archive = FileAttributeFilter.INCLUDE;
        public Color backColor = Color.WINDOW_BACKGROUND;
        public CausesValidation causesValidation = CausesValidation.YES;
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public Color foreColor = Color.WINDOW_TEXT;
        public int helpContextId = 0;
        public FileAttributeFilter hidden = FileAttributeFilter.EXCLUDE;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public MultiSelect multiSelect = MultiSelect.NONE;
        public FileAttributeFilter normal = FileAttributeFilter.INCLUDE;
        public OleDragMode oleDragMode = OleDragMode.MANUAL;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public String pattern = "*.*";
        public FileAttributeFilter readOnly = FileAttributeFilter.INCLUDE;
        public FileAttributeFilter system = FileAttributeFilter.EXCLUDE;
        public int tabIndex = 0;
        public TabStop tabStop = TabStop.INCLUDED;
        public String toolTipText = "";
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int height = 1260;
        public int left = 710;
        public int top = 480;
        public int width = 735;

        public FileListBoxProperties build() {
            return new FileListBoxProperties(this);
        }
    }
}
