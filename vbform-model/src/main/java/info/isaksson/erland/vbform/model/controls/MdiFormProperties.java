package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.FormLinkMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.Movability;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.StartUpPosition;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.Visibility;
import info.isaksson.erland.vbform.model.props.WhatsThisHelp;
import info.isaksson.erland.vbform.model.props.WindowState;

import java.util.Objects;

/** MDI parent form properties. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MdiFormProperties {
    public final Appearance appearance;
    public final boolean autoShowChildren;
    public final Color backColor;
    public final String caption;
    public final Activation enabled;
    public final int helpContextId;
    public final PropertyValue icon;
    public final FormLinkMode linkMode;
    public final String linkTopic;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final Movability moveable;
    public final boolean negotiateToolbars;
    public final OleDropMode oleDropMode;
    public final PropertyValue picture;
    public final TextDirection rightToLeft;
    public final boolean scrollBars;
    public final StartUpPosition startUpPosition;
    public final Visibility visible;
    public final WhatsThisHelp whatsThisHelp;
    public final WindowState windowState;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public MdiFormProperties() {
        this(new Builder());
    }

    private MdiFormProperties(Builder b) {
        this.appearance = b.appearance;
        this.autoShowChildren = b.autoShowChildren;
        this.backColor = b.backColor;
        this.caption = b.caption;
        this.enabled = b.enabled;
        this.helpContextId = b.helpContextId;
        this.icon = b.icon;
        this.linkMode = b.linkMode;
        this.linkTopic = b.linkTopic;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.moveable = b.moveable;
        this.negotiateToolbars = b.negotiateToolbars;
        this.oleDropMode = b.oleDropMode;
        this.picture = b.picture;
        this.rightToLeft = b.rightToLeft;
        this.scrollBars = b.scrollBars;
        this.startUpPosition = b.startUpPosition;
        this.visible = b.visible;
        this.whatsThisHelp = b.whatsThisHelp;
        this.windowState = b.windowState;
        this.height = b.height;
        this.left = b.left;
        this.top = b.top;
        this.width = b.width;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MdiFormProperties)) return false;
        MdiFormProperties that = (MdiFormProperties) o;
        return Objects.equals(appearance, that.appearance)
                && autoShowChildren == that.autoShowChildren
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(caption, that.caption)
                && Objects.equals(enabled, that.enabled)
                && helpContextId == that.helpContextId
                && Objects.equals(icon, that.icon)
                && Objects.equals(linkMode, that.linkMode)
                && Objects.equals(linkTopic, that.linkTopic)
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(moveable, that.moveable)
                && negotiateToolbars == that.negotiateToolbars
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(picture, that.picture)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && scrollBars == that.scrollBars
                && Objects.equals(startUpPosition, that.startUpPosition)
                && Objects.equals(visible, that.visible)
                && Objects.equals(whatsThisHelp, that.whatsThisHelp)
                && Objects.equals(windowState, that.windowState)
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(appearance, autoShowChildren, backColor, caption, enabled, helpContextId, icon,
                linkMode, linkTopic, mouseIcon, mousePointer, moveable, negotiateToolbars, oleDropMode,
                picture, rightToLeft, scrollBars, startUpPosition, visible, whatsThisHelp, windowState,
                height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Appearance appearance = Appearance.THREE_D;
        public boolean autoShowChildren = true;
        public Color backColor = Color.APPLICATION_WORKSPACE;
        public String caption = "";
        public Activation enabled = Activation.ENABLED;
        public int helpContextId = 0;
        public PropertyValue icon;
        public FormLinkMode linkMode = FormLinkMode.NONE;
        public String linkTopic = "";
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public Movability moveable = Movability.MOVEABLE;
        public boolean negotiateToolbars = true;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public PropertyValue picture;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public boolean scrollBars = true;
        public StartUpPosition startUpPosition = StartUpPosition.WINDOWS_DEFAULT;
        public Visibility visible = Visibility.VISIBLE;
        public WhatsThisHelp whatsThisHelp = WhatsThisHelp.F1_HELP;
        public WindowState windowState = WindowState.NORMAL;
        public int height = 3600;
        public int left = 0;
        public int top = 0;
        public int width = 4800;

        public MdiFormProperties build() {
            return new MdiFormProperties(this);
        }
    }
}
