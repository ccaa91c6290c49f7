package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.AutoRedraw;
import info.isaksson.erland.vbform.model.props.ClipControls;
import info.isaksson.erland.vbform.model.props.DrawMode;
import info.isaksson.erland.vbform.model.props.DrawStyle;
import info.isaksson.erland.vbform.model.props.FillStyle;
import info.isaksson.erland.vbform.model.props.FontTransparency;
import info.isaksson.erland.vbform.model.props.FormBorderStyle;
import info.isaksson.erland.vbform.model.props.FormLinkMode;
import info.isaksson.erland.vbform.model.props.HasDeviceContext;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.Movability;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.PaletteMode;
import info.isaksson.erland.vbform.model.props.ScaleMode;
import info.isaksson.erland.vbform.model.props.ShowInTaskbar;
import info.isaksson.erland.vbform.model.props.StartUpPosition;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.TitleBarButton;
import info.isaksson.erland.vbform.model.props.Visibility;
import info.isaksson.erland.vbform.model.props.WhatsThisButton;
import info.isaksson.erland.vbform.model.props.WhatsThisHelp;
import info.isaksson.erland.vbform.model.props.WindowState;

import java.util.Objects;

/** Form properties. Controls and menus are held by {@link info.isaksson.erland.vbform.model.ControlKind.Form}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FormProperties {
    public final Appearance appearance;
    public final AutoRedraw autoRedraw;
    public final Color backColor;
    public final FormBorderStyle borderStyle;
    public final String caption;
    public final int clientHeight;
    public final int clientLeft;
    public final int clientTop;
    public final int clientWidth;
    public final ClipControls clipControls;
    public final TitleBarButton controlBox;
    public final DrawMode drawMode;
    public final DrawStyle drawStyle;
    public final int drawWidth;
    public final Activation enabled;
    public final Color fillColor;
    public final FillStyle fillStyle;
    public final FontTransparency fontTransparent;
    public final Color foreColor;
    public final HasDeviceContext hasDc;
    public final int helpContextId;
    public final PropertyValue icon;
    public final boolean keyPreview;
    public final FormLinkMode linkMode;
    public final String linkTopic;
    public final TitleBarButton maxButton;
    public final boolean mdiChild;
    public final TitleBarButton minButton;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final Movability moveable;
    public final boolean negotiateMenus;
    public final OleDropMode oleDropMode;
    public final PropertyValue palette;
    public final PaletteMode paletteMode;
    public final PropertyValue picture;
    public final TextDirection rightToLeft;
    public final int scaleHeight;
    public final int scaleLeft;
    public final ScaleMode scaleMode;
    public final int scaleTop;
    public final int scaleWidth;
    public final ShowInTaskbar showInTaskbar;
    /** Combines {@code StartUpPosition} with the {@code Client*} geometry it depends on. */
    public final StartUpPosition startUpPosition;
    public final Visibility visible;
    public final WhatsThisButton whatsThisButton;
    public final WhatsThisHelp whatsThisHelp;
    public final WindowState windowState;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public FormProperties() {
        this(new Builder());
    }

    private FormProperties(Builder b) {
        this.appearance = b.appearance;
        this.autoRedraw = b.autoRedraw;
        this.backColor = b.backColor;
        this.borderStyle = b.borderStyle;
        this.caption = b.caption;
        this.clientHeight = b.clientHeight;
        this.clientLeft = b.clientLeft;
        this.clientTop = b.clientTop;
        this.clientWidth = b.clientWidth;
        this.clipControls = b.clipControls;
        this.controlBox = b.controlBox;
        this.drawMode = b.drawMode;
        this.drawStyle = b.drawStyle;
        this.drawWidth = b.drawWidth;
        this.enabled = b.enabled;
        this.fillColor = b.fillColor;
        this.fillStyle = b.fillStyle;
        this.fontTransparent = b.fontTransparent;
        this.foreColor = b.foreColor;
        this.hasDc = b.hasDc;
        this.helpContextId = b.helpContextId;
        this.icon = b.icon;
        this.keyPreview = b.keyPreview;
        this.linkMode = b.linkMode;
        this.linkTopic = b.linkTopic;
        this.maxButton = b.maxButton;
        this.mdiChild = b.mdiChild;
        this.minButton = b.minButton;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.moveable = b.moveable;
        this.negotiateMenus = b.negotiateMenus;
        this.oleDropMode = b.oleDropMode;
        this.palette = b.palette;
        this.paletteMode = b.paletteMode;
        this.picture = b.picture;
        this.rightToLeft = b.rightToLeft;
        this.scaleHeight = b.scaleHeight;
        this.scaleLeft = b.scaleLeft;
        this.scaleMode = b.scaleMode;
        this.scaleTop = b.scaleTop;
        this.scaleWidth = b.scaleWidth;
        this.showInTaskbar = b.showInTaskbar;
        this.startUpPosition = b.startUpPosition;
        this.visible = b.visible;
        this.whatsThisButton = b.whatsThisButton;
        this.whatsThisHelp = b.whatsThisHelp;
        this.windowState = b.windowState;
        this.height = b.height;
        this.left = b.left;
        this.top = b.top;
        this.width = b.width;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormProperties)) return false;
        FormProperties that = (FormProperties) o;
        return Objects.equals(appearance, that.appearance)
                && Objects.equals(autoRedraw, that.autoRedraw)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(borderStyle, that.borderStyle)
                && Objects.equals(caption, that.caption)
                && clientHeight == that.clientHeight
                && clientLeft == that.clientLeft
                && clientTop == that.clientTop
                && clientWidth == that.clientWidth
                && Objects.equals(clipControls, that.clipControls)
                && Objects.equals(controlBox, that.controlBox)
                && Objects.equals(drawMode, that.drawMode)
                && Objects.equals(drawStyle, that.drawStyle)
                && drawWidth == that.drawWidth
                && Objects.equals(enabled, that.enabled)
                && Objects.equals(fillColor, that.fillColor)
                && Objects.equals(fillStyle, that.fillStyle)
                && Objects.equals(fontTransparent, that.fontTransparent)
                && Objects.equals(foreColor, that.foreColor)
                && Objects.equals(hasDc, that.hasDc)
                && helpContextId == that.helpContextId
                && Objects.equals(icon, that.icon)
                && keyPreview == that.keyPreview
                && Objects.equals(linkMode, that.linkMode)
                && Objects.equals(linkTopic, that.linkTopic)
                && Objects.equals(maxButton, that.maxButton)
                && mdiChild == that.mdiChild
                && Objects.equals(minButton, that.minButton)
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(moveable, that.moveable)
                && negotiateMenus == that.negotiateMenus
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(palette, that.palette)
                && Objects.equals(paletteMode, that.paletteMode)
                && Objects.equals(picture, that.picture)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && scaleHeight == that.scaleHeight
                && scaleLeft == that.scaleLeft
                && Objects.equals(scaleMode, that.scaleMode)
                && scaleTop == that.scaleTop
                && scaleWidth == that.scaleWidth
                && Objects.equals(showInTaskbar, that.showInTaskbar)
                && Objects.equals(startUpPosition, that.startUpPosition)
                && Objects.equals(visible, that.visible)
                && Objects.equals(whatsThisButton, that.whatsThisButton)
                && Objects.equals(whatsThisHelp, that.whatsThisHelp)
                && Objects.equals(windowState, that.windowState)
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(appearance, autoRedraw, backColor, borderStyle, caption, clientHeight,
                clientLeft, clientTop, clientWidth, clipControls, controlBox, drawMode, drawStyle, drawWidth,
                enabled, fillColor, fillStyle, fontTransparent, foreColor, hasDc, helpContextId, icon,
                keyPreview, linkMode, linkTopic, maxButton, mdiChild, minButton, mouseIcon, mousePointer,
                moveable, negotiateMenus, oleDropMode, palette, paletteMode, picture, rightToLeft,
                scaleHeight, scaleLeft, scaleMode, scaleTop, scaleWidth, showInTaskbar, startUpPosition,
                visible, whatsThisButton, whatsThisHelp, windowState, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Appearance appearance = Appearance.THREE_D;
        public AutoRedraw autoRedraw = AutoRedraw.MANUAL;
        public Color backColor = Color.BUTTON_FACE;
        public FormBorderStyle borderStyle = FormBorderStyle.SIZABLE;
        public String caption = "Form1";
        public int clientHeight = 200;
        public int clientLeft = 0;
        public int clientTop = 0;
        public int clientWidth = 300;
        public ClipControls clipControls = ClipControls.CLIPPED;
        public TitleBarButton controlBox = TitleBarButton.INCLUDED;
        public DrawMode drawMode = DrawMode.COPY_PEN;
        public DrawStyle drawStyle = DrawStyle.SOLID;
        public int drawWidth = 1;
        public Activation enabled = Activation.ENABLED;
        public Color fillColor = Color.SCROLL_BARS;
        public FillStyle fillStyle = FillStyle.TRANSPARENT;
        public FontTransparency fontTransparent = FontTransparency.TRANSPARENT;
        public Color foreColor = Color.BUTTON_TEXT;
        public HasDeviceContext hasDc = HasDeviceContext.YES;
        public int helpContextId = 0;
        public PropertyValue icon;
        public boolean keyPreview = false;
        public FormLinkMode linkMode = FormLinkMode.NONE;
        public String linkTopic = "";
        public TitleBarButton maxButton = TitleBarButton.INCLUDED;
        public boolean mdiChild = false;
        public TitleBarButton minButton = TitleBarButton.INCLUDED;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public Movability moveable = Movability.MOVEABLE;
        public boolean negotiateMenus = true;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public PropertyValue palette;
        public PaletteMode paletteMode = PaletteMode.HALF_TONE;
        public PropertyValue picture;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public int scaleHeight = 240;
        public int scaleLeft = 0;
        public ScaleMode scaleMode = ScaleMode.TWIP;
        public int scaleTop = 0;
        public int scaleWidth = 240;
        public ShowInTaskbar showInTaskbar = ShowInTaskbar.SHOW;
        public StartUpPosition startUpPosition = StartUpPosition.WINDOWS_DEFAULT;
        public Visibility visible = Visibility.VISIBLE;
        public WhatsThisButton whatsThisButton = WhatsThisButton.EXCLUDED;
        public WhatsThisHelp whatsThisHelp = WhatsThisHelp.F1_HELP;
        public WindowState windowState = WindowState.NORMAL;
        public int height = 240;
        public int left = 0;
        public int top = 0;
        public int width = 240;

        public FormProperties build() {
            return new FormProperties(this);
        }
    }
}
