package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Align;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.AutoRedraw;
import info.isaksson.erland.vbform.model.props.AutoSize;
import info.isaksson.erland.vbform.model.props.BorderStyle;
import info.isaksson.erland.vbform.model.props.CausesValidation;
import info.isaksson.erland.vbform.model.props.ClipControls;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.DrawMode;
import info.isaksson.erland.vbform.model.props.DrawStyle;
import info.isaksson.erland.vbform.model.props.FillStyle;
import info.isaksson.erland.vbform.model.props.FontTransparency;
import info.isaksson.erland.vbform.model.props.HasDeviceContext;
import info.isaksson.erland.vbform.model.props.LinkMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.OleDragMode;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.ScaleMode;
import info.isaksson.erland.vbform.model.props.TabStop;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

/** Picture box properties. A picture box is a container; its children are held by {@link info.isaksson.erland.vbform.model.ControlKind.PictureBox}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PictureBoxProperties {
    public final Align align;
    public final Appearance appearance;
    public final AutoRedraw autoRedraw;
    public final AutoSize autoSize;
    public final Color backColor;
    public final BorderStyle borderStyle;
    public final CausesValidation causesValidation;
    public final ClipControls clipControls;
    public final String dataField;
    public final String dataFormat;
    public final String dataMember;
    public final String dataSource;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
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
    public final String linkItem;
    public final LinkMode linkMode;
    public final int linkTimeout;
    public final String linkTopic;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final boolean negotiate;
    public final OleDragMode oleDragMode;
    public final OleDropMode oleDropMode;
    public final PropertyValue picture;
    public final TextDirection rightToLeft;
    public final int scaleHeight;
    public final int scaleLeft;
    public final ScaleMode scaleMode;
    public final int scaleTop;
    public final int scaleWidth;
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
    public PictureBoxProperties() {
        this(new Builder());
    }

    private PictureBoxProperties(Builder b) {
        this.align = b.align;
        this.appearance = b.appearance;
        this.autoRedraw = b.autoRedraw;
        this.autoSize = b.autoSize;
        this.backColor = b.backColor;
        this.borderStyle = b.borderStyle;
        this.causesValidation = b.causesValidation;
        this.clipControls = b.clipControls;
        this.dataField = b.dataField;
        this.dataFormat = b.dataFormat;
        this.dataMember = b.dataMember;
        this.dataSource = b.dataSource;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
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
        this.linkItem = b.linkItem;
        this.linkMode = b.linkMode;
        this.linkTimeout = b.linkTimeout;
        this.linkTopic = b.linkTopic;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.negotiate = b.negotiate;
        this.oleDragMode = b.oleDragMode;
        this.oleDropMode = b.oleDropMode;
        this.picture = b.picture;
        this.rightToLeft = b.rightToLeft;
        this.scaleHeight = b.scaleHeight;
        this.scaleLeft = b.scaleLeft;
        this.scaleMode = b.scaleMode;
        this.scaleTop = b.scaleTop;
        this.scaleWidth = b.scaleWidth;
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
        if (!(o instanceof PictureBoxProperties)) return false;
        PictureBoxProperties that = (PictureBoxProperties) o;
        return Objects.equals(align, that.align)
                && Objects.equals(appearance, that.appearance)
                && Objects.equals(autoRedraw, that.autoRedraw)
                && Objects.equals(autoSize, that.autoSize)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(borderStyle, that.borderStyle)
                && Objects.equals(causesValidation, that.causesValidation)
                && Objects.equals(clipControls, that.clipControls)
                && Objects.equals(dataField, that.dataField)
                && Objects.equals(dataFormat, that.dataFormat)
                && Objects.equals(dataMember, that.dataMember)
                && Objects.equals(dataSource, that.dataSource)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
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
                && Objects.equals(linkItem, that.linkItem)
                && Objects.equals(linkMode, that.linkMode)
                && linkTimeout == that.linkTimeout
                && Objects.equals(linkTopic, that.linkTopic)
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && negotiate == that.negotiate
                && Objects.equals(oleDragMode, that.oleDragMode)
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(picture, that.picture)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && scaleHeight == that.scaleHeight
                && scaleLeft == that.scaleLeft
                && Objects.equals(scaleMode, that.scaleMode)
                && scaleTop == that.scaleTop
                && scaleWidth == that.scaleWidth
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
        return Objects.hash(align, appearance, autoRedraw, autoSize, backColor, borderStyle,
                causesValidation, clipControls, dataField, dataFormat, dataMember, dataSource, dragIcon,
                dragMode, drawMode, drawStyle, drawWidth, enabled, fillColor, fillStyle, fontTransparent,
                foreColor, hasDc, helpContextId, linkItem, linkMode, linkTimeout, linkTopic, mouseIcon,
                mousePointer, negotiate, oleDragMode, oleDropMode, picture, rightToLeft, scaleHeight,
                scaleLeft, scaleMode, scaleTop, scaleWidth, tabIndex, tabStop, toolTipText, visible,
                whatsThisHelpId, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Align align = Align.NONE;
        public Appearance appearance = Appearance.THREE_D;
        public AutoRedraw autoRedraw = AutoRedraw.MANUAL;
        public AutoSize autoSize = AutoSize.FIXED;
        public Color backColor = Color.BUTTON_FACE;
        public BorderStyle borderStyle = BorderStyle.FIXED_SINGLE;
        public CausesValidation causesValidation = CausesValidation.YES;
        public ClipControls clipControls = ClipControls.CLIPPED;
        public String dataField = "";
        public String dataFormat = "";
        public String dataMember = "";
        public String dataSource = "";
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
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
        public String linkItem = "";
        public LinkMode linkMode = LinkMode.NONE;
        public int linkTimeout = 50;
        public String linkTopic = "";
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public boolean negotiate = false;
        public OleDragMode oleDragMode = OleDragMode.MANUAL;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public PropertyValue picture;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public int scaleHeight = 100;
        public int scaleLeft = 0;
        public ScaleMode scaleMode = ScaleMode.TWIP;
        public int scaleTop = 0;
        public int scaleWidth = 100;
        public int tabIndex = 0;
        public TabStop tabStop = TabStop.INCLUDED;
        public String toolTipText = "";
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int height = 30;
        public int left = 30;
        public int top = 30;
        public int width = 100;

        public PictureBoxProperties build() {
            return new PictureBoxProperties(this);
        }
    }
}
