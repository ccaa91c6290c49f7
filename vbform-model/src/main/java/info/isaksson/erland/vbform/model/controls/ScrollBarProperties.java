package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.CausesValidation;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.TabStop;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

/** Shared by horizontal and vertical scroll bars. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ScrollBarProperties {
    public final CausesValidation causesValidation;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final int helpContextId;
    public final int largeChange;
    public final int max;
    public final int min;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final TextDirection rightToLeft;
    public final int smallChange;
    public final int tabIndex;
    public final TabStop tabStop;
    public final int value;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public ScrollBarProperties() {
        this(new Builder());
    }

    private ScrollBarProperties(Builder b) {
        this.causesValidation = b.causesValidation;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.helpContextId = b.helpContextId;
        this.largeChange = b.largeChange;
        this.max = b.max;
        this.min = b.min;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.rightToLeft = b.rightToLeft;
        this.smallChange = b.smallChange;
        this.tabIndex = b.tabIndex;
        this.tabStop = b.tabStop;
        this.value = b.value;
        this.visible = b.visible;
        this.whatsThisHelpId = b.whatsThisHelpId;
        this.height = b.height;
        this.left = b.left;
        this.top = b.top;
        this.width = b.width;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScrollBarProperties)) return false;
        ScrollBarProperties that = (ScrollBarProperties) o;
        return Objects.equals(causesValidation, that.causesValidation)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && helpContextId == that.helpContextId
                && largeChange == that.largeChange
                && max == that.max
                && min == that.min
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && smallChange == that.smallChange
                && tabIndex == that.tabIndex
                && Objects.equals(tabStop, that.tabStop)
                && value == that.value
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(causesValidation, dragIcon, dragMode, enabled, helpContextId, largeChange, max,
                min, mouseIcon, mousePointer, rightToLeft, smallChange, tabIndex, tabStop, value, visible,
                whatsThisHelpId, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public CausesValidation causesValidation = CausesValidation.YES;
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public int helpContextId = 0;
        public int largeChange = 1;
        public int max = 32767;
        public int min = 0;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public int smallChange = 1;
        public int tabIndex = 0;
        public TabStop tabStop = TabStop.INCLUDED;
        public int value = 0;
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int height = 30;
        public int left = 30;
        public int top = 30;
        public int width = 100;

        public ScrollBarProperties build() {
            return new ScrollBarProperties(this);
        }
    }
}
