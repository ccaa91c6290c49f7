package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.MenuShortcut;
import info.isaksson.erland.vbform.model.props.NegotiatePosition;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

/** A menu item. Sub-menus are held by {@link info.isaksson.erland.vbform.model.ControlKind.Menu}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MenuProperties {
    public final String caption;
    public final boolean checked;
    public final Activation enabled;
    public final int helpContextId;
    public final NegotiatePosition negotiatePosition;
    /** {@code null} when the item has no accelerator. */
    public final MenuShortcut shortcut;
    public final Visibility visible;
    public final boolean windowList;

    /** All properties at their IDE defaults. */
    public MenuProperties() {
        this(new Builder());
    }

    private MenuProperties(Builder b) {
        this.caption = b.caption;
        this.checked = b.checked;
        this.enabled = b.enabled;
        this.helpContextId = b.helpContextId;
        this.negotiatePosition = b.negotiatePosition;
        this.shortcut = b.shortcut;
        this.visible = b.visible;
        this.windowList = b.windowList;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MenuProperties)) return false;
        MenuProperties that = (MenuProperties) o;
        return Objects.equals(caption, that.caption)
                && checked == that.checked
                && Objects.equals(enabled, that.enabled)
                && helpContextId == that.helpContextId
                && Objects.equals(negotiatePosition, that.negotiatePosition)
                && Objects.equals(shortcut, that.shortcut)
                && Objects.equals(visible, that.visible)
                && windowList == that.windowList;
    }

    @Override public int hashCode() {
        return Objects.hash(caption, checked, enabled, helpContextId, negotiatePosition, shortcut, visible,
                windowList);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public String caption = "";
        public boolean checked = false;
        public Activation enabled = Activation.ENABLED;
        public int helpContextId = 0;
        public NegotiatePosition negotiatePosition = NegotiatePosition.NONE;
        public MenuShortcut shortcut = null;
        public Visibility visible = Visibility.VISIBLE;
        public boolean windowList = false;

        public MenuProperties build() {
            return new MenuProperties(this);
        }
    }
}
