package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.props.Activation;

import java.util.Objects;

/** A timer. Only design-time position, interval and enabled state are stored. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TimerProperties {
    public final Activation enabled;
    public final int interval;
    public final int left;
    public final int top;

    /** All properties at their IDE defaults. */
    public TimerProperties() {
        this(new Builder());
    }

    private TimerProperties(Builder b) {
        this.enabled = b.enabled;
        this.interval = b.interval;
        this.left = b.left;
        this.top = b.top;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimerProperties)) return false;
        TimerProperties that = (TimerProperties) o;
        return Objects.equals(enabled, that.enabled)
                && interval == that.interval
                && left == that.left
                && top == that.top;
    }

    @Override public int hashCode() {
        return Objects.hash(enabled, interval, left, top);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Activation enabled = Activation.ENABLED;
        public int interval = 0;
        public int left = 0;
        public int top = 0;

        public TimerProperties build() {
            return new TimerProperties(this);
        }
    }
}
