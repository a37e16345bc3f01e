package domain.format;

import java.util.Objects;

/**
 * Immutable formatting options: keyword casing and layout style.
 */
public final class FormatOptions {

    private static final FormatOptions DEFAULTS = new FormatOptions(true, FormatStyle.BASIC);

    private final boolean uppercase;
    private final FormatStyle style;

    private FormatOptions(boolean uppercase, FormatStyle style) {
        this.uppercase = uppercase;
        this.style = (style == null) ? FormatStyle.BASIC : style;
    }

    /** Upper-case keywords, {@link FormatStyle#BASIC}. */
    public static FormatOptions defaults() {
        return DEFAULTS;
    }

    public static FormatOptions of(FormatStyle style, boolean uppercase) {
        return new FormatOptions(uppercase, style);
    }

    /** The style with its own default keyword casing. */
    public static FormatOptions forStyle(FormatStyle style) {
        FormatStyle s = (style == null) ? FormatStyle.BASIC : style;
        return new FormatOptions(s.defaultUppercase(), s);
    }

    public boolean isUppercase() {
        return uppercase;
    }

    public FormatStyle getStyle() {
        return style;
    }

    public FormatOptions withUppercase(boolean uppercase) {
        return (uppercase == this.uppercase) ? this : new FormatOptions(uppercase, style);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormatOptions)) return false;
        FormatOptions that = (FormatOptions) o;
        return uppercase == that.uppercase && style == that.style;
    }

    @Override
    public int hashCode() {
        return Objects.hash(uppercase, style);
    }

    @Override
    public String toString() {
        return "FormatOptions{style=" + style.styleName() + ", uppercase=" + uppercase + "}";
    }
}
