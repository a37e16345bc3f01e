package domain.format;

/**
 * Available layout styles.
 */
public enum FormatStyle {

    /** block layout, 4-space indent, trailing commas */
    BASIC("basic", true),
    /** block layout, 2-space indent, trailing commas */
    STREAMLINE("streamline", false),
    /** block layout, 4-space indent, leading commas */
    DATAOPS("dataops", true),
    /** right-aligned clause keywords, leading commas */
    ALIGNED("aligned", true);

    private final String styleName;
    private final boolean defaultUppercase;

    FormatStyle(String styleName, boolean defaultUppercase) {
        this.styleName = styleName;
        this.defaultUppercase = defaultUppercase;
    }

    /** Lower-case name used on the command line and by bindings. */
    public String styleName() {
        return styleName;
    }

    /** Keyword casing the command line uses when neither casing flag is given. */
    public boolean defaultUppercase() {
        return defaultUppercase;
    }

    /**
     * Exact (case-sensitive) match on {@link #styleName()}.
     *
     * @return the style, or {@code null} for an unknown name
     */
    public static FormatStyle lookup(String name) {
        if (name == null) return null;
        for (FormatStyle s : values()) {
            if (s.styleName.equals(name)) return s;
        }
        return null;
    }

    /** Like {@link #lookup(String)} but unknown names fall back to {@link #BASIC}. */
    public static FormatStyle fromName(String name) {
        FormatStyle s = lookup(name);
        return (s == null) ? BASIC : s;
    }

    SqlLayout newLayout(FormatterState state) {
        switch (this) {
            case STREAMLINE:
                return new BlockIndentedLayout(state, 2, CommaPlacement.TRAILING);
            case DATAOPS:
                return new BlockIndentedLayout(state, 4, CommaPlacement.LEADING);
            case ALIGNED:
                return new ColumnAlignedLayout(state);
            case BASIC:
            default:
                return new BlockIndentedLayout(state, 4, CommaPlacement.TRAILING);
        }
    }
}
