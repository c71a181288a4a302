package com.jsonflatten.cli.config;

import com.google.gson.annotations.SerializedName;
import com.jsonflatten.core.FlattenOptions;
import com.jsonflatten.core.SeparatorStyle;

/**
 * Deserialized form of a flatten.json configuration file.
 * Every field is optional; absent fields fall back to {@link FlattenOptions#defaults()}.
 */
public class FlattenConfig {

    /** Text prepended to every flattened key (default: ""). */
    @SerializedName("prefix")
    private String prefix;

    /** Predefined style name: dot, path, rails or underscore (default: dot). */
    @SerializedName("style")
    private String style;

    /**
     * Custom separator parts. If any of the three is set they replace {@code style};
     * unset parts are empty.
     */
    @SerializedName("separator_before")
    private String separatorBefore;

    @SerializedName("separator_middle")
    private String separatorMiddle;

    @SerializedName("separator_after")
    private String separatorAfter;

    /** Nesting levels to collapse; 0 keeps the input whole, negative is unlimited (default: -1). */
    @SerializedName("depth")
    private Integer depth;

    /** Keep arrays as values instead of indexing into them (default: false). */
    @SerializedName("preserve_arrays")
    private Boolean preserveArrays;

    /** Indent the output JSON (default: false). */
    @SerializedName("pretty_print")
    private Boolean prettyPrint;

    public String getPrefix()           { return prefix != null ? prefix : ""; }
    public String getStyle()            { return style != null ? style : "dot"; }
    public String getSeparatorBefore()  { return separatorBefore; }
    public String getSeparatorMiddle()  { return separatorMiddle; }
    public String getSeparatorAfter()   { return separatorAfter; }
    public int getDepth()               { return depth != null ? depth : FlattenOptions.UNLIMITED; }
    public boolean isPreserveArrays()   { return preserveArrays != null && preserveArrays; }
    public boolean isPrettyPrint()      { return prettyPrint != null && prettyPrint; }

    public boolean hasCustomSeparator() {
        return separatorBefore != null || separatorMiddle != null || separatorAfter != null;
    }

    /**
     * Resolves the separator style described by this config.
     *
     * @throws IllegalArgumentException if {@code style} names no predefined style
     */
    public SeparatorStyle toSeparatorStyle() {
        if (hasCustomSeparator()) {
            return new SeparatorStyle(separatorBefore, separatorMiddle, separatorAfter);
        }
        return SeparatorStyle.named(getStyle());
    }

    public FlattenOptions toOptions() {
        return new FlattenOptions(getPrefix(), toSeparatorStyle(), getDepth(), isPreserveArrays());
    }
}
