package org.dxworks.docframe.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Options of a {@link Customizable} element: an optional id, style names and an optional
 * fallback element for renderers that do not know the element type.
 * <p>
 * Options combine with {@link #plus(Options)}; {@link #NONE} is the identity of that operation.
 */
public final class Options {

    public static final Options NONE = new Options(null, List.of(), null);

    private final String id;
    private final List<String> styles;
    private final Element fallback;

    private Options(String id, List<String> styles, Element fallback) {
        this.id = id;
        this.styles = styles;
        this.fallback = fallback;
    }

    public static Options of(String id, List<String> styles, Element fallback) {
        List<String> distinct = List.copyOf(new LinkedHashSet<>(styles));
        if (id == null && distinct.isEmpty() && fallback == null) {
            return NONE;
        }
        return new Options(id, distinct, fallback);
    }

    public static Options id(String id) {
        return of(Objects.requireNonNull(id, "id"), List.of(), null);
    }

    public static Options withStyles(String... styles) {
        return of(null, Arrays.asList(styles), null);
    }

    public static Options fallback(Element fallback) {
        return of(null, List.of(), Objects.requireNonNull(fallback, "fallback"));
    }

    public Optional<String> id() {
        return Optional.ofNullable(id);
    }

    public List<String> styles() {
        return styles;
    }

    public Optional<Element> fallback() {
        return Optional.ofNullable(fallback);
    }

    public boolean isEmpty() {
        return this == NONE;
    }

    /**
     * Merges these options with the given ones. Id and fallback of {@code other} win when
     * present, styles keep the order in which they were first seen.
     */
    public Options plus(Options other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;

        List<String> merged = new ArrayList<>(styles);
        merged.addAll(other.styles);
        return of(other.id != null ? other.id : id, merged, other.fallback != null ? other.fallback : fallback);
    }

    public Options withoutId() {
        return of(null, styles, fallback);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Options)) return false;
        Options other = (Options) o;
        return Objects.equals(id, other.id) && styles.equals(other.styles) && Objects.equals(fallback, other.fallback);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, styles, fallback);
    }

    @Override
    public String toString() {
        if (isEmpty()) return "NoOpt";
        List<String> parts = new ArrayList<>();
        if (id != null) parts.add("Id(" + id + ")");
        if (!styles.isEmpty()) parts.add("Styles(" + String.join(",", styles) + ")");
        if (fallback != null) parts.add("Fallback(" + fallback.getClass().getSimpleName() + ")");
        return String.join(" + ", parts);
    }
}
