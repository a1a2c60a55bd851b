package org.dxworks.docframe.model.block;

import java.util.Objects;

/**
 * The format of enumerated list items, like {@code (a)} or {@code 1.}.
 */
public record EnumFormat(EnumType type, String prefix, String suffix) {

    public static final EnumFormat DEFAULT = new EnumFormat(EnumType.ARABIC, "", ".");

    public EnumFormat {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(suffix, "suffix");
    }

    @Override
    public String toString() {
        return "EnumFormat(" + type + "," + prefix + "N" + suffix + ")";
    }
}
