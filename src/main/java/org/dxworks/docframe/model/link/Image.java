package org.dxworks.docframe.model.link;

import org.dxworks.docframe.model.Link;
import org.dxworks.docframe.model.Options;

import java.util.Objects;

/**
 * An inline image with a text description and an optional title.
 */
public record Image(String text, String url, String title, Options options) implements Link {

    public Image {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(options, "options");
    }

    public Image(String text, String url) {
        this(text, url, null, Options.NONE);
    }
}
