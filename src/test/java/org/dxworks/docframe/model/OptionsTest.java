package org.dxworks.docframe.model;

import org.dxworks.docframe.model.block.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OptionsTest {

    @Test
    void noneIsIdentityOfPlus() {
        Options options = Options.of("intro", List.of("note"), null);

        assertSame(options, options.plus(Options.NONE));
        assertSame(options, Options.NONE.plus(options));
    }

    @Test
    void plusPrefersIdOfRightOperandAndKeepsStyleOrder() {
        Options left = Options.of("left", List.of("a", "b"), null);
        Options right = Options.of("right", List.of("b", "c"), null);

        Options merged = left.plus(right);

        assertEquals("right", merged.id().orElseThrow());
        assertEquals(List.of("a", "b", "c"), merged.styles());
    }

    @Test
    void plusKeepsLeftIdWhenRightHasNone() {
        Options merged = Options.id("left").plus(Options.withStyles("x"));

        assertEquals(Options.of("left", List.of("x"), null), merged);
    }

    @Test
    void emptyOptionsCollapseToNone() {
        assertSame(Options.NONE, Options.of(null, List.of(), null));
        assertSame(Options.NONE, Options.withStyles());
        assertSame(Options.NONE, Options.id("x").withoutId());
        assertTrue(Options.NONE.isEmpty());
    }

    @Test
    void stylesAreDistinct() {
        assertEquals(List.of("a", "b"), Options.withStyles("a", "b", "a").styles());
    }

    @Test
    void toStringListsParts() {
        assertEquals("NoOpt", Options.NONE.toString());
        assertEquals("Id(x) + Styles(a,b)", Options.of("x", List.of("a", "b"), null).toString());
        assertEquals("Fallback(Rule)", Options.fallback(new Rule()).toString());
    }
}
