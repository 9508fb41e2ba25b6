package com.abt.mixfix.term;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Name identity and display.
 */
class NameTest {

    @Test
    void testPlainNameHasNoDisambiguator() {
        Name x = Name.plain("x");

        assertThat(x.hasDisambiguator()).isFalse();
        assertThat(x.toString()).isEqualTo("x");
        assertThat(x).isEqualTo(Name.plain("x"));
    }

    @Test
    void testFreshNamesAreDistinct() {
        Name a = Name.fresh("x");
        Name b = Name.fresh("x");

        assertThat(a).isNotEqualTo(b);
        assertThat(a.getTag()).isEqualTo(b.getTag());
        assertThat(b.getDisambiguator()).isGreaterThan(a.getDisambiguator());
    }

    @Test
    void testFreshKeepsTag() {
        Name y = Name.plain("y");
        Name renamed = y.fresh();

        assertThat(renamed.getTag()).isEqualTo("y");
        assertThat(renamed).isNotEqualTo(y);
        assertThat(renamed.toString()).isEqualTo("y@" + renamed.getDisambiguator());
    }

    @Test
    void testSameTagDifferentDisambiguatorIsDifferentName() {
        assertThat(Name.plain("x").withDisambiguator(3L)).isNotEqualTo(Name.plain("x").withDisambiguator(4L));
        assertThat(Name.plain("x").withDisambiguator(3L)).isEqualTo(Name.plain("x").withDisambiguator(3L));
    }
}
