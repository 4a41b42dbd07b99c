package com.layeredconfig.core.key;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link KeyPathParser}.
 */
class KeyPathParserTest {

    @Test
    @DisplayName("Should not split a key starting with a letter or digit")
    void shouldKeepAlphanumericKeyWhole() {
        assertThat(KeyPathParser.split("a.b.c")).containsExactly("a.b.c");
        assertThat(KeyPathParser.split("1/2")).containsExactly("1/2");
    }

    @Test
    @DisplayName("Should use the first character as delimiter")
    void shouldSplitOnLeadingDelimiter() {
        assertThat(KeyPathParser.split(".a.b.c")).containsExactly("a", "b", "c");
        assertThat(KeyPathParser.split("/a/b/c")).containsExactly("a", "b", "c");
        assertThat(KeyPathParser.split("→a→b")).containsExactly("a", "b");
        assertThat(KeyPathParser.split(":a.b:c")).containsExactly("a.b", "c");
    }

    @Test
    @DisplayName("Should keep trailing empty segments")
    void shouldKeepTrailingEmptySegments() {
        assertThat(KeyPathParser.split(".a.")).containsExactly("a", "");
        assertThat(KeyPathParser.split(".")).containsExactly("");
    }

    @Test
    @DisplayName("Should treat an escaped delimiter as part of the segment")
    void shouldHonourEscapedDelimiter() {
        assertThat(KeyPathParser.split(".a.b\\.c")).containsExactly("a", "b.c");
        assertThat(KeyPathParser.split("/x\\/y/z")).containsExactly("x/y", "z");
    }

    @Test
    @DisplayName("Should reject an escaped escape")
    void shouldRejectDoubledEscape() {
        assertThatThrownBy(() -> KeyPathParser.split(".a\\\\.b"))
                .isInstanceOf(MalformedKeyException.class)
                .hasMessageContaining("not yet supported");
    }

    @Test
    @DisplayName("Should reject the sentinel character when escaping")
    void shouldRejectSentinelCollision() {
        assertThatThrownBy(() -> KeyPathParser.split(".a\r.b\\.c"))
                .isInstanceOf(MalformedKeyException.class);
    }

    @Test
    @DisplayName("Should allow the sentinel character when nothing is escaped")
    void shouldAllowSentinelWithoutEscapes() {
        assertThat(KeyPathParser.split(".a\r.b")).containsExactly("a\r", "b");
    }

    @Test
    @DisplayName("Should take iterables and arrays as segments")
    void shouldAcceptSequences() {
        assertThat(KeyPathParser.split(List.of("a", 1, "b"))).containsExactly("a", 1, "b");
        assertThat(KeyPathParser.split(new Object[] {"x", "y"})).containsExactly("x", "y");
    }

    @Test
    @DisplayName("Should wrap other scalars as a single segment")
    void shouldWrapScalars() {
        assertThat(KeyPathParser.split(5)).containsExactly(5);
        assertThat(KeyPathParser.split("")).containsExactly("");
    }

    @Test
    @DisplayName("Should render segments that split back to the same path")
    void shouldJoinWithEscapes() {
        List<Object> segments = List.of("a", "b.c", 0);

        String joined = KeyPathParser.join(segments, '.');

        assertThat(joined).isEqualTo(".a.b\\.c.0");
        assertThat(KeyPathParser.split(joined)).containsExactly("a", "b.c", "0");
    }
}
