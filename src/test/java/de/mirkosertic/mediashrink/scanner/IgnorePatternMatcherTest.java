package de.mirkosertic.mediashrink.scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IgnorePatternMatcher Tests")
class IgnorePatternMatcherTest {

    @Test
    @DisplayName("Unanchored patterns match at any depth")
    void unanchoredMatchesAnywhere() {
        final IgnorePatternMatcher matcher = new IgnorePatternMatcher(List.of("*.sample.mkv"));

        assertThat(matcher.isIgnored("movie.sample.mkv", false)).isTrue();
        assertThat(matcher.isIgnored("Movies/Alien/alien.sample.mkv", false)).isTrue();
        assertThat(matcher.isIgnored("Movies/Alien/alien.mkv", false)).isFalse();
    }

    @Test
    @DisplayName("Anchored patterns only match relative to the root")
    void anchoredMatchesFromRoot() {
        final IgnorePatternMatcher matcher = new IgnorePatternMatcher(List.of("/Downloads/*.mkv"));

        assertThat(matcher.isIgnored("Downloads/a.mkv", false)).isTrue();
        assertThat(matcher.isIgnored("Movies/Downloads/a.mkv", false)).isFalse();
    }

    @Test
    @DisplayName("Directory patterns ignore everything below the directory")
    void directoryPatterns() {
        final IgnorePatternMatcher matcher = new IgnorePatternMatcher(List.of("Extras/"));

        assertThat(matcher.isIgnored("Extras", true)).isTrue();
        assertThat(matcher.isIgnored("Movies/Alien/Extras/making-of.mkv", false)).isTrue();
        assertThat(matcher.isIgnored("Extras", false))
                .as("A file named like the directory is not ignored")
                .isFalse();
    }

    @Test
    @DisplayName("Negation re-includes files and the last matching line wins")
    void negation() {
        final IgnorePatternMatcher matcher = new IgnorePatternMatcher(List.of("*.ts", "!keep.ts"));

        assertThat(matcher.isIgnored("record.ts", false)).isTrue();
        assertThat(matcher.isIgnored("Shows/keep.ts", false)).isFalse();
    }

    @Test
    @DisplayName("Comments and blank lines are skipped")
    void commentsAndBlanks() {
        final IgnorePatternMatcher matcher = new IgnorePatternMatcher(List.of("# comment", "   ", ""));

        assertThat(matcher.isEmpty()).isTrue();
        assertThat(matcher.isIgnored("anything.mkv", false)).isFalse();
    }

    @Test
    @DisplayName("Invalid globs are rejected")
    void invalidGlob() {
        assertThatThrownBy(() -> new IgnorePatternMatcher(List.of("[abc")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
