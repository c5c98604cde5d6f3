package de.mirkosertic.boolquery.match;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StringMatcher}.
 */
@DisplayName("StringMatcher Tests")
class StringMatcherTest {

    @Test
    @DisplayName("Failure table holds longest proper prefix-suffix lengths")
    void shouldComputeFailureTable() {
        assertThat(new StringMatcher("ababc").getFailureTable()).containsExactly(0, 0, 1, 2, 0);
        assertThat(new StringMatcher("aabaaab").getFailureTable()).containsExactly(0, 1, 0, 1, 2, 2, 3);
        assertThat(new StringMatcher("abc").getFailureTable()).containsExactly(0, 0, 0);
        assertThat(new StringMatcher("aaaa").getFailureTable()).containsExactly(0, 1, 2, 3);
        assertThat(new StringMatcher("x").getFailureTable()).containsExactly(0);
    }

    @Test
    @DisplayName("Failure table cannot be modified through the getter")
    void failureTableShouldBeDefensiveCopy() {
        final StringMatcher matcher = new StringMatcher("abab");
        matcher.getFailureTable()[3] = 42;

        assertThat(matcher.getFailureTable()).containsExactly(0, 0, 1, 2);
        assertThat(matcher.contains("xxabab")).isTrue();
    }

    @Test
    void shouldFindPatternAtStartMiddleAndEnd() {
        final StringMatcher matcher = new StringMatcher("phone");

        assertThat(matcher.contains("phone home")).isTrue();
        assertThat(matcher.contains("my iphone!")).isTrue();
        assertThat(matcher.contains("smartphone")).isTrue();
        assertThat(matcher.contains("phone")).isTrue();
    }

    @Test
    void shouldNotFindMissingPattern() {
        final StringMatcher matcher = new StringMatcher("phone");

        assertThat(matcher.contains("")).isFalse();
        assertThat(matcher.contains("phon")).isFalse();
        assertThat(matcher.contains("p h o n e")).isFalse();
        assertThat(matcher.contains("PHONE")).isFalse();
    }

    @Test
    @DisplayName("Partial matches must fall back instead of skipping an occurrence")
    void shouldHandleOverlappingPartialMatches() {
        assertThat(new StringMatcher("aab").contains("aaab")).isTrue();
        assertThat(new StringMatcher("abab").contains("abaabab")).isTrue();
        assertThat(new StringMatcher("aabaaab").contains("aabaabaaab")).isTrue();
        assertThat(new StringMatcher("abcabd").contains("abcabcabd")).isTrue();
        assertThat(new StringMatcher("abcabd").contains("abcabcabc")).isFalse();
    }

    @Test
    @DisplayName("Pattern longer than text never matches")
    void shouldRejectTextShorterThanPattern() {
        final StringMatcher matcher = new StringMatcher("needle");

        assertThat(matcher.contains("needl")).isFalse();
        assertThat(matcher.contains("n")).isFalse();
    }

    @Test
    @DisplayName("Match ending on the last character is found")
    void shouldFindMatchEndingAtLastCharacter() {
        final StringMatcher matcher = new StringMatcher("aab");

        assertThat(matcher.contains("xaaxaab")).isTrue();
        assertThat(matcher.contains("aaaaaaab")).isTrue();
        assertThat(matcher.contains("aaaaaaaa")).isFalse();
    }

    @Test
    void shouldMatchNonAsciiText() {
        final StringMatcher umlaut = new StringMatcher("Größe");
        assertThat(umlaut.contains("Die Größe zählt")).isTrue();
        assertThat(umlaut.contains("Die Grösse zählt")).isFalse();

        final StringMatcher emoji = new StringMatcher("😀");
        assertThat(emoji.contains("smile 😀!")).isTrue();
        assertThat(emoji.contains("smile 😁!")).isFalse();
    }

    @Test
    void shouldRejectEmptyPattern() {
        assertThatThrownBy(() -> new StringMatcher(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void shouldRejectNullPattern() {
        assertThatThrownBy(() -> new StringMatcher(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Repeated calls give the same answer")
    void shouldBeReusable() {
        final StringMatcher matcher = new StringMatcher("abc");

        for (int i = 0; i < 100; i++) {
            assertThat(matcher.contains("xxabcxx")).isTrue();
            assertThat(matcher.contains("xxabxcx")).isFalse();
        }
    }

    @Test
    @DisplayName("Agrees with a naive scan on random input")
    void shouldAgreeWithNaiveScan() {
        final Random random = new Random(4711);
        final char[] alphabet = {'a', 'b', 'c'};

        for (int round = 0; round < 5_000; round++) {
            final String pattern = randomString(random, alphabet, 1 + random.nextInt(6));
            final String text = randomString(random, alphabet, random.nextInt(30));

            assertThat(new StringMatcher(pattern).contains(text))
                    .as("pattern '%s' in text '%s'", pattern, text)
                    .isEqualTo(naiveContains(text, pattern));
        }
    }

    @Test
    void equalPatternsShouldGiveEqualMatchers() {
        assertThat(new StringMatcher("abc")).isEqualTo(new StringMatcher("abc"));
        assertThat(new StringMatcher("abc")).hasSameHashCodeAs(new StringMatcher("abc"));
        assertThat(new StringMatcher("abc")).isNotEqualTo(new StringMatcher("abd"));
        assertThat(new StringMatcher("abc")).hasToString("StringMatcher[pattern=abc]");
    }

    private static String randomString(final Random random, final char[] alphabet, final int length) {
        final StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(alphabet[random.nextInt(alphabet.length)]);
        }
        return builder.toString();
    }

    private static boolean naiveContains(final String text, final String pattern) {
        for (int start = 0; start + pattern.length() <= text.length(); start++) {
            boolean found = true;
            for (int i = 0; i < pattern.length(); i++) {
                if (text.charAt(start + i) != pattern.charAt(i)) {
                    found = false;
                    break;
                }
            }
            if (found) {
                return true;
            }
        }
        return false;
    }
}
