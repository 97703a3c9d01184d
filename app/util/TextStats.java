package util;

import models.TextStatistics;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Counting primitives used by {@link services.ReadabilityService} to compute
 * readability formulas.
 * <p>
 * This class exposes five counters and one aggregate builder:
 * <ul>
 *     <li>{@link #countSymbols(String)}</li>
 *     <li>{@link #countCharacters(String)}</li>
 *     <li>{@link #countWords(String)}</li>
 *     <li>{@link #countSentences(String)}</li>
 *     <li>{@link #countSyllables(String)}</li>
 *     <li>{@link #buildAggregateStats(String)}</li>
 * </ul>
 *
 * <p>All counts are taken over Unicode code points, never bytes or UTF-16
 * units. Words are whitespace-delimited tokens; no further tokenizing is done.
 * Syllable counting is an English vowel-group heuristic.
 *
 * <p>This class is stateless, thread-safe, and not intended to be
 * instantiated. A {@code null} text is treated as empty.
 */
public final class TextStats {
    /**
     * A word is a maximal run of non-whitespace code points. {@code \s} covers the
     * ASCII blanks; {@code \p{Z}} and U+0085 add the Unicode separators.
     */
    private static final Pattern TOKEN_RE = Pattern.compile("[^\\s\\p{Z}\\u0085]+");

    private static final String ELLIPSIS = "...";

    /**
     * English vowel set used by the syllable heuristic.
     */
    private static final String VOWELS = "aeiouy";

    /**
     * Prevent instantiation of this utility class.
     */
    private TextStats() {
    }

    /**
     * Counts symbols: every code point except newlines, with each
     * three-dot ellipsis counted once.
     *
     * <p>An ellipsis inside other punctuation (e.g. {@code [...]}) is not
     * treated specially.
     *
     * @param text raw text (may be {@code null})
     * @return number of symbols, {@code 0} for empty input
     */
    public static int countSymbols(String text) {
        if (text == null || text.isEmpty()) return 0;
        int codePoints = text.codePointCount(0, text.length());
        int newLines = countOccurrences(text, "\n");
        int ellipses = countOccurrences(text, ELLIPSIS);
        return codePoints - newLines - 2 * ellipses;
    }

    /**
     * Counts characters, i.e. Unicode letters and decimal digits.
     *
     * @param text raw text (may be {@code null})
     * @return number of letters and digits
     */
    public static int countCharacters(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (int) text.codePoints()
                .filter(cp -> Character.isLetter(cp) || Character.isDigit(cp))
                .count();
    }

    /**
     * Counts whitespace-delimited words after normalizing newlines to spaces.
     * Numbers, contractions and possessives count as one word each.
     *
     * @param text raw text (may be {@code null})
     * @return number of words, {@code 0} for empty or blank input
     */
    public static int countWords(String text) {
        if (text == null || text.isEmpty()) return 0;
        String normalized = text.replace('\n', ' ');
        return (int) TOKEN_RE.matcher(normalized).results().count();
    }

    /**
     * Counts sentence terminators ({@code .}, {@code !}, {@code ?}) and
     * subtracts the dots that belong to known abbreviations
     * (see {@link Abbreviations}).
     *
     * <p>Repeated punctuation such as {@code "?!"} or {@code "..."} is not
     * collapsed, and a terminator does not need trailing whitespace.
     *
     * @param text raw text (may be {@code null})
     * @return number of sentences, never negative
     */
    public static int countSentences(String text) {
        if (text == null || text.isEmpty()) return 0;

        int raw = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.' || c == '!' || c == '?') raw++;
        }
        if (raw == 0) return 0;

        return Math.max(raw - Abbreviations.dotsIn(text), 0);
    }

    /**
     * Counts syllables of a single word with an English heuristic: vowel
     * groups, silent trailing 'e', and suffix corrections for
     * {@code -le/-les}, {@code -ed} and {@code -es}.
     *
     * @param word a single word (may be {@code null})
     * @return syllable count, always {@code >= 1}
     */
    public static int countSyllables(String word) {
        if (word == null || word.isEmpty()) return 1;
        String w = word.toLowerCase(Locale.ROOT);

        int count = 0;
        boolean prevVowel = false;
        for (int i = 0; i < w.length(); i++) {
            boolean isVowel = isVowel(w.charAt(i));
            if (isVowel && !prevVowel) count++;
            prevVowel = isVowel;
        }

        if (w.endsWith("e")) count--;

        int len = w.length();
        if (len > 2) {
            if (w.endsWith("le") || w.endsWith("les")) {
                int before = len - (w.endsWith("le") ? 3 : 4);
                if (before >= 0 && isConsonant(w.charAt(before))) count++;
            } else if (w.endsWith("ed")) {
                char before = w.charAt(len - 3);
                if (before == 't') {
                    count++;
                } else if (isVowel(before)) {
                    count--;
                }
            } else if (w.endsWith("es")) {
                char before = w.charAt(len - 3);
                if (isConsonant(before) && before != 'w' && before != 'x') count++;
            }
        }
        return Math.max(count, 1);
    }

    /**
     * Builds the aggregate statistics for a text, running every counter once
     * on the whole text and {@link #countSyllables(String)} once per token.
     *
     * @param text raw text (may be {@code null})
     * @return a new {@link TextStatistics}
     */
    public static TextStatistics buildAggregateStats(String text) {
        String t = text == null ? "" : text;
        int syllables = TOKEN_RE.matcher(t.replace('\n', ' ')).results()
                .mapToInt(m -> countSyllables(m.group()))
                .sum();
        return new TextStatistics(
                countSymbols(t),
                countCharacters(t),
                countWords(t),
                countSentences(t),
                syllables);
    }

    private static boolean isVowel(char c) {
        return VOWELS.indexOf(c) >= 0;
    }

    // 'y' is in the vowel set, so it never counts as a consonant.
    private static boolean isConsonant(char c) {
        return Character.isLetter(c) && !isVowel(c);
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
