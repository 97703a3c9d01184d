package util;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Static table of abbreviations whose dots must not be counted as sentence
 * terminators by {@link TextStats#countSentences(String)}.
 *
 * <p>Keys are lowercase and end in a dot. The weight of an entry is the number
 * of dots it contains; all of them are treated as non-terminating, including
 * the final one.
 *
 * <p>An occurrence must not follow a letter, so {@code "st."} does not match
 * inside {@code "first."}. Digits, dots and whatever comes after are ignored:
 * {@code "5p.m."}, {@code "left.Mr."} and {@code "Dr.Smith"} all match. Entries
 * are tried longest first and a match consumes its span, so {@code "B.C.E."}
 * counts once as {@code "b.c.e."} and never again as {@code "b.c."} or
 * {@code "c.e."}.
 */
public final class Abbreviations {

    private static final List<String> ENTRIES = List.of(
            "u.s.",

            "mr.", "messrs.", "mrs.", "mmes.", "ms.", "dr.", "prof.",
            "capt.", "st.", "revd.", "rev.",

            "jan.", "feb.", "mar.", "apr.", "aug.", "sept.", "oct.", "nov.", "dec.",

            "a.m.", "p.m.", "i.e.", "e.g.", "a.d.", "b.c.", "b.c.e.", "c.e.", "n.b."
    );

    private static final Map<String, Integer> WEIGHTS;

    /**
     * One alternation over every entry, longest first, so the regex engine
     * prefers {@code "b.c.e."} over {@code "b.c."} at the same position.
     */
    private static final Pattern OCCURRENCE;

    static {
        Map<String, Integer> weights = new LinkedHashMap<>();
        for (String abbreviation : ENTRIES) {
            int dots = (int) abbreviation.chars().filter(c -> c == '.').count();
            weights.put(abbreviation, dots);
        }
        WEIGHTS = Collections.unmodifiableMap(weights);

        String alternation = ENTRIES.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        OCCURRENCE = Pattern.compile("(?<!\\p{L})(?:" + alternation + ")", Pattern.CASE_INSENSITIVE);
    }

    private Abbreviations() {
    }

    /**
     * @return read-only view of abbreviation to weight, in table order
     */
    public static Map<String, Integer> table() {
        return WEIGHTS;
    }

    /**
     * @param abbreviation lowercase abbreviation, e.g. {@code "b.c.e."}
     * @return number of dots to subtract per occurrence, or {@code 0} if unknown
     */
    public static int weight(String abbreviation) {
        return WEIGHTS.getOrDefault(abbreviation, 0);
    }

    /**
     * Sums the weights of every abbreviation occurrence in {@code text}.
     *
     * @param text raw text, not {@code null}
     * @return number of dots that belong to abbreviations
     */
    static int dotsIn(String text) {
        Matcher m = OCCURRENCE.matcher(text);
        int dots = 0;
        while (m.find()) {
            dots += weight(m.group().toLowerCase(Locale.ROOT));
        }
        return dots;
    }
}
