package util;

import models.GradeBand;

import java.util.Map;

/**
 * Maps an Automated Readability Index score to the reader age range and US
 * grade level it corresponds to.
 *
 * <p>Scores 1-14 come from the table, anything above 14 is
 * {@link #PROFESSOR}, and everything else is {@link #UNKNOWN}. The grade
 * labels are kept exactly as published by the scoring tool, spelling included.
 */
public final class GradeTable {

    public static final GradeBand PROFESSOR = new GradeBand("22+", "Professor level");
    public static final GradeBand UNKNOWN = new GradeBand("Unknown", "Unknown");

    private static final int HIGHEST_SCORE = 14;

    private static final Map<Integer, GradeBand> BANDS = Map.ofEntries(
            Map.entry(1, new GradeBand("5-6", "Kindengarden")),
            Map.entry(2, new GradeBand("6-7", "First Grade")),
            Map.entry(3, new GradeBand("7-8", "Second Grade")),
            Map.entry(4, new GradeBand("8-9", "Third Grade")),
            Map.entry(5, new GradeBand("9-10", "Forth Grade")),
            Map.entry(6, new GradeBand("10-11", "Fifth Grade")),
            Map.entry(7, new GradeBand("11-12", "Sixth Grade")),
            Map.entry(8, new GradeBand("12-13", "Seventh Grade")),
            Map.entry(9, new GradeBand("13-14", "Eighth Grade")),
            Map.entry(10, new GradeBand("14-15", "Ninth Grade")),
            Map.entry(11, new GradeBand("15-16", "Tenth Grade")),
            Map.entry(12, new GradeBand("16-17", "Eleventh Grade")),
            Map.entry(13, new GradeBand("17-18", "Twelfth Grade")),
            Map.entry(HIGHEST_SCORE, new GradeBand("18-22", "College student"))
    );

    private GradeTable() {
    }

    /**
     * @param score ARI score
     * @return the matching band, never {@code null}
     */
    public static GradeBand lookup(int score) {
        if (score > HIGHEST_SCORE) return PROFESSOR;
        return BANDS.getOrDefault(score, UNKNOWN);
    }
}
