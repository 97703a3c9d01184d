package services;

import com.typesafe.config.Config;
import models.ErrorInfo;
import models.GradeBand;
import models.ReadabilityError;
import models.ReadabilityReport;
import models.ServiceResult;
import models.TextStatistics;
import util.GradeTable;
import util.TextStats;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Service responsible for turning text counts into readability scores. The
 * service supports computing:
 * <ul>
 *     <li>Coleman–Liau index</li>
 *     <li>Automated Readability Index (ARI) and its grade band</li>
 *     <li>Gulpease index (Italian)</li>
 *     <li>Flesch Reading Ease score</li>
 *     <li>Flesch–Kincaid Grade Level</li>
 * </ul>
 *
 * <p>Every formula checks its preconditions before dividing and returns a
 * failed {@link ServiceResult} tagged with a {@link ReadabilityError} instead of
 * throwing. All counting is delegated to {@link util.TextStats} to keep the
 * service focused solely on the arithmetic.</p>
 */
@Singleton
public class ReadabilityService {

    static final int DEFAULT_MAX_TEXTS = 50;

    private final int maxTexts;

    public ReadabilityService() {
        this(DEFAULT_MAX_TEXTS);
    }

    @Inject
    public ReadabilityService(Config config) {
        this(config.hasPath("readability.maxTexts")
                ? config.getInt("readability.maxTexts")
                : DEFAULT_MAX_TEXTS);
    }

    ReadabilityService(int maxTexts) {
        if (maxTexts < 1) {
            throw new IllegalArgumentException("readability.maxTexts must be positive, got " + maxTexts);
        }
        this.maxTexts = maxTexts;
    }

    public int getMaxTexts() {
        return maxTexts;
    }

    /**
     * Counts everything {@link TextStats} knows about a text.
     */
    public TextStatistics buildStats(String text) {
        return TextStats.buildAggregateStats(text);
    }

    /**
     * Coleman–Liau index, rounded to one decimal:
     * <pre>
     *   5.88 × (characters / words) − 29.6 × (sentences / words) − 15.8
     * </pre>
     *
     * @param text raw text (may be null)
     * @return the index, or EMPTY_INPUT / NO_WORDS
     */
    public ServiceResult<Double> calculateColemanLiau(String text) {
        if (text == null || text.isEmpty()) return fail(ReadabilityError.EMPTY_INPUT, "CLI");

        double characters = TextStats.countCharacters(text);
        double words = TextStats.countWords(text);
        double sentences = TextStats.countSentences(text);
        if (words == 0) return fail(ReadabilityError.NO_WORDS, "CLI");

        double cli = 5.88 * (characters / words) - 29.6 * (sentences / words) - 15.8;
        return ServiceResult.success(round(cli, 1));
    }

    /**
     * Automated Readability Index, always rounded up to the next whole number:
     * <pre>
     *   4.71 × (characters / words) + 0.5 × (words / sentences) − 21.43
     * </pre>
     *
     * @param text raw text (may be null)
     * @return the score, or EMPTY_INPUT / NO_WORDS / NO_SENTENCES
     */
    public ServiceResult<Integer> calculateAri(String text) {
        if (text == null || text.isEmpty()) return fail(ReadabilityError.EMPTY_INPUT, "ARI");

        double characters = TextStats.countCharacters(text);
        double words = TextStats.countWords(text);
        double sentences = TextStats.countSentences(text);
        if (words == 0) return fail(ReadabilityError.NO_WORDS, "ARI");
        if (sentences == 0) return fail(ReadabilityError.NO_SENTENCES, "ARI");

        double ari = 4.71 * (characters / words) + 0.5 * (words / sentences) - 21.43;
        return ServiceResult.success((int) Math.ceil(ari));
    }

    /**
     * @param score ARI score
     * @return age range and grade level; see {@link GradeTable}
     */
    public GradeBand convertAriToGrades(int score) {
        return GradeTable.lookup(score);
    }

    /**
     * Gulpease index for Italian text, rounded to the nearest whole number:
     * <pre>
     *   89 + (300 × sentences − 10 × characters) / words
     * </pre>
     *
     * @param text raw text (may be null)
     * @return the index, or EMPTY_INPUT / NO_WORDS
     */
    public ServiceResult<Long> calculateGulpease(String text) {
        if (text == null || text.isEmpty()) return fail(ReadabilityError.EMPTY_INPUT, "Gulpease readability index");

        double words = TextStats.countWords(text);
        if (words == 0) return fail(ReadabilityError.NO_WORDS, "Gulpease readability index");

        double characters = TextStats.countCharacters(text);
        double sentences = TextStats.countSentences(text);

        double raw = 89 + (300 * sentences - 10 * characters) / words;
        return ServiceResult.success((long) round(raw, 0));
    }

    /**
     * Flesch Reading Ease, rounded to one decimal:
     * <pre>
     *   206.835 − 1.015 × (words / sentences) − 84.6 × (syllables / words)
     * </pre>
     */
    public ServiceResult<Double> calculateReadingEase(String text) {
        return flesch(text, "Flesch Reading Ease", (wps, spw) -> 206.835 - 1.015 * wps - 84.6 * spw);
    }

    /**
     * Flesch–Kincaid Grade Level, rounded to one decimal:
     * <pre>
     *   0.39 × (words / sentences) + 11.8 × (syllables / words) − 15.59
     * </pre>
     */
    public ServiceResult<Double> calculateGradeLevel(String text) {
        return flesch(text, "Flesch-Kincaid Grade Level", (wps, spw) -> 0.39 * wps + 11.8 * spw - 15.59);
    }

    /**
     * Runs every formula against one text.
     *
     * @param text raw text (may be null)
     * @return immutable {@link ReadabilityReport}
     */
    public ReadabilityReport analyze(String text) {
        TextStatistics stats = buildStats(text);
        ServiceResult<Integer> ari = calculateAri(text);
        GradeBand grade = ari.getData().map(this::convertAriToGrades).orElse(null);
        return new ReadabilityReport(
                stats,
                calculateColemanLiau(text),
                ari,
                grade,
                calculateGulpease(text),
                calculateReadingEase(text),
                calculateGradeLevel(text));
    }

    /**
     * Analyzes a list of texts using Java Streams, limited to the first
     * {@code readability.maxTexts} non-null entries, and averages the
     * Coleman–Liau and ARI scores of the texts where they could be computed.
     *
     * @param texts raw texts (may be null or contain nulls)
     * @return a {@link Result} with the per-text reports and the averages
     */
    public Result bundle(List<String> texts) {
        if (texts == null) texts = Collections.emptyList();

        List<ReadabilityReport> reports = texts.stream()
                .filter(Objects::nonNull)
                .limit(maxTexts)
                .map(this::analyze)
                .collect(Collectors.toList());

        OptionalDouble avgCli = reports.stream()
                .flatMap(r -> r.getColemanLiau().getData().stream())
                .mapToDouble(Double::doubleValue)
                .average();
        OptionalDouble avgAri = reports.stream()
                .flatMap(r -> r.getAri().getData().stream())
                .mapToInt(Integer::intValue)
                .average();

        return new Result(reports, round(avgCli.orElse(0.0), 1), round(avgAri.orElse(0.0), 1));
    }

    private ServiceResult<Double> flesch(String text, String formula, Formula f) {
        if (text == null || text.isEmpty()) return fail(ReadabilityError.EMPTY_INPUT, formula);

        TextStatistics stats = buildStats(text);
        if (stats.getWords() == 0) return fail(ReadabilityError.NO_WORDS, formula);
        if (stats.getSentences() == 0) return fail(ReadabilityError.NO_SENTENCES, formula);

        double wps = (double) stats.getWords() / stats.getSentences(); // words per sentence
        double spw = (double) stats.getSyllables() / stats.getWords(); // syllables per word
        return ServiceResult.success(round(f.apply(wps, spw), 1));
    }

    private static <T> ServiceResult<T> fail(ReadabilityError error, String formula) {
        return ServiceResult.failure(ErrorInfo.of(error, formula));
    }

    // Half away from zero, so -2.25 becomes -2.3 rather than -2.2.
    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.signum(value) * Math.round(Math.abs(value) * scale) / scale;
    }

    @FunctionalInterface
    private interface Formula {
        double apply(double wordsPerSentence, double syllablesPerWord);
    }

    /**
     * Container object that holds both the list of per-text reports and the
     * aggregated averages. Returned to the actor so it can be serialized into JSON.
     */
    public static final class Result {
        private final List<ReadabilityReport> items;
        private final double averageColemanLiau;
        private final double averageAri;

        public Result(List<ReadabilityReport> items, double averageColemanLiau, double averageAri) {
            this.items = items;
            this.averageColemanLiau = averageColemanLiau;
            this.averageAri = averageAri;
        }
        public List<ReadabilityReport> getItems()   { return items; }
        public double getAverageColemanLiau()       { return averageColemanLiau; }
        public double getAverageAri()               { return averageAri; }
    }
}
