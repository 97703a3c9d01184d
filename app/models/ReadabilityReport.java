package models;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of analyzing one text: the aggregate counts plus every
 * readability formula. Each formula is a {@link ServiceResult} so a text
 * without sentences can still report the scores that do not need them.
 *
 * <ul>
 *     <li>Coleman–Liau index (one decimal)</li>
 *     <li>Automated Readability Index (integer) and its grade band</li>
 *     <li>Gulpease index (whole number)</li>
 *     <li>Flesch Reading Ease and Flesch–Kincaid Grade Level (one decimal)</li>
 * </ul>
 *
 * <p>Populated by {@link services.ReadabilityService#analyze(String)}.</p>
 */
public final class ReadabilityReport {
    private final TextStatistics stats;
    private final ServiceResult<Double> colemanLiau;
    private final ServiceResult<Integer> ari;
    private final GradeBand ariGrade;
    private final ServiceResult<Long> gulpease;
    private final ServiceResult<Double> readingEase;
    private final ServiceResult<Double> gradeLevel;

    public ReadabilityReport(TextStatistics stats,
                             ServiceResult<Double> colemanLiau,
                             ServiceResult<Integer> ari,
                             GradeBand ariGrade,
                             ServiceResult<Long> gulpease,
                             ServiceResult<Double> readingEase,
                             ServiceResult<Double> gradeLevel) {
        this.stats = stats;
        this.colemanLiau = colemanLiau;
        this.ari = ari;
        this.ariGrade = ariGrade;
        this.gulpease = gulpease;
        this.readingEase = readingEase;
        this.gradeLevel = gradeLevel;
    }

    public TextStatistics getStats() {
        return stats;
    }

    public ServiceResult<Double> getColemanLiau() {
        return colemanLiau;
    }

    public ServiceResult<Integer> getAri() {
        return ari;
    }

    /**
     * @return grade band of the ARI score, empty when ARI could not be computed
     */
    public Optional<GradeBand> getAriGrade() {
        return Optional.ofNullable(ariGrade);
    }

    public ServiceResult<Long> getGulpease() {
        return gulpease;
    }

    /**
     * @return Flesch Reading Ease (higher = easier)
     */
    public ServiceResult<Double> getReadingEase() {
        return readingEase;
    }

    /**
     * @return Flesch–Kincaid Grade Level
     */
    public ServiceResult<Double> getGradeLevel() {
        return gradeLevel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadabilityReport)) return false;
        ReadabilityReport that = (ReadabilityReport) o;
        return stats.equals(that.stats) &&
                colemanLiau.getData().equals(that.colemanLiau.getData()) &&
                ari.getData().equals(that.ari.getData()) &&
                Objects.equals(ariGrade, that.ariGrade) &&
                gulpease.getData().equals(that.gulpease.getData()) &&
                readingEase.getData().equals(that.readingEase.getData()) &&
                gradeLevel.getData().equals(that.gradeLevel.getData());
    }

    @Override
    public int hashCode() {
        return Objects.hash(stats, colemanLiau.getData(), ari.getData(), ariGrade,
                gulpease.getData(), readingEase.getData(), gradeLevel.getData());
    }

    @Override
    public String toString() {
        return "ReadabilityReport{" +
                "stats=" + stats +
                ", colemanLiau=" + colemanLiau.getData().orElse(null) +
                ", ari=" + ari.getData().orElse(null) +
                ", ariGrade=" + ariGrade +
                ", gulpease=" + gulpease.getData().orElse(null) +
                ", readingEase=" + readingEase.getData().orElse(null) +
                ", gradeLevel=" + gradeLevel.getData().orElse(null) +
                '}';
    }
}
