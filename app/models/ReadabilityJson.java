package models;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import play.libs.Json;
import services.ReadabilityService;

/**
 * Renders readability results as JSON payloads for the HTTP surface.
 *
 * <p>A successful score is written as a plain number under its field name; a
 * failed one is written as the {@link ErrorInfo} object instead, so clients
 * can tell the two apart by node type.</p>
 */
public final class ReadabilityJson {

    private ReadabilityJson() {}

    /**
     * Full report for one text.
     *
     * @param report the analysis
     * @return object with {@code stats}, one field per formula and {@code ariGrade}
     */
    public static ObjectNode report(ReadabilityReport report) {
        ObjectNode out = Json.newObject();
        out.set("stats", report.getStats().toJson());
        putScore(out, "colemanLiau", report.getColemanLiau());
        putScore(out, "ari", report.getAri());
        report.getAriGrade().ifPresent(g -> out.set("ariGrade", g.toJson()));
        putScore(out, "gulpease", report.getGulpease());
        putScore(out, "readingEase", report.getReadingEase());
        putScore(out, "gradeLevel", report.getGradeLevel());
        return out;
    }

    /**
     * Italian-only payload: the counts and the Gulpease index.
     */
    public static ObjectNode italian(TextStatistics stats, ServiceResult<Long> gulpease) {
        ObjectNode out = Json.newObject();
        out.put("language", "it");
        out.set("stats", stats.toJson());
        putScore(out, "gulpease", gulpease);
        return out;
    }

    /**
     * Batch payload with per-text reports and averages.
     */
    public static ObjectNode bundle(ReadabilityService.Result result) {
        ObjectNode out = Json.newObject();
        out.put("count", result.getItems().size());
        out.put("averageColemanLiau", result.getAverageColemanLiau());
        out.put("averageAri", result.getAverageAri());

        ArrayNode items = Json.newArray();
        result.getItems().forEach(r -> items.add(report(r)));
        out.set("items", items);
        return out;
    }

    private static void putScore(ObjectNode out, String field, ServiceResult<?> score) {
        if (score.isSuccess() && score.getData().isPresent()) {
            out.set(field, Json.toJson(score.getData().get()));
        } else {
            score.getError().ifPresent(e -> out.set(field, e.toJson()));
        }
    }
}
