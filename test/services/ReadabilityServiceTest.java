package services;

import com.typesafe.config.ConfigFactory;
import models.GradeBand;
import models.ReadabilityError;
import models.ReadabilityReport;
import models.ServiceResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReadabilityServiceTest {

    /** 50 letters, 10 words, 2 sentences. */
    private static final String FIFTY_LETTERS =
            "Alpha bravo delta gamma omega. Sigma theta kappa tango rover.";

    /** 17 letters, 6 words, 1 sentence, 6 syllables. */
    private static final String CAT = "The cat sat on the mat.";

    private final ReadabilityService service = new ReadabilityService();

    private static ReadabilityError errorOf(ServiceResult<?> r) {
        assertFalse(r.isSuccess());
        return r.getError().orElseThrow().getCode();
    }

    @Test
    public void colemanLiau_emptyInputFails() {
        assertEquals(ReadabilityError.EMPTY_INPUT, errorOf(service.calculateColemanLiau("")));
        assertEquals(ReadabilityError.EMPTY_INPUT, errorOf(service.calculateColemanLiau(null)));
    }

    @Test
    public void colemanLiau_noWordsFails() {
        ServiceResult<Double> r = service.calculateColemanLiau("   \n ");
        assertEquals(ReadabilityError.NO_WORDS, errorOf(r));
        assertEquals(ServiceResult.UNPROCESSABLE, r.getStatus());
        assertTrue(r.getError().get().getMessage().contains("CLI"));
    }

    @Test
    public void colemanLiau_roundsToOneDecimal() {
        assertEquals(7.7, service.calculateColemanLiau(FIFTY_LETTERS).getData().orElseThrow(), 1e-9);
        assertEquals(-4.1, service.calculateColemanLiau(CAT).getData().orElseThrow(), 1e-9);
    }

    @Test
    public void colemanLiau_doesNotNeedSentences() {
        // 10 characters, 2 words, no terminator: 5.88 * 5 - 15.8
        assertEquals(13.6, service.calculateColemanLiau("hello world").getData().orElseThrow(), 1e-9);
    }

    @Test
    public void ari_roundsUp() {
        // 4.71 * 5 + 0.5 * 5 - 21.43 = 4.62
        assertEquals(5, service.calculateAri(FIFTY_LETTERS).getData().orElseThrow());
        // 4.71 * 17/6 + 0.5 * 6 - 21.43 = -5.085
        assertEquals(-5, service.calculateAri(CAT).getData().orElseThrow());
    }

    @Test
    public void ari_preconditions() {
        assertEquals(ReadabilityError.EMPTY_INPUT, errorOf(service.calculateAri("")));
        assertEquals(ReadabilityError.NO_WORDS, errorOf(service.calculateAri("  ")));
        assertEquals(ReadabilityError.NO_SENTENCES, errorOf(service.calculateAri("hello world")));
    }

    @Test
    public void convertAriToGrades_usesTable() {
        assertEquals(new GradeBand("9-10", "Forth Grade"), service.convertAriToGrades(5));
        assertEquals(new GradeBand("22+", "Professor level"), service.convertAriToGrades(20));
        assertEquals(new GradeBand("Unknown", "Unknown"), service.convertAriToGrades(0));
    }

    @Test
    public void gulpease_matchesFormula() {
        // 89 + (300 * 2 - 10 * 50) / 10
        assertEquals(99L, service.calculateGulpease(FIFTY_LETTERS).getData().orElseThrow());
        // 89 + (300 - 170) / 6 = 110.67
        assertEquals(111L, service.calculateGulpease(CAT).getData().orElseThrow());
    }

    @Test
    public void gulpease_preconditions() {
        assertEquals(ReadabilityError.EMPTY_INPUT, errorOf(service.calculateGulpease("")));
        assertEquals(ReadabilityError.NO_WORDS, errorOf(service.calculateGulpease("\n\n")));
        assertTrue(service.calculateGulpease("ciao mondo").isSuccess(), "no sentence is still a score");
    }

    @Test
    public void flesch_scores() {
        // 206.835 - 1.015 * 6 - 84.6 * 1
        assertEquals(116.1, service.calculateReadingEase(CAT).getData().orElseThrow(), 1e-9);
        // 0.39 * 6 + 11.8 * 1 - 15.59 = -1.45
        assertEquals(-1.45, service.calculateGradeLevel(CAT).getData().orElseThrow(), 0.051);
        assertEquals(ReadabilityError.NO_SENTENCES, errorOf(service.calculateReadingEase("hello world")));
        assertEquals(ReadabilityError.EMPTY_INPUT, errorOf(service.calculateGradeLevel("")));
    }

    @Test
    public void analyze_collectsEveryFormula() {
        ReadabilityReport r = service.analyze(FIFTY_LETTERS);
        assertEquals(10, r.getStats().getWords());
        assertEquals(50, r.getStats().getCharacters());
        assertEquals(2, r.getStats().getSentences());
        assertEquals(7.7, r.getColemanLiau().getData().orElseThrow(), 1e-9);
        assertEquals(5, r.getAri().getData().orElseThrow());
        assertEquals("Forth Grade", r.getAriGrade().orElseThrow().getGradeLevel());
        assertEquals(99L, r.getGulpease().getData().orElseThrow());
        assertTrue(r.getReadingEase().isSuccess());
        assertTrue(r.getGradeLevel().isSuccess());
    }

    @Test
    public void analyze_withoutSentencesHasNoGrade() {
        ReadabilityReport r = service.analyze("hello world");
        assertTrue(r.getColemanLiau().isSuccess());
        assertFalse(r.getAri().isSuccess());
        assertTrue(r.getAriGrade().isEmpty());
    }

    @Test
    public void bundle_limitsToMaxTextsAndComputesAverage() {
        List<String> list = Collections.nCopies(60, FIFTY_LETTERS);

        ReadabilityService.Result r = service.bundle(list);
        assertEquals(50, r.getItems().size());
        assertEquals(7.7, r.getAverageColemanLiau(), 1e-9);
        assertEquals(5.0, r.getAverageAri(), 1e-9);
    }

    @Test
    public void bundle_skipsNullsAndFailedScores() {
        ReadabilityService.Result r = service.bundle(Arrays.asList(FIFTY_LETTERS, null, "hello world"));
        assertEquals(2, r.getItems().size());
        // ARI only exists for the first text
        assertEquals(5.0, r.getAverageAri(), 1e-9);
        assertEquals(10.65, r.getAverageColemanLiau(), 0.051);
    }

    @Test
    public void bundle_handlesNullList() {
        ReadabilityService.Result r = service.bundle(null);
        assertTrue(r.getItems().isEmpty());
        assertEquals(0.0, r.getAverageColemanLiau(), 0.0001);
        assertEquals(0.0, r.getAverageAri(), 0.0001);
    }

    @Test
    public void maxTexts_readFromConfig() {
        ReadabilityService configured = new ReadabilityService(
                ConfigFactory.parseString("readability.maxTexts = 3"));
        assertEquals(3, configured.getMaxTexts());
        assertEquals(3, configured.bundle(Collections.nCopies(10, CAT)).getItems().size());
        assertEquals(ReadabilityService.DEFAULT_MAX_TEXTS,
                new ReadabilityService(ConfigFactory.empty()).getMaxTexts());
    }

    @Test
    public void maxTexts_mustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReadabilityService(ConfigFactory.parseString("readability.maxTexts = 0")));
    }

    @Test
    public void round_halfAwayFromZero() {
        assertEquals(-2.3, ReadabilityService.round(-2.25, 1), 1e-9);
        assertEquals(2.3, ReadabilityService.round(2.25, 1), 1e-9);
        assertEquals(-3.0, ReadabilityService.round(-2.5, 0), 1e-9);
        assertEquals(0.0, ReadabilityService.round(0.0, 1), 1e-9);
    }
}
