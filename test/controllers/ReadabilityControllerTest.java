package controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import play.libs.Json;
import play.mvc.Http;
import play.mvc.Result;
import play.test.Helpers;
import services.ReadabilityService;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Request handling of {@link ReadabilityController}, with a real actor system behind it.
 */
public class ReadabilityControllerTest {

    private static final String TEXT =
            "Alpha bravo delta gamma omega. Sigma theta kappa tango rover.";

    private ReadabilityController controller;

    @BeforeEach
    void setUp() {
        controller = new ReadabilityController(
                new ReadabilityService(),
                ConfigFactory.parseString("readability.askTimeout = 5s"));
    }

    @AfterEach
    void tearDown() throws Exception {
        controller.shutdown().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private static Result await(CompletionStage<Result> stage) throws Exception {
        return stage.toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private static JsonNode body(Result result) {
        return Json.parse(Helpers.contentAsString(result));
    }

    @Test
    void analyze_jsonBody() throws Exception {
        Http.Request request = Helpers.fakeRequest("POST", "/api/readability")
                .bodyJson(Json.newObject().put("text", TEXT))
                .build();

        Result result = await(controller.analyze(request));
        assertEquals(200, result.status());
        assertEquals(7.7, body(result).path("colemanLiau").asDouble(), 1e-9);
    }

    @Test
    void analyze_plainTextBody() throws Exception {
        Http.Request request = Helpers.fakeRequest("POST", "/api/readability")
                .bodyText(TEXT)
                .build();

        Result result = await(controller.analyze(request));
        assertEquals(200, result.status());
        assertEquals(5, body(result).path("ari").asInt());
    }

    @Test
    void analyze_italianLanguageParam() throws Exception {
        Http.Request request = Helpers.fakeRequest("POST", "/api/readability?language=IT")
                .bodyJson(Json.newObject().put("text", TEXT))
                .build();

        Result result = await(controller.analyze(request));
        assertEquals(200, result.status());
        assertEquals(99, body(result).path("gulpease").asInt());
    }

    @Test
    void analyze_unsupportedLanguageIsBadRequest() throws Exception {
        Http.Request request = Helpers.fakeRequest("POST", "/api/readability?language=fr")
                .bodyJson(Json.newObject().put("text", TEXT))
                .build();

        Result result = await(controller.analyze(request));
        assertEquals(400, result.status());
    }

    @Test
    void analyze_missingTextIsBadRequest() throws Exception {
        Http.Request request = Helpers.fakeRequest("POST", "/api/readability")
                .bodyJson(Json.newObject().put("other", "x"))
                .build();

        Result result = await(controller.analyze(request));
        assertEquals(400, result.status());
        assertEquals("Missing required field 'text'", body(result).path("error").asText());
    }

    @Test
    void analyze_emptyTextIsUnprocessable() throws Exception {
        Http.Request request = Helpers.fakeRequest("POST", "/api/readability")
                .bodyJson(Json.newObject().put("text", ""))
                .build();

        Result result = await(controller.analyze(request));
        assertEquals(422, result.status());
        assertEquals("EMPTY_INPUT", body(result).path("code").asText());
    }

    @Test
    void batch_requiresTextsArray() throws Exception {
        Http.Request bad = Helpers.fakeRequest("POST", "/api/readability/batch")
                .bodyJson(Json.newObject().put("texts", "not an array"))
                .build();
        assertEquals(400, await(controller.batch(bad)).status());

        JsonNode payload = Json.parse("{\"texts\": [\"" + TEXT + "\", \"The cat sat on the mat.\"]}");
        Http.Request good = Helpers.fakeRequest("POST", "/api/readability/batch")
                .bodyJson(payload)
                .build();
        Result result = await(controller.batch(good));
        assertEquals(200, result.status());
        assertEquals(2, body(result).path("items").size());
    }

    @Test
    void stats_fromQueryParameter() throws Exception {
        Http.Request request = Helpers.fakeRequest("GET", "/api/stats?text=Dr.%20Smith%20went%20home.").build();

        Result result = await(controller.stats(request));
        assertEquals(200, result.status());
        JsonNode json = body(result);
        assertEquals(4, json.path("words").asInt());
        assertEquals(1, json.path("sentences").asInt());
    }

    @Test
    void stats_readsQueryStringAndIgnoresBody() throws Exception {
        Http.Request request = Helpers.fakeRequest("GET", "/api/stats?text=Dr.%20Smith%20went%20home.")
                .bodyJson(Json.newObject().put("text", "one"))
                .build();

        JsonNode json = body(await(controller.stats(request)));
        assertEquals(4, json.path("words").asInt());

        Http.Request bodyOnly = Helpers.fakeRequest("GET", "/api/stats")
                .bodyText("Dr. Smith went home.")
                .build();
        assertEquals(400, await(controller.stats(bodyOnly)).status());
    }

    @Test
    void grades_lookup() {
        Result ok = controller.grades("5");
        assertEquals(200, ok.status());
        JsonNode json = body(ok);
        assertEquals(5, json.path("score").asInt());
        assertEquals("9-10", json.path("age").asText());
        assertEquals("Forth Grade", json.path("gradeLevel").asText());

        assertEquals("Professor level", body(controller.grades("20")).path("gradeLevel").asText());
        assertEquals("Unknown", body(controller.grades("0")).path("age").asText());
        assertEquals(400, controller.grades("five").status());
    }
}
