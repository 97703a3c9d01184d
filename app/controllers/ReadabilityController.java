package controllers;

import actors.ReadabilityActor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.Config;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.Scheduler;
import org.apache.pekko.actor.typed.javadsl.AskPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import play.libs.Json;
import play.mvc.Controller;
import play.mvc.Http;
import play.mvc.Result;
import play.mvc.Results;
import services.ReadabilityService;
import scala.jdk.javaapi.FutureConverters;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * JSON endpoints for readability analysis. Request parsing happens here; all
 * counting and scoring is offloaded to {@link ReadabilityActor}.
 */
@Singleton
public class ReadabilityController extends Controller {

    private static final Logger LOG = LoggerFactory.getLogger(ReadabilityController.class);

    private final ReadabilityService readabilityService;
    private final ActorSystem<ReadabilityActor.Command> readabilityActor;
    private final Scheduler scheduler;
    private final Duration askTimeout;

    @Inject
    public ReadabilityController(ReadabilityService readabilityService, Config config) {
        this.readabilityService = readabilityService;
        this.readabilityActor = ActorSystem.create(
                ReadabilityActor.create(readabilityService), "readability");
        this.scheduler = readabilityActor.scheduler();
        this.askTimeout = config.hasPath("readability.askTimeout")
                ? config.getDuration("readability.askTimeout")
                : Duration.ofSeconds(15);
    }

    /**
     * {@code POST /api/readability}: full report for the text in the body.
     * {@code ?language=it} restricts the answer to the Gulpease index.
     */
    public CompletionStage<Result> analyze(Http.Request request) {
        Optional<String> language = language(request);
        if (language.isEmpty()) {
            return rejected("Unsupported language, expected 'en' or 'it'");
        }
        Optional<String> text = extractText(request);
        if (text.isEmpty()) {
            return rejected("Missing required field 'text'");
        }
        LOG.debug("Analyzing {} chars, language={}", text.get().length(), language.get());

        return AskPattern.ask(
                readabilityActor,
                replyTo -> new ReadabilityActor.Analyze(text.get(), language.get(), replyTo),
                askTimeout,
                scheduler
        );
    }

    /**
     * {@code POST /api/readability/batch}: body {@code {"texts": [...]}}.
     */
    public CompletionStage<Result> batch(Http.Request request) {
        JsonNode json = request.body().asJson();
        JsonNode texts = json == null ? null : json.get("texts");
        if (texts == null || !texts.isArray()) {
            return rejected("Missing required array 'texts'");
        }
        List<String> list = new ArrayList<>();
        texts.forEach(n -> list.add(n.isNull() ? null : n.asText()));

        return AskPattern.ask(
                readabilityActor,
                replyTo -> new ReadabilityActor.AnalyzeBatch(list, replyTo),
                askTimeout,
                scheduler
        );
    }

    /**
     * {@code GET /api/stats?text=...}: the five raw counts. Only the query
     * string is read; a request body is ignored.
     */
    public CompletionStage<Result> stats(Http.Request request) {
        Optional<String> text = Optional.ofNullable(request.getQueryString("text"));
        if (text.isEmpty()) {
            return rejected("Missing required parameter 'text'");
        }
        return AskPattern.ask(
                readabilityActor,
                replyTo -> new ReadabilityActor.ComputeStats(text.get(), replyTo),
                askTimeout,
                scheduler
        );
    }

    /**
     * {@code GET /api/ari/grades/:score}: grade band lookup. A pure table read,
     * answered without the actor.
     */
    public Result grades(String score) {
        int value;
        try {
            value = Integer.parseInt(score.trim());
        } catch (NumberFormatException ex) {
            ObjectNode err = Json.newObject().put("error", "Score must be an integer: " + score);
            return Results.badRequest(err).as("application/json");
        }
        ObjectNode out = readabilityService.convertAriToGrades(value).toJson();
        out.put("score", value);
        return Results.ok(out).as("application/json");
    }

    /**
     * Terminates the actor system backing this controller.
     */
    public CompletionStage<Void> shutdown() {
        readabilityActor.terminate();
        return FutureConverters.asJava(readabilityActor.whenTerminated()).thenApply(done -> null);
    }

    static Optional<String> extractText(Http.Request request) {
        JsonNode json = request.body().asJson();
        if (json != null) {
            JsonNode text = json.get("text");
            return text == null || text.isNull() ? Optional.empty() : Optional.of(text.asText());
        }
        String body = request.body().asText();
        if (body != null) {
            return Optional.of(body);
        }
        return Optional.ofNullable(request.getQueryString("text"));
    }

    static Optional<String> language(Http.Request request) {
        String lang = Optional.ofNullable(request.getQueryString("language"))
                .orElse(Optional.ofNullable(request.getQueryString("lang")).orElse("en"))
                .trim()
                .toLowerCase(Locale.ROOT);
        if (lang.isEmpty() || lang.equals("en")) return Optional.of("en");
        if (lang.equals("it")) return Optional.of("it");
        return Optional.empty();
    }

    private static CompletionStage<Result> rejected(String message) {
        ObjectNode err = Json.newObject().put("error", message);
        return CompletableFuture.completedFuture(Results.badRequest(err).as("application/json"));
    }
}
