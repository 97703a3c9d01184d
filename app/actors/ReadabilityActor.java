package actors;

import com.fasterxml.jackson.databind.node.ObjectNode;
import models.ErrorInfo;
import models.ReadabilityJson;
import models.ReadabilityReport;
import models.ServiceResult;
import models.TextStatistics;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.SupervisorStrategy;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import play.libs.Json;
import play.mvc.Result;
import play.mvc.Results;
import services.ReadabilityService;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Actor that runs readability analysis for the HTTP surface and replies with
 * a ready-to-send {@link Result}.
 *
 * <p>The actor keeps no state between messages. A report whose Coleman–Liau
 * score failed is answered with 422, since that failure (empty text or no
 * words) means no formula could run. Formula failures that only affect some
 * scores, such as a missing sentence terminator, stay inline in a 200 report.</p>
 */
public final class ReadabilityActor extends AbstractBehavior<ReadabilityActor.Command> {

    public interface Command {}

    public static final class Analyze implements Command {
        public final String text;
        public final String language;
        public final ActorRef<Result> replyTo;

        public Analyze(String text, String language, ActorRef<Result> replyTo) {
            this.text = text;
            this.language = language;
            this.replyTo = replyTo;
        }
    }

    public static final class AnalyzeBatch implements Command {
        public final List<String> texts;
        public final ActorRef<Result> replyTo;

        public AnalyzeBatch(List<String> texts, ActorRef<Result> replyTo) {
            this.texts = texts;
            this.replyTo = replyTo;
        }
    }

    public static final class ComputeStats implements Command {
        public final String text;
        public final ActorRef<Result> replyTo;

        public ComputeStats(String text, ActorRef<Result> replyTo) {
            this.text = text;
            this.replyTo = replyTo;
        }
    }

    private final ReadabilityService readabilityService;

    public static Behavior<Command> create(ReadabilityService readabilityService) {
        Behavior<Command> behavior = Behaviors.setup(ctx ->
                new ReadabilityActor(ctx, readabilityService));
        return Behaviors.supervise(behavior)
                .onFailure(SupervisorStrategy.restart().withLimit(3, Duration.ofMinutes(1)));
    }

    private ReadabilityActor(ActorContext<Command> context, ReadabilityService readabilityService) {
        super(context);
        this.readabilityService = readabilityService;
    }

    @Override
    public Receive<Command> createReceive() {
        return newReceiveBuilder()
                .onMessage(Analyze.class, this::onAnalyze)
                .onMessage(AnalyzeBatch.class, this::onAnalyzeBatch)
                .onMessage(ComputeStats.class, this::onComputeStats)
                .build();
    }

    private Behavior<Command> onAnalyze(Analyze cmd) {
        reply(cmd.replyTo, "analyze", () -> {
            if ("it".equals(cmd.language)) {
                TextStatistics stats = readabilityService.buildStats(cmd.text);
                ServiceResult<Long> gulpease = readabilityService.calculateGulpease(cmd.text);
                return Results.status(gulpease.getStatus(), ReadabilityJson.italian(stats, gulpease));
            }
            ReadabilityReport report = readabilityService.analyze(cmd.text);
            ServiceResult<Double> cli = report.getColemanLiau();
            ObjectNode body = ReadabilityJson.report(report);
            if (!cli.isSuccess()) {
                ErrorInfo error = cli.getError().orElseThrow();
                body.put("status", "error");
                body.put("code", error.getCode().name());
                body.put("message", error.getMessage());
            }
            return Results.status(cli.getStatus(), body);
        });
        return this;
    }

    private Behavior<Command> onAnalyzeBatch(AnalyzeBatch cmd) {
        reply(cmd.replyTo, "batch", () -> {
            ReadabilityService.Result r = readabilityService.bundle(cmd.texts);
            getContext().getLog().debug("Analyzed batch of {} texts", r.getItems().size());
            return Results.ok(ReadabilityJson.bundle(r));
        });
        return this;
    }

    private Behavior<Command> onComputeStats(ComputeStats cmd) {
        reply(cmd.replyTo, "stats", () -> Results.ok(readabilityService.buildStats(cmd.text).toJson()));
        return this;
    }

    private void reply(ActorRef<Result> replyTo, String operation, Supplier<Result> work) {
        Result out;
        try {
            out = work.get();
        } catch (RuntimeException ex) {
            getContext().getLog().error("ReadabilityActor failure during {}", operation, ex);
            ObjectNode err = Json.newObject()
                    .put("status", 500)
                    .put("error", "Failed to compute readability");
            out = Results.internalServerError(err);
        }
        replyTo.tell(out.as("application/json"));
    }
}
