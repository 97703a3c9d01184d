package controllers;

import play.BuiltInComponents;
import play.mvc.Http;
import play.routing.Router;
import play.routing.RoutingDsl;

/**
 * Route table for the readability endpoints:
 * <pre>
 * POST /api/readability          full report (JSON {"text": ...} or text/plain body)
 * POST /api/readability/batch    per-text reports and averages
 * GET  /api/stats?text=...       raw counts
 * GET  /api/ari/grades/:score    ARI grade band
 * </pre>
 */
public final class ReadabilityRoutes {

    private final ReadabilityController controller;

    public ReadabilityRoutes(ReadabilityController controller) {
        this.controller = controller;
    }

    public Router build(BuiltInComponents components) {
        return RoutingDsl.fromComponents(components)
                .POST("/api/readability").routingAsync(controller::analyze)
                .POST("/api/readability/batch").routingAsync(controller::batch)
                .GET("/api/stats").routingAsync(controller::stats)
                .GET("/api/ari/grades/:score")
                .routingTo((Http.Request request, String score) -> controller.grades(score))
                .build();
    }
}
