package server;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import controllers.ReadabilityController;
import controllers.ReadabilityRoutes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import play.Mode;
import play.server.Server;
import services.ReadabilityService;

/**
 * Starts an embedded Play server exposing {@link ReadabilityRoutes}.
 *
 * <p>Reads {@code readability.http.port} from {@code application.conf}
 * ({@code PORT} overrides it).</p>
 */
public final class ReadabilityServer {

    private static final Logger LOG = LoggerFactory.getLogger(ReadabilityServer.class);

    private final Server server;
    private final ReadabilityController controller;

    private ReadabilityServer(Server server, ReadabilityController controller) {
        this.server = server;
        this.controller = controller;
    }

    public static ReadabilityServer start(Config config) {
        ReadabilityService service = new ReadabilityService(config);
        ReadabilityController controller = new ReadabilityController(service, config);
        ReadabilityRoutes routes = new ReadabilityRoutes(controller);

        int port = config.getInt("readability.http.port");
        Server server = Server.forRouter(Mode.PROD, port, routes::build);
        LOG.info("Readability server listening on port {} (maxTexts={})", server.httpPort(), service.getMaxTexts());
        return new ReadabilityServer(server, controller);
    }

    public int port() {
        return server.httpPort();
    }

    public void stop() {
        LOG.info("Stopping readability server");
        server.stop();
        controller.shutdown().toCompletableFuture().join();
    }

    public static void main(String[] args) {
        ReadabilityServer app = start(ConfigFactory.load());
        Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "readability-shutdown"));
    }
}
