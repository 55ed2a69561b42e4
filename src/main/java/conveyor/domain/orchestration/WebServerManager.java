package conveyor.domain.orchestration;

import com.google.gson.Gson;
import conveyor.dal.ServerConfig;
import conveyor.domain.gateway.ApiResponse;
import conveyor.domain.gateway.JobController;
import io.javalin.Javalin;
import io.javalin.json.JsonMapper;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.javalin.apibuilder.ApiBuilder.get;

/**
 * Manages web server (Javalin) configuration and lifecycle
 * @since 19/10/2025
 */
public class WebServerManager {
    private static final Logger logger = LoggerFactory.getLogger(WebServerManager.class);

    private final ServerConfig serverConfig;
    private final JobController jobController;

    // Pretty-printing Gson for REST responses
    private final Gson gson;

    private Javalin javalinApp;

    /**
     * Constructor
     * @param serverConfig Server configuration
     * @param jobController Job endpoints
     * @param gson Pretty-printing Gson used by the JSON mapper
     */
    public WebServerManager(ServerConfig serverConfig, JobController jobController, Gson gson) {
        this.serverConfig = serverConfig;
        this.jobController = jobController;
        this.gson = gson;
    }

    /**
     * Start web server
     */
    public void start() {
        logger.info("Starting web server on {}...", serverConfig.address());
        javalinApp = createJavalinApp();
        logger.info("✓ Web server started successfully on port {}", javalinApp.port());
    }

    /**
     * Stop web server
     */
    public void stop() {
        if (javalinApp != null) {
            javalinApp.stop();
            javalinApp = null;
        }
    }

    /**
     * Get the bound port, useful when port 0 was requested
     */
    public int getPort() {
        return javalinApp == null ? -1 : javalinApp.port();
    }

    /**
     * Create and configure Javalin web application
     */
    private Javalin createJavalinApp() {
        Javalin app = Javalin.create(config -> {
            config.jsonMapper(createGsonMapper());
            config.jetty.threadPool = new QueuedThreadPool(serverConfig.requestThreads(), 2, 60_000);
            config.showJavalinBanner = false;

            config.bundledPlugins.enableCors(cors -> {
                cors.addRule(corsRule -> {
                    corsRule.anyHost();
                    corsRule.allowCredentials = false;
                });
            });

            if (serverConfig.loggingEnabled()) {
                config.bundledPlugins.enableDevLogging();
            }

            config.router.apiBuilder(() -> {
                get("/", ctx -> ctx.redirect("/docs"));
                get("/docs", ctx -> ctx.html(loadDocs()));

                jobController.registerRoutes();
            });
        });

        app.exception(Exception.class, (exception, ctx) -> {
            logger.error("Unhandled exception", exception);
            ctx.status(500).json(ApiResponse.error("Internal server error: " + exception.getMessage()));
        });

        return app.start(serverConfig.address().host(), serverConfig.address().port());
    }

    /**
     * Create Gson JSON mapper
     */
    private JsonMapper createGsonMapper() {
        return new JsonMapper() {
            @Override
            public String toJsonString(Object obj, Type type) {
                return gson.toJson(obj, type);
            }

            @Override
            public <T> T fromJsonString(String json, Type targetType) {
                return gson.fromJson(json, targetType);
            }
        };
    }

    /**
     * Load API documentation page, an external copy in the work directory wins over the bundled one
     */
    private String loadDocs() {
        Path externalHtml = serverConfig.workDir().resolve("html/api_docs.html");
        if (Files.exists(externalHtml)) {
            try {
                String content = Files.readString(externalHtml, StandardCharsets.UTF_8);
                logger.debug("Loaded API docs from external file: {}", externalHtml);
                return content;
            } catch (IOException e) {
                logger.warn("Failed to load external API docs: {}", e.getMessage());
            }
        }

        try (InputStream is = getClass().getResourceAsStream("/html/api_docs.html")) {
            if (is != null) {
                String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                logger.debug("Loaded API docs from classpath");
                return content;
            }
        } catch (IOException e) {
            logger.error("Failed to load API documentation", e);
        }

        return "<h1>API documentation not available</h1>";
    }
}
