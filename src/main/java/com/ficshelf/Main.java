package com.ficshelf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ficshelf.collab.EbookConvertCollaborator;
import com.ficshelf.collab.FanFicFareRetrieval;
import com.ficshelf.collab.SystemCommandRunner;
import com.ficshelf.collab.ZimWriterPackager;
import com.ficshelf.controllers.CatalogController;
import com.ficshelf.controllers.Controller;
import com.ficshelf.controllers.ProjectController;
import com.ficshelf.controllers.TargetController;
import com.ficshelf.errors.AlreadyExistsException;
import com.ficshelf.errors.FicShelfException;
import com.ficshelf.errors.InvalidReferenceException;
import com.ficshelf.errors.NotAProjectException;
import com.ficshelf.storage.JsonStorage;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.nio.file.DirectoryNotEmptyException;
import java.util.List;

public class Main {

    private static final String VERSION = "0.2.0";
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();
            printBanner(config);

            if (config.isInitProject() && !Project.isValidProject(config.getProjectPath())) {
                Project.init(config.getProjectPath());
            }

            ObjectMapper objectMapper = JsonStorage.mapper();
            SystemCommandRunner runner = new SystemCommandRunner();
            ProjectContext projectContext = new ProjectContext(config.getProjectPath(),
                new FanFicFareRetrieval(runner, config.getFanficfareCommand()),
                new EbookConvertCollaborator(runner),
                new ZimWriterPackager(runner));

            Javalin app = createApp(projectContext, objectMapper);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Project: " + config.getProjectPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start FicShelf: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static Javalin createApp(ProjectContext projectContext, ObjectMapper objectMapper) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper, false));
            cfg.http.defaultContentType = "application/json";
        });

        List<Controller> controllers = List.of(
            new ProjectController(projectContext, objectMapper),
            new TargetController(projectContext, objectMapper),
            new CatalogController(projectContext, objectMapper));
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  FicShelf v" + VERSION);
        logger.console("========================================");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(NotAProjectException.class, (e, ctx) -> {
            warn("Not a project: " + e.getSubject());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(InvalidReferenceException.class, (e, ctx) -> {
            warn("Invalid reference: " + e.getSubject());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(JsonProcessingException.class, (e, ctx) -> {
            warn("Malformed request body: " + e.getOriginalMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(AlreadyExistsException.class, (e, ctx) -> {
            warn("Already exists: " + e.getSubject());
            ctx.status(409).json(Controller.errorBody(e));
        });

        app.exception(DirectoryNotEmptyException.class, (e, ctx) -> {
            warn("Directory not empty: " + e.getFile());
            ctx.status(409).json(Controller.errorBody(e));
        });

        app.exception(FicShelfException.class, (e, ctx) -> {
            error("Request failed for " + e.getSubject(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }

    private static void warn(String message) {
        AppLogger log = AppLogger.get();
        if (log != null) {
            log.warn(message);
        }
    }

    private static void error(String message, Exception e) {
        AppLogger log = AppLogger.get();
        if (log != null) {
            log.error(message, e);
        }
    }
}
