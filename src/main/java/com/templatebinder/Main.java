package com.templatebinder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.aepx.DocumentParseException;
import com.templatebinder.controllers.AnalysisController;
import com.templatebinder.controllers.Controller;
import com.templatebinder.controllers.ExpressionController;
import com.templatebinder.controllers.SettingsController;
import com.templatebinder.controllers.StoreCompositionController;
import com.templatebinder.controllers.VariableController;
import com.templatebinder.variables.VariableRegistry;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.FileNotFoundException;
import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .environment(System.getenv())
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), true, config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            VariableRegistry registry = VariableRegistry.standard();
            TemplateWorkspace workspace = new TemplateWorkspace(config.getWorkspacePath());
            BindingSettingsStore settingsStore = new BindingSettingsStore(workspace.getWorkspaceRoot(), objectMapper);
            TemplateBindingService bindingService =
                new TemplateBindingService(workspace, settingsStore, registry, objectMapper);
            logger.info("Workspace initialized: " + workspace.getWorkspaceRoot());

            Javalin app = createApp(bindingService, registry);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Workspace: " + config.getWorkspacePath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));
        } catch (Exception e) {
            System.err.println("Failed to start Template Binder: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static Javalin createApp(TemplateBindingService bindingService, VariableRegistry registry) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
        });

        List<Controller> controllers = List.of(
            new VariableController(registry),
            new AnalysisController(bindingService, objectMapper),
            new ExpressionController(bindingService, objectMapper),
            new StoreCompositionController(bindingService, objectMapper),
            new SettingsController(bindingService, objectMapper)
        );
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Template Binder v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(FileNotFoundException.class, (e, ctx) -> {
            AppLogger.get().warn("File not found: " + e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });
        app.exception(SecurityException.class, (e, ctx) -> {
            AppLogger.get().warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            AppLogger.get().warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });
        app.exception(JsonProcessingException.class, (e, ctx) -> {
            AppLogger.get().warn("Malformed request body: " + e.getOriginalMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });
        app.exception(DocumentParseException.class, (e, ctx) -> {
            AppLogger.get().warn("Template is not well-formed: " + e.getMessage());
            ctx.status(422).json(Controller.errorBody(e));
        });
        app.exception(Exception.class, (e, ctx) -> {
            AppLogger.get().error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
