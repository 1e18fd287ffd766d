package com.ficshelf.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ficshelf.AppLogger;
import com.ficshelf.Project;
import com.ficshelf.ProjectContext;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Project-level settings: options, category aliases and subprojects.
 */
public class ProjectController implements Controller {

    private final ProjectContext projectContext;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ProjectController(ProjectContext projectContext, ObjectMapper objectMapper) {
        this.projectContext = projectContext;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/project", this::getInfo);
        app.post("/api/project/init", this::initProject);
        app.post("/api/project/open", this::openProject);
        app.get("/api/project/options", this::getOptions);
        app.get("/api/project/options/{category}/{name}", this::getOption);
        app.put("/api/project/options/{category}/{name}", this::setOption);
        app.get("/api/project/aliases", this::getAliases);
        app.post("/api/project/aliases", this::addAlias);
        app.get("/api/project/subprojects", this::getSubprojects);
        app.post("/api/project/subprojects", this::addSubproject);
    }

    private void getInfo(Context ctx) throws Exception {
        Project project = projectContext.project();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("path", project.getRoot().toString());
        info.put("version", project.options().getVersion());
        info.put("targets", project.listTargets().size());
        info.put("pending", project.listTargets(true).size());
        info.put("stored", project.listStoredIdentities().size());
        info.put("markedForUpdate", project.listMarkedForUpdate().size());
        info.put("subprojects", project.listSubprojectPaths());
        ctx.json(info);
    }

    private void initProject(Context ctx) throws Exception {
        String path = requireText(ctx, "path");
        if (path == null) {
            return;
        }
        Project project = projectContext.initAndLoad(Path.of(path));
        logger.info("Initialized and opened project " + project.getRoot());
        ctx.status(201).json(Map.of("ok", true, "path", project.getRoot().toString()));
    }

    private void openProject(Context ctx) throws Exception {
        String path = requireText(ctx, "path");
        if (path == null) {
            return;
        }
        projectContext.load(Path.of(path));
        ctx.json(Map.of("ok", true, "path", projectContext.project().getRoot().toString()));
    }

    private void getOptions(Context ctx) throws Exception {
        ctx.json(projectContext.project().options().asMap());
    }

    private void getOption(Context ctx) throws Exception {
        String category = ctx.pathParam("category");
        String name = ctx.pathParam("name");
        Object value = projectContext.project().getOption(category, name, null);
        if (value == null) {
            ctx.status(404).json(Map.of("error", "Option not set: " + category + "." + name));
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", category);
        body.put("name", name);
        body.put("value", value);
        ctx.json(body);
    }

    private void setOption(Context ctx) throws Exception {
        String category = ctx.pathParam("category");
        String name = ctx.pathParam("name");
        JsonNode json = objectMapper.readTree(ctx.body());
        if (json == null || !json.has("value")) {
            ctx.status(400).json(Map.of("error", "value is required"));
            return;
        }
        Object value = objectMapper.treeToValue(json.get("value"), Object.class);
        projectContext.write(project -> {
            project.setOption(category, name, value);
            return null;
        });
        logger.info("Option " + category + "." + name + " set");
        ctx.json(Map.of("ok", true));
    }

    private void getAliases(Context ctx) throws Exception {
        ctx.json(projectContext.project().getCategoryAliases().asMap());
    }

    private void addAlias(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String from = json != null && json.hasNonNull("from") ? json.get("from").asText() : null;
        String to = json != null && json.hasNonNull("to") ? json.get("to").asText() : null;
        projectContext.write(project -> {
            project.addCategoryAlias(from, to);
            return null;
        });
        ctx.json(Map.of("ok", true, "from", from, "to", to));
    }

    private void getSubprojects(Context ctx) throws Exception {
        ctx.json(projectContext.project().listSubprojectPaths());
    }

    private void addSubproject(Context ctx) throws Exception {
        String path = requireText(ctx, "path");
        if (path == null) {
            return;
        }
        boolean added = projectContext.write(project -> project.addSubproject(path));
        ctx.status(added ? 201 : 200).json(Map.of("ok", true, "added", added));
    }

    private String requireText(Context ctx, String field) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        if (json == null || !json.hasNonNull(field) || json.get(field).asText().isBlank()) {
            ctx.status(400).json(Map.of("error", field + " is required"));
            return null;
        }
        return json.get(field).asText();
    }
}
