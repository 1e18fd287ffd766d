package com.ficshelf.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ficshelf.AppLogger;
import com.ficshelf.ProjectContext;
import com.ficshelf.models.AddResult;
import com.ficshelf.models.BulkAddResult;
import com.ficshelf.models.DownloadOutcome;
import com.ficshelf.target.Target;
import com.ficshelf.target.TargetResolver;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Target list, update marks, downloads and e-book conversion.
 */
public class TargetController implements Controller {

    private final ProjectContext projectContext;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public TargetController(ProjectContext projectContext, ObjectMapper objectMapper) {
        this.projectContext = projectContext;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/targets", this::listTargets);
        app.post("/api/targets", this::addTarget);
        app.post("/api/targets/bulk", this::addBulk);
        app.post("/api/targets/import", this::importFile);
        app.get("/api/targets/resolve", this::resolve);
        app.get("/api/targets/sources", ctx -> ctx.json(TargetResolver.knownSources()));
        app.get("/api/targets/marked", this::listMarked);
        app.post("/api/targets/mark", this::mark);
        app.post("/api/targets/download", this::downloadPending);
        app.post("/api/targets/update", this::updateMarked);
        app.post("/api/targets/convert", this::convert);
    }

    private void listTargets(Context ctx) throws Exception {
        boolean pendingOnly = "true".equalsIgnoreCase(ctx.queryParam("pending"));
        List<Map<String, Object>> result = new ArrayList<>();
        for (Target target : projectContext.project().listTargets(pendingOnly)) {
            result.add(describe(target));
        }
        ctx.json(result);
    }

    private void addTarget(Context ctx) throws Exception {
        String reference = requireText(ctx, "reference");
        if (reference == null) {
            return;
        }
        AddResult result = projectContext.write(project -> project.addTarget(reference));
        Target target = TargetResolver.resolve(reference);
        Map<String, Object> body = describe(target);
        body.put("result", result);
        ctx.status(result == AddResult.ADDED ? 201 : 200).json(body);
    }

    private void addBulk(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        if (json == null || !json.has("references") || !json.get("references").isArray()) {
            ctx.status(400).json(Map.of("error", "references array is required"));
            return;
        }
        List<String> references = new ArrayList<>();
        for (JsonNode node : json.get("references")) {
            references.add(node.asText());
        }
        BulkAddResult result = projectContext.write(project -> project.addTargetsFromBulkSource(references));
        ctx.json(result);
    }

    private void importFile(Context ctx) throws Exception {
        String path = requireText(ctx, "path");
        if (path == null) {
            return;
        }
        BulkAddResult result = projectContext.write(project -> project.addTargetsFromFile(Path.of(path)));
        logger.info("Imported targets from " + path + ": " + result);
        ctx.json(result);
    }

    private void resolve(Context ctx) {
        String reference = ctx.queryParam("reference");
        if (reference == null || reference.isBlank()) {
            ctx.status(400).json(Map.of("error", "reference parameter required"));
            return;
        }
        ctx.json(describe(TargetResolver.resolve(reference)));
    }

    private void listMarked(Context ctx) throws Exception {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Target target : projectContext.project().listMarkedForUpdate()) {
            result.add(describe(target));
        }
        ctx.json(result);
    }

    private void mark(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        if (json == null || !json.hasNonNull("reference")) {
            ctx.status(400).json(Map.of("error", "reference is required"));
            return;
        }
        Target target = TargetResolver.resolve(json.get("reference").asText());
        boolean required = !json.has("required") || json.get("required").asBoolean(true);
        boolean changed = projectContext.write(project -> project.markForUpdate(target, required));
        ctx.json(Map.of("ok", true, "changed", changed));
    }

    private void downloadPending(Context ctx) throws Exception {
        int limit = limitOf(ctx);
        List<DownloadOutcome> outcomes = projectContext.write(
            project -> projectContext.downloads().downloadPending(project, limit));
        ctx.json(outcomes);
    }

    private void updateMarked(Context ctx) throws Exception {
        int limit = limitOf(ctx);
        List<DownloadOutcome> outcomes = projectContext.write(
            project -> projectContext.downloads().updateMarked(project, limit));
        ctx.json(outcomes);
    }

    private void convert(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        if (json == null || !json.hasNonNull("reference") || !json.hasNonNull("output")) {
            ctx.status(400).json(Map.of("error", "reference and output are required"));
            return;
        }
        Target target = TargetResolver.resolve(json.get("reference").asText());
        Path output = Path.of(json.get("output").asText());
        projectContext.write(project -> {
            project.convertTarget(target, projectContext.bookConverter(), output);
            return null;
        });
        ctx.json(Map.of("ok", true, "output", output.toAbsolutePath().toString()));
    }

    private int limitOf(Context ctx) {
        String limit = ctx.queryParam("limit");
        if (limit == null || limit.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(limit.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid limit: " + limit, e);
        }
    }

    private String requireText(Context ctx, String field) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        if (json == null || !json.hasNonNull(field) || json.get(field).asText().isBlank()) {
            ctx.status(400).json(Map.of("error", field + " is required"));
            return null;
        }
        return json.get(field).asText();
    }

    private static Map<String, Object> describe(Target target) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("url", target.getUrl());
        body.put("source", target.getSource());
        body.put("id", target.getId());
        return body;
    }
}
