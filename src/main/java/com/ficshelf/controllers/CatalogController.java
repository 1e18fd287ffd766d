package com.ficshelf.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ficshelf.AppLogger;
import com.ficshelf.ProjectContext;
import com.ficshelf.aggregate.CatalogStats;
import com.ficshelf.models.AuthorEntry;
import com.ficshelf.models.CatalogIndex;
import com.ficshelf.target.TargetIdentity;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the aggregated catalog and the archive build.
 */
public class CatalogController implements Controller {

    private final ProjectContext projectContext;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public CatalogController(ProjectContext projectContext, ObjectMapper objectMapper) {
        this.projectContext = projectContext;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/catalog", this::getCatalog);
        app.get("/api/catalog/titles", this::getTitles);
        app.get("/api/catalog/categories/{name}", this::getCategory);
        app.get("/api/catalog/authors", this::getAuthors);
        app.post("/api/catalog/build", this::build);
    }

    private CatalogIndex aggregate(Context ctx) throws Exception {
        boolean includeSubprojects = !"false".equalsIgnoreCase(ctx.queryParam("subprojects"));
        return projectContext.aggregation().aggregate(projectContext.project(), includeSubprojects);
    }

    private void getCatalog(Context ctx) throws Exception {
        CatalogIndex index = aggregate(ctx);
        Map<String, Integer> categories = new LinkedHashMap<>();
        for (Map.Entry<String, List<TargetIdentity>> entry : index.getByCategory().entrySet()) {
            categories.put(entry.getKey(), entry.getValue().size());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stats", CatalogStats.of(index));
        body.put("categories", categories);
        body.put("discardedDuplicates", index.getDiscardedDuplicates());
        body.put("warnings", index.getWarnings());
        ctx.json(body);
    }

    private void getTitles(Context ctx) throws Exception {
        List<Map<String, String>> result = new ArrayList<>();
        for (Map.Entry<TargetIdentity, String> entry : projectContext.project().listTitles()) {
            Map<String, String> item = new LinkedHashMap<>();
            item.put("source", entry.getKey().getSource());
            item.put("id", entry.getKey().getId());
            item.put("title", entry.getValue());
            result.add(item);
        }
        ctx.json(result);
    }

    private void getCategory(Context ctx) throws Exception {
        String name = ctx.pathParam("name");
        CatalogIndex index = aggregate(ctx);
        if (!index.getByCategory().containsKey(name)) {
            ctx.status(404).json(Map.of("error", "Unknown category: " + name));
            return;
        }
        ctx.json(index.metadataOf(index.getCategory(name)));
    }

    private void getAuthors(Context ctx) throws Exception {
        List<Map<String, Object>> result = new ArrayList<>();
        for (AuthorEntry author : aggregate(ctx).getByAuthor().values()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("source", author.getIdentity().getSource());
            item.put("id", author.getId());
            item.put("name", author.getName());
            item.put("url", author.getUrl());
            item.put("stories", author.getStories().size());
            result.add(item);
        }
        ctx.json(result);
    }

    private void build(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        if (json == null || !json.hasNonNull("output")) {
            ctx.status(400).json(Map.of("error", "output is required"));
            return;
        }
        Path output = Path.of(json.get("output").asText());
        Path pages = json.hasNonNull("pages") ? Path.of(json.get("pages").asText()) : null;
        boolean includeSubprojects = !json.has("subprojects") || json.get("subprojects").asBoolean(true);
        CatalogStats stats = projectContext.write(
            project -> projectContext.builds().build(project, output, pages, includeSubprojects));
        logger.info("Built archive " + output);
        ctx.json(Map.of("ok", true, "output", output.toAbsolutePath().toString(), "stats", stats));
    }
}
