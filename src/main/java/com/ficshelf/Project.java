package com.ficshelf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.ficshelf.collab.BookConversionCollaborator;
import com.ficshelf.collab.RetrievalCollaborator;
import com.ficshelf.collab.RetrievalRequest;
import com.ficshelf.collab.RetrievalResult;
import com.ficshelf.convert.MetadataConverters;
import com.ficshelf.errors.AlreadyExistsException;
import com.ficshelf.errors.CollaboratorFailureException;
import com.ficshelf.errors.CyclicSubprojectException;
import com.ficshelf.errors.FicShelfException;
import com.ficshelf.errors.MalformedSourceException;
import com.ficshelf.errors.MissingMetadataException;
import com.ficshelf.errors.NotAProjectException;
import com.ficshelf.models.AddResult;
import com.ficshelf.models.BulkAddResult;
import com.ficshelf.models.CanonicalMetadata;
import com.ficshelf.models.CatalogWarning;
import com.ficshelf.models.DownloadOutcome;
import com.ficshelf.models.MetadataCollection;
import com.ficshelf.models.RawMetadata;
import com.ficshelf.models.StoryRecord;
import com.ficshelf.storage.FileTrees;
import com.ficshelf.storage.JsonStorage;
import com.ficshelf.target.Target;
import com.ficshelf.target.TargetIdentity;
import com.ficshelf.target.TargetResolver;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A project directory: the target list, downloaded stories and the per-project
 * options, aliases, update marks and subproject links.
 *
 * <pre>
 * project.json          options, marks the directory as a project
 * target_urls.txt       one target URL per line
 * aliases.json          category aliases
 * update_marks.json     targets to re-download
 * subprojects.txt       relative paths of nested projects
 * resources/            static files for the archive build
 * fanfics/{source}/{id}/story.html, metadata.json, images/
 * </pre>
 */
public class Project {

    public static final String MARKER_FILE = ProjectOptions.FILE_NAME;
    public static final String STORIES_DIR = "fanfics";
    public static final String RESOURCES_DIR = "resources";
    public static final String METADATA_FILE = "metadata.json";
    public static final String STORY_FILE = "story.html";
    public static final String IMAGES_DIR = "images";
    public static final String UNCATEGORIZED = "Uncategorized";
    static final String BACKUP_DIR = ".update-backup";

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final Path root;
    private final ProjectOptions options;
    private final TargetList targets;
    private final UpdateMarkStore updateMarks;
    private final SubprojectList subprojects;
    private CategoryAliasTable aliases;

    private Project(Path root) {
        this.root = root;
        this.options = new ProjectOptions(root);
        this.targets = new TargetList(root);
        this.updateMarks = new UpdateMarkStore(root);
        this.subprojects = new SubprojectList(root);
    }

    /**
     * Open an existing project.
     *
     * @throws NotAProjectException if {@code path} has no project marker
     */
    public static Project open(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!isValidProject(normalized)) {
            throw new NotAProjectException(normalized.toString());
        }
        return new Project(normalized);
    }

    public static boolean isValidProject(Path path) {
        return Files.isDirectory(path) && Files.isRegularFile(path.resolve(MARKER_FILE));
    }

    /**
     * Create a new project. The directory is created if needed, but not its
     * parents; an existing directory must be empty.
     *
     * @throws AlreadyExistsException     if {@code path} already is a project
     * @throws DirectoryNotEmptyException if {@code path} exists and is not empty
     */
    public static Project init(Path path) throws IOException {
        Path normalized = path.toAbsolutePath().normalize();
        if (isValidProject(normalized)) {
            throw new AlreadyExistsException(normalized.toString(), "Already a valid project: " + normalized);
        }
        if (!Files.exists(normalized)) {
            Files.createDirectory(normalized);
        } else {
            try (Stream<Path> entries = Files.list(normalized)) {
                if (entries.findAny().isPresent()) {
                    throw new DirectoryNotEmptyException(normalized.toString());
                }
            }
        }

        ProjectOptions.writeDefaults(normalized);
        TargetList.writeDefaults(normalized);
        CategoryAliasTable.writeEmpty(normalized);
        SubprojectList.writeDefaults(normalized);
        Files.createDirectories(normalized.resolve(RESOURCES_DIR));
        log("Initialized project at " + normalized);
        return new Project(normalized);
    }

    public Path getRoot() {
        return root;
    }

    public ProjectOptions options() {
        return options;
    }

    // ---- options ----

    public Object getOption(String category, String name, Object defaultValue) throws IOException {
        return options.get(category, name, defaultValue);
    }

    public void setOption(String category, String name, Object value) throws IOException {
        options.set(category, name, value);
    }

    // ---- targets ----

    public AddResult addTarget(String reference) throws IOException {
        return targets.add(reference);
    }

    public BulkAddResult addTargetsFromBulkSource(List<String> references) throws IOException {
        return targets.addAll(references);
    }

    /**
     * Add every story reference found anywhere in a text file.
     */
    public BulkAddResult addTargetsFromFile(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        List<String> urls = new ArrayList<>();
        for (Target found : TargetResolver.findAllReferences(text)) {
            urls.add(found.getUrl());
        }
        log("Found " + urls.size() + " references in " + file);
        return targets.addAll(urls);
    }

    public List<Target> listTargets() throws IOException {
        return listTargets(false);
    }

    /**
     * @param excludeDownloaded only return targets with nothing stored locally
     */
    public List<Target> listTargets(boolean excludeDownloaded) throws IOException {
        List<Target> all = targets.list();
        if (!excludeDownloaded) {
            return all;
        }
        List<Target> pending = new ArrayList<>();
        for (Target target : all) {
            if (!hasTargetLocally(target)) {
                pending.add(target);
            }
        }
        return pending;
    }

    public boolean hasTarget(Target target) throws IOException {
        return targets.contains(target);
    }

    public boolean hasTargetLocally(Target target) {
        return Files.isDirectory(targetDirectory(target.getIdentity()));
    }

    public Path storiesDirectory() {
        return root.resolve(STORIES_DIR);
    }

    public Path targetDirectory(TargetIdentity identity) {
        return storiesDirectory().resolve(identity.getSource()).resolve(identity.getId());
    }

    // ---- download / update ----

    /**
     * Fetch a target into {@code fanfics/{source}/{id}} and store the
     * collaborator's metadata output next to it. A failed fetch leaves no
     * directory behind.
     *
     * @throws AlreadyExistsException if the target is already stored locally
     */
    public DownloadOutcome downloadTarget(Target target, RetrievalCollaborator collaborator) throws IOException {
        Path dir = targetDirectory(target.getIdentity());
        if (Files.exists(dir)) {
            throw new AlreadyExistsException(target.getUrl(), "Target already downloaded: " + target.subpath());
        }
        RetrievalRequest request = new RetrievalRequest(target, dir, outputTemplate(dir),
            options.getBoolean("download", "include_images", true));

        RetrievalResult result;
        try {
            result = collaborator.retrieve(request);
        } catch (CollaboratorFailureException e) {
            logWarn("Download of " + target.getUrl() + " failed: " + e.getMessage());
            FileTrees.deleteRecursively(dir);
            return DownloadOutcome.failed(target, e.getMessage());
        } catch (RuntimeException e) {
            FileTrees.deleteRecursively(dir);
            throw e;
        }

        if (!Files.isDirectory(dir)) {
            logWarn("Download of " + target.getUrl() + " reported success but produced no " + target.subpath());
            return DownloadOutcome.failed(target, "No output was written to " + target.subpath());
        }
        try {
            Files.writeString(dir.resolve(METADATA_FILE), result.getMetadataJson(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logWarn("Could not store metadata of " + target.getUrl() + ": " + e.getMessage());
            FileTrees.deleteRecursively(dir);
            return DownloadOutcome.failed(target, "Could not write " + METADATA_FILE + ": " + e.getMessage());
        }
        log("Downloaded " + target.getUrl() + " into " + target.subpath());
        return DownloadOutcome.downloaded(target);
    }

    /**
     * Re-download a stored target. The old copy is kept aside until the new
     * download succeeds and put back if it does not. A successful update
     * clears the target's update mark.
     */
    public DownloadOutcome updateTarget(Target target, RetrievalCollaborator collaborator) throws IOException {
        Path dir = targetDirectory(target.getIdentity());
        if (!Files.isDirectory(dir)) {
            return downloadAndUnmark(target, collaborator, false);
        }

        Path backup = root.resolve(BACKUP_DIR).resolve(target.getSource()).resolve(target.getId());
        FileTrees.deleteRecursively(backup);
        Files.createDirectories(backup.getParent());
        Files.move(dir, backup, StandardCopyOption.REPLACE_EXISTING);

        DownloadOutcome outcome;
        try {
            outcome = downloadAndUnmark(target, collaborator, true);
        } catch (RuntimeException | IOException e) {
            restore(backup, dir);
            throw e;
        }
        if (outcome.isSuccess()) {
            FileTrees.deleteRecursively(backup);
        } else {
            restore(backup, dir);
        }
        return outcome;
    }

    private DownloadOutcome downloadAndUnmark(Target target, RetrievalCollaborator collaborator, boolean replacing) throws IOException {
        DownloadOutcome outcome = downloadTarget(target, collaborator);
        if (!outcome.isSuccess()) {
            return outcome;
        }
        updateMarks.mark(target, false);
        return replacing ? DownloadOutcome.updated(target) : outcome;
    }

    private void restore(Path backup, Path dir) throws IOException {
        FileTrees.deleteRecursively(dir);
        Files.move(backup, dir);
        logWarn("Restored previous copy of " + root.relativize(dir));
    }

    private static String outputTemplate(Path dir) {
        return dir + File.separator + "story${formatext}";
    }

    public boolean markForUpdate(Target target, boolean required) throws IOException {
        return updateMarks.mark(target, required);
    }

    public List<Target> listMarkedForUpdate() throws IOException {
        return updateMarks.list();
    }

    /**
     * Convert one stored story to an e-book.
     */
    public void convertTarget(Target target, BookConversionCollaborator converter, Path output) throws IOException {
        TargetIdentity identity = target.getIdentity();
        if (!hasTargetLocally(target)) {
            throw new MissingMetadataException(target.getUrl(), "Target is not stored locally: " + target.subpath());
        }
        CanonicalMetadata metadata = MetadataConverters.convert(readRawMetadata(identity), identity);
        converter.convert(targetDirectory(identity), metadata, output);
    }

    // ---- category aliases ----

    public synchronized CategoryAliasTable getCategoryAliases() throws IOException {
        if (aliases == null) {
            aliases = CategoryAliasTable.load(root);
        }
        return aliases;
    }

    public void addCategoryAlias(String from, String to) throws IOException {
        getCategoryAliases().addAlias(from, to);
    }

    // ---- subprojects ----

    /**
     * Link a nested project by its path relative to this one.
     *
     * @return false if the path was already linked
     * @throws NotAProjectException if the path is not a project
     */
    public boolean addSubproject(String relativePath) throws IOException {
        Path resolved = root.resolve(relativePath).normalize();
        if (!isValidProject(resolved)) {
            throw new NotAProjectException(resolved.toString());
        }
        if (resolved.equals(root)) {
            throw new CyclicSubprojectException(resolved.toString(), root.toString());
        }
        return subprojects.add(relativePath);
    }

    public List<String> listSubprojectPaths() throws IOException {
        return subprojects.list();
    }

    /**
     * All projects below this one, depth first in listed order. This project
     * itself is not included.
     *
     * @throws CyclicSubprojectException if a project links back to one of its ancestors
     */
    public List<Project> getSubprojects() throws IOException {
        List<Project> result = new ArrayList<>();
        Set<Path> onPath = new HashSet<>();
        onPath.add(realPath(root));
        collectSubprojects(this, onPath, new HashSet<>(), result);
        return result;
    }

    private static void collectSubprojects(Project parent, Set<Path> onPath, Set<Path> seen, List<Project> out) throws IOException {
        for (String rel : parent.listSubprojectPaths()) {
            Path resolved = parent.root.resolve(rel).normalize();
            Project child = open(resolved);
            Path key = realPath(child.root);
            if (onPath.contains(key)) {
                throw new CyclicSubprojectException(key.toString(), parent.root.toString());
            }
            if (!seen.add(key)) {
                continue;
            }
            out.add(child);
            onPath.add(key);
            collectSubprojects(child, onPath, seen, out);
            onPath.remove(key);
        }
    }

    private static Path realPath(Path path) throws IOException {
        return path.toRealPath();
    }

    // ---- stored stories ----

    /**
     * Identities of every story directory under {@code fanfics/}, in (source, id) order.
     */
    public List<TargetIdentity> listStoredIdentities() throws IOException {
        List<TargetIdentity> identities = new ArrayList<>();
        for (String source : FileTrees.listSubdirectories(storiesDirectory())) {
            for (String id : FileTrees.listSubdirectories(storiesDirectory().resolve(source))) {
                identities.add(new TargetIdentity(source, id));
            }
        }
        identities.sort(null);
        return identities;
    }

    /**
     * Read a stored story's metadata file as written by the retrieval tool.
     *
     * @throws MissingMetadataException if there is no readable metadata file
     * @throws MalformedSourceException if the file is not a JSON object
     */
    public RawMetadata readRawMetadata(TargetIdentity identity) {
        Path file = targetDirectory(identity).resolve(METADATA_FILE);
        if (!Files.isRegularFile(file)) {
            throw new MissingMetadataException(identity.subpath(), "Story " + identity.subpath() + " has no metadata");
        }
        Map<String, Object> content;
        try {
            content = JsonStorage.mapper().readValue(file.toFile(), OBJECT_TYPE);
        } catch (JsonProcessingException e) {
            throw new MalformedSourceException(identity.subpath(),
                "Metadata of " + identity.subpath() + " is not a JSON object: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new MissingMetadataException(identity.subpath(), "Could not read metadata of " + identity.subpath(), e);
        }
        if (content == null) {
            throw new MalformedSourceException(identity.subpath(), "Metadata of " + identity.subpath() + " is empty");
        }
        return new RawMetadata(content);
    }

    /**
     * Converted metadata of every locally stored story, with this project's
     * category aliases applied. Stories that cannot be read are reported as
     * warnings and left out.
     */
    public MetadataCollection collectMetadata() throws IOException {
        CategoryAliasTable table = getCategoryAliases();
        List<StoryRecord> records = new ArrayList<>();
        List<CatalogWarning> warnings = new ArrayList<>();
        for (TargetIdentity identity : listStoredIdentities()) {
            try {
                CanonicalMetadata metadata = MetadataConverters.convert(readRawMetadata(identity), identity);
                String category = metadata.getCategory();
                if (category == null || category.isBlank()) {
                    category = UNCATEGORIZED;
                }
                records.add(new StoryRecord(identity, metadata.withCategory(table.resolve(category))));
            } catch (FicShelfException e) {
                logWarn("Skipping " + identity.subpath() + ": " + e.getMessage());
                warnings.add(new CatalogWarning(root.relativize(targetDirectory(identity)).toString(), e.getMessage()));
            } catch (RuntimeException e) {
                logWarn("Skipping " + identity.subpath() + ", unreadable metadata: " + e);
                warnings.add(new CatalogWarning(root.relativize(targetDirectory(identity)).toString(),
                    "Unreadable metadata: " + e.getMessage()));
            }
        }
        return new MetadataCollection(records, warnings);
    }

    /**
     * Titles of the locally stored stories, in identity order. Stories without
     * readable metadata are left out.
     */
    public List<Map.Entry<TargetIdentity, String>> listTitles() throws IOException {
        List<Map.Entry<TargetIdentity, String>> titles = new ArrayList<>();
        for (StoryRecord record : collectMetadata().getRecords()) {
            String title = record.getMetadata().getTitle();
            titles.add(new AbstractMap.SimpleImmutableEntry<>(record.getIdentity(), title != null ? title : CanonicalMetadata.UNKNOWN));
        }
        return titles;
    }

    @Override
    public String toString() {
        return "Project(" + root + ")";
    }

    private static void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[Project] " + message);
        }
    }

    private static void logWarn(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[Project] " + message);
        }
    }
}
