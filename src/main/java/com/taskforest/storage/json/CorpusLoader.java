package com.taskforest.storage.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforest.core.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads a task corpus from disk.
 * <p>
 * Two layouts are understood:
 * <ul>
 *   <li>a {@code .json} file holding an array of flat records ({@link JsonTaskRecord});</li>
 *   <li>a directory with one sub-directory per task, each holding {@code ui_messages.json}
 *       and optionally {@code task_metadata.json} ({@link TranscriptTaskRecord}).</li>
 * </ul>
 * Sub-directories without a transcript are skipped.
 */
@Component
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    static final String MESSAGES_FILE = "ui_messages.json";
    static final String METADATA_FILE = "task_metadata.json";

    private final ObjectMapper objectMapper;

    @Autowired
    public CorpusLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CorpusLoader() {
        this(new ObjectMapper());
    }

    /**
     * @throws CorpusLoadException if the path is missing, unreadable or not one of the two layouts
     */
    public List<TaskRecord> load(Path corpus) {
        if (!Files.exists(corpus)) {
            throw new CorpusLoadException("Corpus not found: " + corpus);
        }
        List<TaskRecord> records = Files.isDirectory(corpus) ? loadDirectory(corpus) : loadFile(corpus);
        log.info("Loaded {} record(s) from {}", records.size(), corpus);
        return records;
    }

    private List<TaskRecord> loadFile(Path file) {
        JsonNode root = readJson(file);
        if (!root.isArray()) {
            throw new CorpusLoadException("Expected a JSON array of task records in " + file);
        }
        var records = new ArrayList<TaskRecord>(root.size());
        for (JsonNode node : root) {
            records.add(JsonTaskRecord.fromJson(node));
        }
        return records;
    }

    private List<TaskRecord> loadDirectory(Path dir) {
        List<Path> taskDirs;
        try (Stream<Path> entries = Files.list(dir)) {
            taskDirs = entries.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            throw new CorpusLoadException("Failed to list corpus directory " + dir, e);
        }

        var records = new ArrayList<TaskRecord>(taskDirs.size());
        for (Path taskDir : taskDirs) {
            Path messagesFile = taskDir.resolve(MESSAGES_FILE);
            if (!Files.isRegularFile(messagesFile)) {
                log.debug("Skipping {}: no {}", taskDir.getFileName(), MESSAGES_FILE);
                continue;
            }
            JsonNode messages = readJson(messagesFile);
            Path metadataFile = taskDir.resolve(METADATA_FILE);
            JsonNode metadata = Files.isRegularFile(metadataFile) ? readJson(metadataFile) : null;
            records.add(new TranscriptTaskRecord(taskDir.getFileName().toString(), messages, metadata, objectMapper));
        }
        return records;
    }

    private JsonNode readJson(Path file) {
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new CorpusLoadException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }
}
