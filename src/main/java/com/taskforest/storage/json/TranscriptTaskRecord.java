package com.taskforest.storage.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforest.core.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A task record backed by a conversation transcript ({@code ui_messages.json})
 * and an optional metadata document ({@code task_metadata.json}).
 * <p>
 * Each transcript entry carries a {@code ts} (epoch millis), a {@code type}
 * of {@code say} or {@code ask}, the matching sub-type field and a
 * {@code text}. Tool and API request texts are themselves JSON documents.
 * Everything is derived on access, so a broken transcript surfaces as an
 * extraction failure of this record only.
 */
public class TranscriptTaskRecord implements TaskRecord {

    private static final Logger log = LoggerFactory.getLogger(TranscriptTaskRecord.class);

    /** Declarations shorter than this are noise, not sub-task instructions. */
    static final int MIN_DECLARATION_LENGTH = 6;

    private static final Pattern TASK_TAG = Pattern.compile("<task>([\\s\\S]*?)</task>", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEW_TASK_BLOCK = Pattern.compile(
            "<\\s*new_task\\b[\\s\\S]*?<\\s*/\\s*new_task\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern MESSAGE_TAG = Pattern.compile(
            "<\\s*message\\s*>([\\s\\S]*?)<\\s*/\\s*message\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEW_TASK_FRAGMENT = Pattern.compile(
            "\\[new_task in ([^:]+):\\s*['\"](.+?)['\"]\\]", Pattern.DOTALL);

    private final String taskId;
    private final JsonNode messages;
    private final JsonNode metadata;
    private final ObjectMapper objectMapper;

    /**
     * @param taskId       the task id, usually the transcript's directory name
     * @param messages     the parsed message array
     * @param metadata     the parsed metadata object, or {@code null}
     * @param objectMapper used for the JSON embedded in message texts
     */
    public TranscriptTaskRecord(String taskId, JsonNode messages, JsonNode metadata, ObjectMapper objectMapper) {
        this.taskId = taskId;
        this.messages = messages;
        this.metadata = metadata;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return taskId;
    }

    @Override
    public String createdAt() {
        String fromMetadata = metadataText("createdAt");
        if (fromMetadata != null && !fromMetadata.isBlank()) {
            return fromMetadata;
        }
        return messageCount() > 0 ? JsonTaskRecord.text(messages.get(0), "ts") : null;
    }

    @Override
    public String lastActivity() {
        int count = messageCount();
        return count > 0 ? JsonTaskRecord.text(messages.get(count - 1), "ts") : null;
    }

    @Override
    public String workspace() {
        return metadataText("workspace");
    }

    @Override
    public String declaredParentId() {
        return metadataText("parentTaskId");
    }

    /**
     * The {@code <task>} content of the first API request; failing that, the
     * first plain text said or asked.
     */
    @Override
    public String ownInstruction() {
        for (JsonNode message : iterableMessages()) {
            if (isSay(message, "api_req_started")) {
                String request = apiRequestText(message);
                if (request != null) {
                    Matcher m = TASK_TAG.matcher(request);
                    if (m.find()) {
                        return m.group(1).strip();
                    }
                    break;
                }
            }
        }
        for (JsonNode message : iterableMessages()) {
            if (isSay(message, "text") || (isAsk(message) && !isAsk(message, "tool"))) {
                String text = JsonTaskRecord.text(message, "text");
                if (text != null && !text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    @Override
    public List<String> declaredChildInstructions() {
        Set<String> declared = new LinkedHashSet<>();
        for (JsonNode message : iterableMessages()) {
            String text = JsonTaskRecord.text(message, "text");
            if (text == null) {
                continue;
            }

            if (isAsk(message, "tool")) {
                JsonNode tool = parseEmbedded(text);
                if (tool != null && "newTask".equals(JsonTaskRecord.text(tool, "tool"))) {
                    addDeclaration(declared, JsonTaskRecord.text(tool, "content"));
                }
            }

            if (isSay(message, "api_req_started")) {
                String request = apiRequestText(message);
                if (request != null) {
                    Matcher m = NEW_TASK_FRAGMENT.matcher(request);
                    while (m.find()) {
                        addDeclaration(declared, m.group(2));
                    }
                }
            }

            Matcher block = NEW_TASK_BLOCK.matcher(text);
            while (block.find()) {
                Matcher body = MESSAGE_TAG.matcher(block.group());
                if (body.find()) {
                    addDeclaration(declared, body.group(1));
                }
            }
        }
        return new ArrayList<>(declared);
    }

    private static void addDeclaration(Set<String> declared, String instruction) {
        if (instruction == null) {
            return;
        }
        String trimmed = instruction.strip();
        if (trimmed.length() >= MIN_DECLARATION_LENGTH) {
            declared.add(trimmed);
        }
    }

    private String apiRequestText(JsonNode message) {
        JsonNode payload = parseEmbedded(JsonTaskRecord.text(message, "text"));
        return payload != null ? JsonTaskRecord.text(payload, "request") : null;
    }

    private JsonNode parseEmbedded(String text) {
        if (text == null || text.isBlank() || text.strip().charAt(0) != '{') {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Task {}: message text is not valid JSON ({})", taskId, e.getOriginalMessage());
            return null;
        }
    }

    private String metadataText(String field) {
        return metadata != null && metadata.isObject() ? JsonTaskRecord.text(metadata, field) : null;
    }

    private int messageCount() {
        return messages != null && messages.isArray() ? messages.size() : 0;
    }

    private Iterable<JsonNode> iterableMessages() {
        return messageCount() > 0 ? messages : List.of();
    }

    private static boolean isSay(JsonNode message, String kind) {
        return "say".equals(JsonTaskRecord.text(message, "type")) && kind.equals(JsonTaskRecord.text(message, "say"));
    }

    private static boolean isAsk(JsonNode message) {
        return "ask".equals(JsonTaskRecord.text(message, "type"));
    }

    private static boolean isAsk(JsonNode message, String kind) {
        return isAsk(message) && kind.equals(JsonTaskRecord.text(message, "ask"));
    }
}
