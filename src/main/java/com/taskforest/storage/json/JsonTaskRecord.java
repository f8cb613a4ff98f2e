package com.taskforest.storage.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskforest.core.model.TaskRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * A flat task record as stored in a JSON corpus file.
 * <p>
 * Values are kept as raw text; validation is left to the skeleton extractor.
 */
public record JsonTaskRecord(
        String id,
        String createdAt,
        String lastActivity,
        String workspace,
        String ownInstruction,
        List<String> declaredChildInstructions,
        String declaredParentId
) implements TaskRecord {

    public JsonTaskRecord {
        declaredChildInstructions = declaredChildInstructions != null ? List.copyOf(declaredChildInstructions) : List.of();
    }

    /**
     * Reads one element of a corpus array. Accepts {@code taskId} or {@code id}
     * for the identifier; unknown fields are ignored.
     */
    public static JsonTaskRecord fromJson(JsonNode node) {
        String id = text(node, "taskId");
        if (id == null) {
            id = text(node, "id");
        }
        var children = new ArrayList<String>();
        JsonNode childNode = node.get("childInstructions");
        if (childNode != null && childNode.isArray()) {
            for (JsonNode child : childNode) {
                if (child.isTextual()) {
                    children.add(child.asText());
                }
            }
        }
        return new JsonTaskRecord(
                id,
                text(node, "createdAt"),
                text(node, "lastActivity"),
                text(node, "workspace"),
                text(node, "instruction"),
                children,
                text(node, "parentTaskId"));
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
