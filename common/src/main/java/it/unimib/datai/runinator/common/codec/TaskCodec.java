package it.unimib.datai.runinator.common.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimib.datai.runinator.common.model.ScheduledTask;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts {@link ScheduledTask} to and from its snake_case JSON form.
 *
 * <p>Decoding never fails on missing, null or mistyped fields; it falls back to defaults instead.
 * Encoding always writes every key, using JSON null for absent values.</p>
 */
public final class TaskCodec {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private TaskCodec() {}

    public static ScheduledTask decode(JsonNode node) {
        Long id = node.hasNonNull("id") ? node.get("id").asLong() : null;
        return new ScheduledTask(
                id,
                text(node, "name"),
                text(node, "cron_schedule"),
                text(node, "action_name"),
                text(node, "action_function"),
                text(node, "action_configuration"),
                node.path("timeout").asLong(0),
                timestamp(node, "next_execution"),
                bool(node, "enabled", true),
                bool(node, "immediate", false),
                timestamp(node, "blackout_start"),
                timestamp(node, "blackout_end")
        );
    }

    /**
     * Decodes the object elements of a JSON array in order; any other element is skipped.
     */
    public static List<ScheduledTask> decodeArray(JsonNode array) {
        List<ScheduledTask> tasks = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            if (item.isObject()) {
                tasks.add(decode(item));
            }
        }
        return tasks;
    }

    public static ObjectNode encode(ScheduledTask task) {
        ObjectNode obj = NODES.objectNode();
        if (task.id() == null) {
            obj.putNull("id");
        } else {
            obj.put("id", task.id());
        }
        obj.put("name", task.name());
        obj.put("cron_schedule", task.cronSchedule());
        obj.put("action_name", task.actionName());
        obj.put("action_function", task.actionFunction());
        obj.put("action_configuration", task.actionConfiguration());
        obj.put("timeout", task.timeout());
        obj.put("next_execution", TaskTimestamps.format(task.nextExecution()));
        obj.put("enabled", task.enabled());
        obj.put("immediate", task.immediate());
        obj.put("blackout_start", TaskTimestamps.format(task.blackoutStart()));
        obj.put("blackout_end", TaskTimestamps.format(task.blackoutEnd()));
        return obj;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : "";
    }

    private static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.booleanValue() : fallback;
    }

    private static Instant timestamp(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        return TaskTimestamps.parse(value.asText());
    }
}
