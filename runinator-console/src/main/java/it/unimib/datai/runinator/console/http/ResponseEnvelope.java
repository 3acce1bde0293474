package it.unimib.datai.runinator.console.http;

import com.fasterxml.jackson.databind.JsonNode;
import it.unimib.datai.runinator.common.codec.TaskCodec;
import it.unimib.datai.runinator.common.model.ScheduledTask;

import java.util.List;

/**
 * The response shapes the web service is known to produce.
 */
public sealed interface ResponseEnvelope {

    /** A JSON array of task objects. */
    record TaskList(List<ScheduledTask> tasks) implements ResponseEnvelope {
    }

    /** {@code {"message": ...}} without a success flag, used for list-style errors. */
    record MessageOnly(String message) implements ResponseEnvelope {
    }

    /** {@code {"success": bool, "message": string}}. */
    record Outcome(boolean success, String message) implements ResponseEnvelope {
    }

    /** Anything else. */
    record Unrecognized() implements ResponseEnvelope {
    }

    static ResponseEnvelope classify(JsonNode root) {
        if (root == null) {
            return new Unrecognized();
        }
        if (root.isArray()) {
            return new TaskList(TaskCodec.decodeArray(root));
        }
        if (!root.isObject()) {
            return new Unrecognized();
        }
        JsonNode success = root.get("success");
        JsonNode message = root.get("message");
        boolean hasMessage = message != null && message.isTextual();
        if (success != null && success.isBoolean() && hasMessage) {
            return new Outcome(success.booleanValue(), message.asText());
        }
        if (hasMessage && !message.asText().isEmpty()) {
            return new MessageOnly(message.asText());
        }
        return new Unrecognized();
    }
}
