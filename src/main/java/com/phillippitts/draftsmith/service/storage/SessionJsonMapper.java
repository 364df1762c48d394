package com.phillippitts.draftsmith.service.storage;

import com.phillippitts.draftsmith.domain.iteration.IterationHistoryEntry;
import com.phillippitts.draftsmith.domain.iteration.IterationState;
import com.phillippitts.draftsmith.domain.iteration.StepKind;
import com.phillippitts.draftsmith.domain.session.Session;
import com.phillippitts.draftsmith.domain.session.StepOutput;
import com.phillippitts.draftsmith.domain.session.StepRecord;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Renders session snapshots as JSON using wire names for enums
 * ({@code "mode": "outline"}, {@code "kind": "regenerate"}).
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class SessionJsonMapper {

    private SessionJsonMapper() {
        // Utility class
    }

    static JSONObject toJson(Session session) {
        JSONObject json = new JSONObject();
        json.put("id", session.id());
        json.put("mode", session.mode().wireName());
        putOpt(json, "personaId", session.personaId());
        putOpt(json, "templateId", session.templateId());
        putOpt(json, "subject", session.subject());
        json.put("historyDepth", session.historyDepth());
        json.put("createdAt", session.createdAt().toString());
        json.put("updatedAt", session.updatedAt().toString());
        json.put("currentState", stateToJson(session.state()));

        JSONArray steps = new JSONArray();
        for (StepRecord record : session.steps()) {
            steps.put(stepToJson(record));
        }
        json.put("steps", steps);

        JSONObject outputs = new JSONObject();
        for (Map.Entry<StepKind, StepOutput> entry : session.outputs().entrySet()) {
            outputs.put(entry.getKey().wireName(), outputToJson(entry.getValue()));
        }
        json.put("outputs", outputs);
        return json;
    }

    static JSONObject stateToJson(IterationState state) {
        JSONObject json = new JSONObject();
        json.put("mode", state.mode().wireName());
        json.put("status", state.status().name().toLowerCase(Locale.ROOT));
        json.put("cycle", state.cycle());
        json.put("nextRequiredStep", state.isCompleted() ? "completed" : state.nextRequiredStep().wireName());
        json.put("canApprove", state.canApprove());
        JSONArray history = new JSONArray();
        for (IterationHistoryEntry entry : state.history()) {
            JSONObject h = new JSONObject();
            h.put("sequence", entry.sequence());
            h.put("cycle", entry.cycle());
            h.put("kind", entry.kind().wireName());
            h.put("payload", toJsonValue(entry.payload()));
            history.put(h);
        }
        json.put("history", history);
        return json;
    }

    private static JSONObject stepToJson(StepRecord record) {
        JSONObject json = new JSONObject();
        json.put("stepId", record.stepId());
        json.put("sessionId", record.sessionId());
        json.put("kind", record.kind().wireName());
        json.put("input", toJsonValue(record.input()));
        json.put("output", outputToJson(record.output()));
        json.put("timestamp", record.timestamp().toString());
        json.put("durationMs", record.durationMs());
        return json;
    }

    static JSONObject outputToJson(StepOutput output) {
        JSONObject json = new JSONObject();
        json.put("type", output.type());
        if (output instanceof StepOutput.Generated g) {
            json.put("content", g.content());
            json.put("promptTokens", g.promptTokens());
            json.put("completionTokens", g.completionTokens());
            json.put("totalTokens", g.totalTokens());
            putOpt(json, "finishReason", g.finishReason());
            putOpt(json, "model", g.model());
        } else if (output instanceof StepOutput.Failed f) {
            json.put("code", f.code());
            json.put("message", f.message());
            json.put("recoverable", f.recoverable());
            json.put("details", toJsonValue(f.details()));
        } else if (output instanceof StepOutput.Skipped s) {
            putOpt(json, "reason", s.reason());
        }
        return json;
    }

    /**
     * Converts payload values to JSON-compatible values. Records and other objects are rendered
     * with {@code toString()}; nulls become {@link JSONObject#NULL}.
     */
    static Object toJsonValue(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        if (value instanceof Map<?, ?> map) {
            JSONObject json = new JSONObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                json.put(String.valueOf(entry.getKey()), toJsonValue(entry.getValue()));
            }
            return json;
        }
        if (value instanceof Collection<?> collection) {
            JSONArray array = new JSONArray();
            for (Object item : collection) {
                array.put(toJsonValue(item));
            }
            return array;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        if (value instanceof Enum<?> e) {
            return e.name().toLowerCase(Locale.ROOT);
        }
        return String.valueOf(value);
    }

    private static void putOpt(JSONObject json, String key, String value) {
        if (value != null) {
            json.put(key, value);
        }
    }
}
