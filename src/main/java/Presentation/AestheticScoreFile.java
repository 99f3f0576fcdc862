package Presentation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads externally produced aesthetic scores. Accepts either an object mapping image id to
 * score, or an array of {@code {"image_id": ..., "overall_aesthetic": ...}} entries.
 */
public final class AestheticScoreFile {

    private final ObjectMapper mapper;

    public AestheticScoreFile(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, Integer> read(Path file) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        Map<String, Integer> scores = new HashMap<>();

        if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = root.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                scores.put(e.getKey(), toScore(e.getKey(), e.getValue()));
            }
        } else if (root.isArray()) {
            for (JsonNode entry : root) {
                JsonNode id = entry.get("image_id");
                JsonNode score = entry.has("overall_aesthetic") ? entry.get("overall_aesthetic") : entry.get("aesthetic_score");
                if (id == null || !id.isTextual() || score == null) {
                    throw new IOException("Aesthetic entry needs image_id and overall_aesthetic: " + entry);
                }
                scores.put(id.asText(), toScore(id.asText(), score));
            }
        } else {
            throw new IOException("Aesthetic score file must hold a JSON object or array: " + file);
        }
        return scores;
    }

    private static int toScore(String id, JsonNode value) throws IOException {
        if (!value.isNumber()) {
            throw new IOException("Aesthetic score for " + id + " is not a number: " + value);
        }
        return (int) Math.round(value.asDouble());
    }
}
