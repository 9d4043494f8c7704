package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Resolves dot-separated paths against a JSON tree. Object levels are entered by key, array
 * levels by a decimal index.
 */
public final class JsonPathLookup {

    private JsonPathLookup() {}

    public static List<String> segments(String dotPath) {
        if (dotPath == null || dotPath.isBlank()) {
            throw new IllegalArgumentException("Path cannot be null or empty.");
        }
        List<String> segments = Arrays.asList(dotPath.trim().split("\\.", -1));
        if (segments.contains("")) {
            throw new IllegalArgumentException("Path contains an empty segment: '" + dotPath + "'");
        }
        return segments;
    }

    public static Optional<JsonNode> lookup(JsonNode root, List<String> segments) {
        JsonNode current = root;
        for (String segment : segments) {
            if (current == null) {
                return Optional.empty();
            }
            current = switch (current.getNodeType()) {
                case OBJECT -> current.get(segment);
                case ARRAY -> PartNaming.isNumeric(segment) && segment.length() < 10
                        ? current.get(Integer.parseInt(segment))
                        : null;
                default -> null;
            };
        }
        return Optional.ofNullable(current);
    }
}
