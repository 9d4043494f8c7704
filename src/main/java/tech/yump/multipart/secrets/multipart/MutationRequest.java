package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A change to apply to a multipart secret.
 *
 * @param changes     The key-value pairs to write. Never empty.
 * @param path        Dot-separated path of the object receiving the changes; empty for the root.
 * @param forceUpdate {@code true} to overwrite existing keys only, {@code false} to add new keys only.
 */
public record MutationRequest(
        SortedMap<String, JsonNode> changes,
        String path,
        boolean forceUpdate
) {

    public MutationRequest {
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("JSON data is empty");
        }
        changes = Collections.unmodifiableSortedMap(new TreeMap<>(changes));
        path = path == null ? "" : path.trim();
        if (!path.isEmpty()) {
            for (String segment : path.split("\\.", -1)) {
                if (segment.isEmpty()) {
                    throw new IllegalArgumentException("Path contains an empty segment: '" + path + "'");
                }
            }
        }
    }

    public static MutationRequest of(Map<String, ? extends JsonNode> changes, String path, boolean forceUpdate) {
        return new MutationRequest(changes == null ? null : new TreeMap<>(changes), path, forceUpdate);
    }

    public static MutationRequest add(Map<String, ? extends JsonNode> changes) {
        return of(changes, null, false);
    }

    public static MutationRequest update(Map<String, ? extends JsonNode> changes) {
        return of(changes, null, true);
    }

    public boolean isPathMode() {
        return StringUtils.hasText(path);
    }

    public List<String> pathSegments() {
        return isPathMode() ? Arrays.asList(path.split("\\.")) : List.of();
    }
}
