package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * The logical key-value document of a multipart secret, or a chunk of it.
 * Entries are always kept sorted by key, so iteration order never depends on how the
 * document was assembled.
 */
public final class SecretDocument {

    private final TreeMap<String, JsonNode> entries;

    public SecretDocument() {
        this.entries = new TreeMap<>();
    }

    private SecretDocument(TreeMap<String, JsonNode> entries) {
        this.entries = entries;
    }

    public static SecretDocument of(Map<String, ? extends JsonNode> values) {
        SecretDocument document = new SecretDocument();
        values.forEach(document::put);
        return document;
    }

    public SecretDocument copy() {
        return new SecretDocument(new TreeMap<>(entries));
    }

    public void put(String key, JsonNode value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, value);
    }

    public JsonNode get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public NavigableMap<String, JsonNode> entries() {
        return Collections.unmodifiableNavigableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecretDocument that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        // Values are secrets; only the key set is printable.
        return "SecretDocument" + entries.keySet();
    }
}
