package tech.yump.multipart.secrets;

import lombok.Getter;

/**
 * Thrown when a single key-value pair serializes to more bytes than one part may hold.
 * Values are never split across parts.
 */
@Getter
public class KeyTooLargeException extends MultipartSecretException {

    private final String key;
    private final int size;
    private final int limit;

    public KeyTooLargeException(String key, int size, int limit) {
        super(String.format("Key '%s' exceeds max chunk size (%d bytes): got %d", key, limit, size));
        this.key = key;
        this.size = size;
        this.limit = limit;
    }
}
