package tech.yump.multipart.secrets;

import lombok.Getter;

/**
 * Thrown by a force-update request for a key that does not exist yet. Updates never create keys.
 */
@Getter
public class KeyMissingException extends MultipartSecretException {

    private final String key;
    private final String path;

    public KeyMissingException(String key, String path) {
        super(path.isEmpty()
                ? "Key does not exist and cannot be updated: " + key
                : String.format("Key does not exist at path '%s' and cannot be updated: %s", path, key));
        this.key = key;
        this.path = path;
    }
}
