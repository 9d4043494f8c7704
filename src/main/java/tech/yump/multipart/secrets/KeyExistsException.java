package tech.yump.multipart.secrets;

import lombok.Getter;

/**
 * Thrown by an add request for a key that is already present at the target location.
 */
@Getter
public class KeyExistsException extends MultipartSecretException {

    private final String key;
    private final String path;

    public KeyExistsException(String key, String path) {
        super(path.isEmpty()
                ? "Key already exists: " + key
                : String.format("Key already exists at path '%s': %s", path, key));
        this.key = key;
        this.path = path;
    }
}
