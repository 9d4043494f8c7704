package tech.yump.multipart.secrets;

import lombok.Getter;

/**
 * Thrown when the same top-level key is stored in two different parts.
 */
@Getter
public class DuplicateKeyException extends MultipartSecretException {

    private final String key;
    private final String firstPartName;
    private final String duplicatePartName;

    public DuplicateKeyException(String key, String firstPartName, String duplicatePartName) {
        super(String.format("Duplicate key '%s' found in secret part '%s' (already present in '%s')",
                key, duplicatePartName, firstPartName));
        this.key = key;
        this.firstPartName = firstPartName;
        this.duplicatePartName = duplicatePartName;
    }
}
