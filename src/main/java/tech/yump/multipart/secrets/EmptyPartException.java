package tech.yump.multipart.secrets;

import lombok.Getter;

/**
 * Thrown when a stored part parses to an empty JSON object. Empty parts are an inconsistency in
 * the store and are never skipped silently.
 */
@Getter
public class EmptyPartException extends MultipartSecretException {

    private final String partName;

    public EmptyPartException(String partName) {
        super("Secret part '" + partName + "' contains empty JSON data");
        this.partName = partName;
    }
}
