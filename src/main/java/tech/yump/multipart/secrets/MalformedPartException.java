package tech.yump.multipart.secrets;

import lombok.Getter;

/**
 * Thrown when a stored part is not valid JSON or its top level is not a JSON object.
 */
@Getter
public class MalformedPartException extends MultipartSecretException {

    private final String partName;

    public MalformedPartException(String partName, String reason) {
        super("Secret part '" + partName + "' is malformed: " + reason);
        this.partName = partName;
    }

    public MalformedPartException(String partName, String reason, Throwable cause) {
        super("Secret part '" + partName + "' is malformed: " + reason, cause);
        this.partName = partName;
    }
}
