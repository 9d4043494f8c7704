package tech.yump.multipart.secrets;

import lombok.Getter;

/**
 * Thrown when redistribution would need fewer parts than currently exist. Shrinking is refused
 * because the surplus parts would keep stale copies of redistributed keys.
 */
@Getter
public class InsufficientChunksException extends MultipartSecretException {

    private final int chunkCount;
    private final int existingPartCount;

    public InsufficientChunksException(int chunkCount, int existingPartCount) {
        super(String.format("Number of new chunks (%d) is less than existing multipart secrets (%d). "
                        + "This would leave duplicated keys in extra secrets. "
                        + "Please manually delete extra secrets or check your input",
                chunkCount, existingPartCount));
        this.chunkCount = chunkCount;
        this.existingPartCount = existingPartCount;
    }
}
