package tech.yump.multipart.secrets;

import lombok.Getter;

/**
 * Thrown when redistribution would allocate an overflow part beyond the configured maximum.
 */
@Getter
public class PartLimitExceededException extends MultipartSecretException {

    private final int requestedIndex;
    private final int maxOverflowParts;

    public PartLimitExceededException(int requestedIndex, int maxOverflowParts) {
        super(String.format("Redistribution needs overflow part %d but at most %d overflow parts are allowed",
                requestedIndex, maxOverflowParts));
        this.requestedIndex = requestedIndex;
        this.maxOverflowParts = maxOverflowParts;
    }
}
