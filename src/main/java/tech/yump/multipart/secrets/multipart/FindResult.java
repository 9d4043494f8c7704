package tech.yump.multipart.secrets.multipart;

/**
 * Location of the first part holding a value at the searched path.
 */
public record FindResult(int index, String name) {
}
