package tech.yump.multipart.secrets;

import lombok.Getter;

@Getter
public class PathSegmentMissingException extends MultipartSecretException {

    private final String segment;
    private final String path;

    public PathSegmentMissingException(String segment, String path) {
        super(String.format("Path segment '%s' does not exist (path '%s')", segment, path));
        this.segment = segment;
        this.path = path;
    }
}
