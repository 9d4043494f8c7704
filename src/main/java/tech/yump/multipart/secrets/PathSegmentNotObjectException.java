package tech.yump.multipart.secrets;

import lombok.Getter;

@Getter
public class PathSegmentNotObjectException extends MultipartSecretException {

    private final String segment;
    private final String path;

    public PathSegmentNotObjectException(String segment, String path, String actualType) {
        super(String.format("Path segment '%s' is a %s, not an object (path '%s')",
                segment, actualType, path));
        this.segment = segment;
        this.path = path;
    }
}
