package tech.yump.multipart.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Location of a path within the parts of a multipart secret.")
public record FindResponse(
        @Schema(description = "Base name of the secret.", example = "myapp/config", requiredMode = Schema.RequiredMode.REQUIRED)
        String baseName,

        @Schema(description = "The searched dot-separated path.", example = "Db.User", requiredMode = Schema.RequiredMode.REQUIRED)
        String path,

        @Schema(description = "Index of the part holding the path (0 is the base part).", example = "1", requiredMode = Schema.RequiredMode.REQUIRED)
        int partIndex,

        @Schema(description = "Name of the part holding the path.", example = "myapp/config-1", requiredMode = Schema.RequiredMode.REQUIRED)
        String partName
) {
}
