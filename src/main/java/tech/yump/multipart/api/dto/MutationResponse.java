package tech.yump.multipart.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.multipart.secrets.multipart.MutationResult;

import java.util.List;

@Schema(description = "Result of an add or update on a multipart secret.")
public record MutationResponse(
        @Schema(description = "Base name of the secret.", example = "myapp/config", requiredMode = Schema.RequiredMode.REQUIRED)
        String baseName,

        @Schema(description = "Total number of top-level keys after the operation.", example = "412", requiredMode = Schema.RequiredMode.REQUIRED)
        int totalKeys,

        @Schema(description = "Total number of parts the secret is stored in.", example = "2", requiredMode = Schema.RequiredMode.REQUIRED)
        int totalParts,

        @Schema(description = "Names of all written parts, base part first.", example = "[\"myapp/config\", \"myapp/config-1\"]")
        List<String> parts,

        @Schema(description = "Names of parts created by this operation.", example = "[\"myapp/config-1\"]")
        List<String> createdParts
) {
    public static MutationResponse from(MutationResult result) {
        return new MutationResponse(result.baseName(), result.keyCount(), result.partCount(),
                result.partNames(), result.createdParts());
    }
}
