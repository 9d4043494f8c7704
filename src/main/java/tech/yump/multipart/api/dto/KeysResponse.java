package tech.yump.multipart.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Top-level key names of a multipart secret. Values are never returned.")
public record KeysResponse(
        @Schema(description = "Base name of the secret.", example = "myapp/config", requiredMode = Schema.RequiredMode.REQUIRED)
        String baseName,

        @Schema(description = "Number of keys.", example = "2", requiredMode = Schema.RequiredMode.REQUIRED)
        int totalKeys,

        @Schema(description = "Key names in ascending order.", example = "[\"apiKey\", \"timeout\"]")
        List<String> keys
) {
}
