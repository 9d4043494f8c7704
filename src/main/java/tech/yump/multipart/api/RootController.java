package tech.yump.multipart.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.multipart.config.MultipartProperties;

import java.util.Map;

@RestController
@Tag(name = "System", description = "System information and status endpoints")
public class RootController {

  private final MultipartProperties properties;

  public RootController(MultipartProperties properties) {
    this.properties = properties;
  }

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Provides a simple welcome message and status check."
  )
  @ApiResponse(responseCode = "200", description = "Welcome message and status.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"Welcome to Multipart Secrets API\", \"status\": \"OK\"}")))
  public Map<String, String> getRoot() {
    return Map.of("message", "Welcome to Multipart Secrets API", "status", "OK");
  }

  @GetMapping("/sys/partitioning")
  @Operation(
          summary = "Get Partitioning Settings",
          description = "Returns the store backend and the limits used when secrets are split into parts."
  )
  @ApiResponse(responseCode = "200", description = "Partitioning settings retrieved.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"backend\": \"AWS\", \"maxPartBytes\": 51200, \"maxOverflowParts\": 5}")))
  public Map<String, Object> getPartitioning() {
    return Map.of(
            "backend", properties.store().backend().name(),
            "maxPartBytes", properties.partitioning().maxPartBytes(),
            "maxOverflowParts", properties.partitioning().maxOverflowParts());
  }
}
