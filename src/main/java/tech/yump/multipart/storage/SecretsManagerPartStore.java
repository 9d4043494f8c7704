package tech.yump.multipart.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.APIErrorType;
import software.amazon.awssdk.services.secretsmanager.model.BatchGetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.BatchGetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.Filter;
import software.amazon.awssdk.services.secretsmanager.model.FilterNameStringType;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.SecretValueEntry;
import software.amazon.awssdk.services.secretsmanager.model.Tag;
import software.amazon.awssdk.services.secretsmanager.model.UpdateSecretRequest;
import tech.yump.multipart.secrets.multipart.PartNaming;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link PartStore} backed by AWS Secrets Manager. Every part is one secret whose
 * SecretString is the part's JSON object.
 */
@Slf4j
@RequiredArgsConstructor
public class SecretsManagerPartStore implements PartStore {

  // BatchGetSecretValue accepts at most 20 secret ids per call
  static final int BATCH_GET_MAX_IDS = 20;
  static final String RESOURCE_NOT_FOUND = "ResourceNotFoundException";

  private final SecretsManagerClient client;

  @Override
  public List<Integer> listPartIndices(String baseName) throws StorageException {
    requireName(baseName);
    List<Integer> indices = new ArrayList<>();
    String nextToken = null;
    try {
      do {
        // The name filter is a prefix match, which also returns unrelated secrets sharing the prefix
        ListSecretsRequest request = ListSecretsRequest.builder()
                .filters(Filter.builder().key(FilterNameStringType.NAME).values(baseName).build())
                .nextToken(nextToken)
                .build();
        ListSecretsResponse response = client.listSecrets(request);
        for (SecretListEntry secret : response.secretList()) {
          PartNaming.parseIndex(baseName, secret.name()).ifPresent(indices::add);
        }
        nextToken = response.nextToken();
      } while (StringUtils.hasText(nextToken));
    } catch (SdkException e) {
      log.error("Failed to list secrets for base name '{}': {}", baseName, e.getMessage(), e);
      throw new StoreUnavailableException("Failed to list multipart secrets for: " + baseName, e);
    }
    indices.sort(null);
    log.debug("Found part indices {} for base name '{}'", indices, baseName);
    return indices;
  }

  @Override
  public Map<Integer, byte[]> fetchParts(String baseName, List<Integer> indices) throws StorageException {
    requireName(baseName);
    if (indices == null || indices.isEmpty()) {
      throw new IllegalArgumentException("No part indices provided to fetch.");
    }

    List<String> names = indices.stream().map(index -> PartNaming.partName(baseName, index)).toList();
    Map<String, byte[]> values = new HashMap<>();
    for (int from = 0; from < names.size(); from += BATCH_GET_MAX_IDS) {
      List<String> batch = names.subList(from, Math.min(from + BATCH_GET_MAX_IDS, names.size()));
      BatchGetSecretValueResponse response;
      try {
        response = client.batchGetSecretValue(BatchGetSecretValueRequest.builder().secretIdList(batch).build());
      } catch (SdkException e) {
        log.error("Failed to batch get secret values {}: {}", batch, e.getMessage(), e);
        throw new StoreUnavailableException("Failed to batch get secret values", e);
      }
      for (SecretValueEntry entry : response.secretValues()) {
        values.put(entry.name(), payloadOf(entry));
      }
      if (response.hasErrors()) {
        for (APIErrorType error : response.errors()) {
          log.warn("Batch get reported error for '{}': {} {}", error.secretId(), error.errorCode(), error.message());
          // Missing secrets surface as PartNotFoundException below; anything else means the part is unreadable
          if (!RESOURCE_NOT_FOUND.equals(error.errorCode())) {
            throw new StoreUnavailableException("Failed to read secret part '" + error.secretId() + "': "
                    + error.errorCode() + " " + error.message());
          }
        }
      }
    }

    Map<Integer, byte[]> parts = new LinkedHashMap<>();
    for (int i = 0; i < indices.size(); i++) {
      byte[] payload = values.get(names.get(i));
      if (payload == null) {
        throw new PartNotFoundException(names.get(i));
      }
      parts.put(indices.get(i), payload);
    }
    return parts;
  }

  @Override
  public void upsertPart(String name, byte[] payload, Map<String, String> tags) throws StorageException {
    requireName(name);
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null for upsert operation.");
    }
    String secretString = new String(payload, StandardCharsets.UTF_8);
    try {
      if (exists(name)) {
        client.updateSecret(UpdateSecretRequest.builder()
                .secretId(name)
                .secretString(secretString)
                .build());
        log.info("Updated secret '{}' ({} bytes)", name, payload.length);
      } else {
        List<Tag> tagList = new ArrayList<>();
        if (tags != null) {
          tags.forEach((key, value) -> tagList.add(Tag.builder().key(key).value(value).build()));
        }
        client.createSecret(CreateSecretRequest.builder()
                .name(name)
                .secretString(secretString)
                .tags(tagList)
                .build());
        log.info("Created secret '{}' ({} bytes, {} tags)", name, payload.length, tagList.size());
      }
    } catch (SdkException e) {
      log.error("Failed to create/modify secret '{}': {}", name, e.getMessage(), e);
      throw new StoreUnavailableException("Failed to create/modify secret: " + name, e);
    }
  }

  private boolean exists(String name) {
    try {
      client.describeSecret(DescribeSecretRequest.builder().secretId(name).build());
      return true;
    } catch (ResourceNotFoundException e) {
      log.debug("Secret '{}' does not exist yet", name);
      return false;
    }
  }

  private static byte[] payloadOf(SecretValueEntry entry) {
    if (entry.secretString() != null) {
      return entry.secretString().getBytes(StandardCharsets.UTF_8);
    }
    return entry.secretBinary() != null ? entry.secretBinary().asByteArray() : null;
  }

  private static void requireName(String name) {
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("Secret name cannot be null or empty.");
    }
  }
}
