package tech.yump.multipart.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the provenance tags written on newly created parts.
 */
@Component
@RequiredArgsConstructor
public class PartTags {

    private final MultipartProperties properties;

    public Map<String, String> forEnvironment(String environment) {
        MultipartProperties.TagProperties tagProperties = properties.tags();
        Map<String, String> tags = new TreeMap<>(tagProperties.defaults());
        if (StringUtils.hasText(environment)) {
            tags.put(tagProperties.environmentKey(), environment.trim());
        }
        return Collections.unmodifiableMap(tags);
    }
}
