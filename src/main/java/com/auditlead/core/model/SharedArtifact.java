package com.auditlead.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An item of collected data contributed to the context store by a collector agent,
 * e.g. one crawled page or one captured screenshot.
 *
 * @param kind        artifact family, e.g. {@link #PAGE} or {@link #SCREENSHOT}
 * @param key         stable identity within the kind; re-inserting the same key overwrites
 * @param contributor name of the agent that wrote it
 * @param text        extracted text content (may be empty)
 * @param attributes  free-form structured attributes (page type, dimensions, selectors...)
 * @param createdAt   when the artifact was written
 */
public record SharedArtifact(
    String kind,
    String key,
    String contributor,
    String text,
    Map<String, Object> attributes,
    Instant createdAt
) implements Serializable {

    public static final String PAGE = "page";
    public static final String SCREENSHOT = "screenshot";

    public SharedArtifact {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(key, "key");
        text = text == null ? "" : text;
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static SharedArtifact of(String kind, String key, String contributor, String text,
                                    Map<String, Object> attributes) {
        return new SharedArtifact(kind, key, contributor, text, attributes, Instant.now());
    }

    /** Screenshots are keyed by {@code url::type}, matching how collectors address them. */
    public static String screenshotKey(String url, String screenshotType) {
        return url + "::" + screenshotType;
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }
}
