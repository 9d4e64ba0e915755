package com.simforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Observable facts read back from a produced scene file.
 * Field names match the JSON printed by {@code scripts/inspect_scene.py}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SceneInspection(
        @JsonProperty("object_count")       int     objectCount,
        @JsonProperty("has_camera")         boolean hasCamera,
        @JsonProperty("light_count")        int     lightCount,
        @JsonProperty("frame_range")        int     frameRange,
        @JsonProperty("physics_configured") boolean physicsConfigured,
        @JsonProperty("physics_body_count") int     physicsBodyCount
) {}
