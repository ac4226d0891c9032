package com.example.music2db.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Unit of delivery to the catalog: a library-relative path plus its metadata.
 */
@JsonPropertyOrder({"file_path", "metadata"})
public record TrackRecord(
        @JsonProperty("file_path") String filePath,
        TrackMetadata metadata
) {
}
