package com.example.music2db.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Descriptive fields read from one audio file. Absent fields are null and
 * are left out of the JSON sent to the catalog.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"length", "artist", "title", "album", "genre", "year", "tags"})
public record TrackMetadata(
        Integer length,
        String artist,
        String title,
        String album,
        String genre,
        String year,
        String tags
) {
    public static final TrackMetadata EMPTY = new TrackMetadata(null, null, null, null, null, null, null);

    @JsonIgnore
    public boolean isEmpty() {
        return length == null && artist == null && title == null && album == null
                && genre == null && year == null && tags == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer length;
        private String artist;
        private String title;
        private String album;
        private String genre;
        private String year;
        private String tags;

        private Builder() {
        }

        public Builder length(Integer length) {
            this.length = length;
            return this;
        }

        public Builder artist(String artist) {
            this.artist = blankToNull(artist);
            return this;
        }

        public Builder title(String title) {
            this.title = blankToNull(title);
            return this;
        }

        public Builder album(String album) {
            this.album = blankToNull(album);
            return this;
        }

        public Builder genre(String genre) {
            this.genre = blankToNull(genre);
            return this;
        }

        public Builder year(String year) {
            this.year = blankToNull(year);
            return this;
        }

        public Builder tags(String tags) {
            this.tags = blankToNull(tags);
            return this;
        }

        public TrackMetadata build() {
            return new TrackMetadata(length, artist, title, album, genre, year, tags);
        }

        private static String blankToNull(String value) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
    }
}
