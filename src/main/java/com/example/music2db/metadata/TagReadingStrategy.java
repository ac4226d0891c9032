package com.example.music2db.metadata;

import org.jaudiotagger.tag.Tag;

/**
 * Flattens one kind of tag container into {@link TrackMetadata} fields.
 */
public interface TagReadingStrategy {
    /** Prefix the tagging tools write in front of Last.fm tag lists. */
    String LASTFM_TAGS_PREFIX = "LastFM tags:";

    boolean supports(Tag tag);

    void read(Tag tag, TrackMetadata.Builder builder);
}
