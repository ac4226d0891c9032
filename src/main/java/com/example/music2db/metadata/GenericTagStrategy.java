package com.example.music2db.metadata;

import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;

/**
 * Single-valued tag containers: Vorbis comments (FLAC, Ogg), MP4 atoms,
 * ASF, ID3v1. Only the first value of each field is used.
 */
public final class GenericTagStrategy implements TagReadingStrategy {

    @Override
    public boolean supports(Tag tag) {
        return tag != null;
    }

    @Override
    public void read(Tag tag, TrackMetadata.Builder builder) {
        builder.artist(first(tag, FieldKey.ARTIST))
                .title(first(tag, FieldKey.TITLE))
                .album(first(tag, FieldKey.ALBUM))
                .genre(first(tag, FieldKey.GENRE))
                .year(first(tag, FieldKey.YEAR));

        String comment = first(tag, FieldKey.COMMENT);
        if (comment != null) {
            int index = comment.indexOf(LASTFM_TAGS_PREFIX);
            if (index >= 0) {
                builder.tags(comment.substring(index + LASTFM_TAGS_PREFIX.length()));
            }
        }
    }

    private String first(Tag tag, FieldKey key) {
        try {
            return tag.getFirst(key);
        } catch (KeyNotFoundException | UnsupportedOperationException ex) {
            return null;
        }
    }
}
