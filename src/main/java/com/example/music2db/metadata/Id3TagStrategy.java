package com.example.music2db.metadata;

import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagField;
import org.jaudiotagger.tag.TagTextField;
import org.jaudiotagger.tag.id3.AbstractID3v2Frame;
import org.jaudiotagger.tag.id3.AbstractID3v2Tag;
import org.jaudiotagger.tag.id3.framebody.AbstractFrameBodyTextInfo;
import org.jaudiotagger.tag.id3.framebody.FrameBodyCOMM;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * ID3v2 tags (MP3, and ID3 chunks in WAV/AIFF). Text frames may repeat; the
 * first value of each frame is kept and the frames are joined with {@code " & "}.
 */
public final class Id3TagStrategy implements TagReadingStrategy {
    static final String LASTFM_COMMENT_DESCRIPTION = "LastFM tags";
    private static final String VALUE_SEPARATOR = " & ";

    @Override
    public boolean supports(Tag tag) {
        return tag instanceof AbstractID3v2Tag;
    }

    @Override
    public void read(Tag tag, TrackMetadata.Builder builder) {
        builder.artist(joinAll(tag, FieldKey.ARTIST))
                .title(joinAll(tag, FieldKey.TITLE))
                .album(joinAll(tag, FieldKey.ALBUM))
                .genre(joinAll(tag, FieldKey.GENRE))
                .year(joinAll(tag, FieldKey.YEAR))
                .tags(lastFmTags(tag));
    }

    private String joinAll(Tag tag, FieldKey key) {
        List<TagField> fields;
        try {
            fields = tag.getFields(key);
        } catch (KeyNotFoundException | UnsupportedOperationException ex) {
            return null;
        }
        List<String> present = new ArrayList<>();
        for (TagField field : fields) {
            String value = firstValue(field);
            if (value != null && !value.isBlank()) {
                present.add(value.trim());
            }
        }
        return present.isEmpty() ? null : String.join(VALUE_SEPARATOR, present);
    }

    /**
     * First text value of one frame. ID3v2.4 frames can hold several
     * null-separated values; only the leading one is kept.
     */
    private String firstValue(TagField field) {
        if (field instanceof AbstractID3v2Frame
                && ((AbstractID3v2Frame) field).getBody() instanceof AbstractFrameBodyTextInfo) {
            return ((AbstractFrameBodyTextInfo) ((AbstractID3v2Frame) field).getBody()).getFirstTextValue();
        }
        if (field instanceof TagTextField) {
            return ((TagTextField) field).getContent();
        }
        return null;
    }

    private String lastFmTags(Tag tag) {
        // COMM in v2.3/v2.4, COM in v2.2; both parse into FrameBodyCOMM
        Iterator<TagField> fields = tag.getFields();
        while (fields.hasNext()) {
            TagField field = fields.next();
            if (field instanceof AbstractID3v2Frame
                    && ((AbstractID3v2Frame) field).getBody() instanceof FrameBodyCOMM) {
                FrameBodyCOMM comment = (FrameBodyCOMM) ((AbstractID3v2Frame) field).getBody();
                String text = comment.getText();
                if (LASTFM_COMMENT_DESCRIPTION.equals(comment.getDescription()) && text != null && !text.isBlank()) {
                    return text.replace(LASTFM_TAGS_PREFIX, "").trim();
                }
            }
        }
        return null;
    }
}
