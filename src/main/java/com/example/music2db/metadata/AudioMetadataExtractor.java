package com.example.music2db.metadata;

import com.example.music2db.FailureKind;
import com.example.music2db.Outcome;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Reads audio headers and tags with jaudiotagger. The container format is
 * sniffed with Tika so files with a misleading extension are still parsed by
 * the right reader; the tag container then picks the {@link TagReadingStrategy}.
 */
public class AudioMetadataExtractor implements MetadataExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(AudioMetadataExtractor.class);
    // jaudiotagger reports every odd frame through java.util.logging
    private static final java.util.logging.Logger JAUDIOTAGGER_LOG = java.util.logging.Logger.getLogger("org.jaudiotagger");

    private static final Map<String, String> READER_BY_MEDIA_TYPE = Map.ofEntries(
            Map.entry("audio/mpeg", "mp3"),
            Map.entry("audio/x-flac", "flac"),
            Map.entry("audio/flac", "flac"),
            Map.entry("audio/ogg", "ogg"),
            Map.entry("audio/vorbis", "ogg"),
            Map.entry("audio/mp4", "m4a"),
            Map.entry("audio/x-m4a", "m4a"),
            Map.entry("audio/vnd.wave", "wav"),
            Map.entry("audio/x-wav", "wav"),
            Map.entry("audio/x-aiff", "aif"),
            Map.entry("audio/x-ms-wma", "wma"),
            Map.entry("audio/x-dsf", "dsf")
    );

    private final Tika tika;
    private final List<TagReadingStrategy> strategies;

    public AudioMetadataExtractor(Tika tika) {
        this(tika, List.of(new Id3TagStrategy(), new GenericTagStrategy()));
    }

    AudioMetadataExtractor(Tika tika, List<TagReadingStrategy> strategies) {
        this.tika = tika;
        this.strategies = List.copyOf(strategies);
        JAUDIOTAGGER_LOG.setLevel(Level.WARNING);
    }

    @Override
    public Outcome<TrackMetadata> extract(Path file) {
        if (!Files.isReadable(file)) {
            return Outcome.failure(FailureKind.UNREADABLE_FILE, "not readable: " + file);
        }
        AudioFile audioFile;
        try {
            String reader = detectReader(file);
            audioFile = reader == null
                    ? AudioFileIO.read(file.toFile())
                    : AudioFileIO.readAs(file.toFile(), reader);
        } catch (CannotReadException | InvalidAudioFrameException | TagException ex) {
            return Outcome.failure(FailureKind.UNSUPPORTED_FORMAT, ex.getMessage());
        } catch (IOException | ReadOnlyFileException ex) {
            return Outcome.failure(FailureKind.UNREADABLE_FILE, ex.toString());
        } catch (RuntimeException ex) {
            // corrupt frames surface as unchecked exceptions from the parser
            return Outcome.failure(FailureKind.UNSUPPORTED_FORMAT, ex.toString());
        }
        return Outcome.success(toMetadata(audioFile));
    }

    TrackMetadata toMetadata(AudioFile audioFile) {
        TrackMetadata.Builder builder = TrackMetadata.builder();
        AudioHeader header = audioFile.getAudioHeader();
        if (header != null) {
            // whole seconds, truncated
            builder.length((int) header.getPreciseTrackLength());
        }
        Tag tag = audioFile.getTag();
        if (tag != null) {
            for (TagReadingStrategy strategy : strategies) {
                if (strategy.supports(tag)) {
                    strategy.read(tag, builder);
                    break;
                }
            }
        }
        return builder.build();
    }

    /**
     * Returns the jaudiotagger reader extension for the sniffed content type,
     * or null to let jaudiotagger choose by file name.
     */
    String detectReader(Path file) {
        try {
            MediaType mediaType = MediaType.parse(tika.detect(file));
            if (mediaType == null) {
                return null;
            }
            String reader = READER_BY_MEDIA_TYPE.get(mediaType.getBaseType().toString());
            LOGGER.trace("Detected {} for {}", mediaType, file);
            return reader;
        } catch (IOException ex) {
            LOGGER.debug("Content type detection failed for {}: {}", file, ex.toString());
            return null;
        }
    }
}
