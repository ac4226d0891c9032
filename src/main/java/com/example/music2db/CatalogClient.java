package com.example.music2db;

import com.example.music2db.metadata.TrackRecord;

import java.util.List;

/**
 * Remote catalog that receives track metadata. Calls never throw; transport
 * and protocol problems come back as failed outcomes.
 */
public interface CatalogClient extends AutoCloseable {

    /**
     * Succeeds with the reported status text when the service is up.
     */
    Outcome<String> checkHealth();

    /**
     * One-off submission of a single track.
     */
    Outcome<Void> sendTrack(TrackRecord track);

    /**
     * Submits a batch; succeeds with the service's summary message.
     */
    Outcome<String> sendTracks(List<TrackRecord> tracks);

    @Override
    default void close() {
        // no-op
    }
}
