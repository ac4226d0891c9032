package com.example.music2db;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScanCheckpoint(
        @JsonProperty("last_scan_time") double lastScanTime
) {
}
