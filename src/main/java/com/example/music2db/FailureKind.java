package com.example.music2db;

public enum FailureKind {
    /** The file is not an audio container the tag reader understands. */
    UNSUPPORTED_FORMAT,
    /** The file exists but could not be read (permissions, I/O). */
    UNREADABLE_FILE,
    /** The catalog service could not be reached or timed out. */
    NETWORK_ERROR,
    /** The catalog service answered with a non-success status code. */
    HTTP_STATUS,
    /** The catalog service answered 200 with a body we did not expect. */
    UNEXPECTED_RESPONSE
}
