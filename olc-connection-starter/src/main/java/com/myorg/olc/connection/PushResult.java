package com.myorg.olc.connection;

public enum PushResult {
    /** Written to the socket, or handed to the instance holding it. */
    DELIVERED,
    /** The client cannot be reached. Its directory row is removed once the holder is known to be gone. */
    GONE
}
