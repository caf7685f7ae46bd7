package com.example.cablebox.domain;

public enum PlaybackReason {
    /** Listener joined the station mid-track. */
    TUNE_IN,
    RESUME,
    MANUAL,
    NEXT
}
