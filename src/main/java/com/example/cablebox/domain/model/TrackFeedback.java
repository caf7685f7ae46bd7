package com.example.cablebox.domain.model;

public final class TrackFeedback {

    public static final TrackFeedback NONE = new TrackFeedback(false, false);

    private final boolean liked;
    private final boolean disliked;

    public TrackFeedback(boolean liked, boolean disliked) {
        this.liked = liked;
        this.disliked = disliked;
    }

    public boolean isLiked() {
        return liked;
    }

    public boolean isDisliked() {
        return disliked;
    }
}
