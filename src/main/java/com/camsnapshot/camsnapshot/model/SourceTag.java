package com.camsnapshot.camsnapshot.model;

/**
 * Category of snapshot origin. The tag is the directory name under
 * {@code <camera>/snapshots/}, the notes label is what gets stored on snapshot rows.
 *
 * <p>Every label that is not one of the four named ones maps to {@link #ARCHIVES},
 * and {@link #ARCHIVES} maps back to "User Created", so an unknown label does not
 * survive a round trip.
 */
public enum SourceTag {
    RECORDINGS("recordings", "Proxy"),
    THUMBNAIL("thumbnail", "Thumbnail"),
    TIMELAPSE("timelapse", "Timelapse"),
    SNAPMAIL("snapmail", "SnapMail"),
    ARCHIVES("archives", "User Created");

    private final String directoryName;
    private final String notes;

    SourceTag(String directoryName, String notes) {
        this.directoryName = directoryName;
        this.notes = notes;
    }

    public String directoryName() {
        return directoryName;
    }

    public String notes() {
        return notes;
    }

    public static SourceTag fromNotes(String notes) {
        if (notes == null) {
            return ARCHIVES;
        }
        switch (notes) {
            case "Proxy":
                return RECORDINGS;
            case "Thumbnail":
                return THUMBNAIL;
            case "Timelapse":
                return TIMELAPSE;
            case "SnapMail":
                return SNAPMAIL;
            default:
                return ARCHIVES;
        }
    }

    public static SourceTag fromDirectoryName(String name) {
        for (SourceTag tag : values()) {
            if (tag.directoryName.equals(name)) {
                return tag;
            }
        }
        return ARCHIVES;
    }

    @Override
    public String toString() {
        return directoryName;
    }
}
