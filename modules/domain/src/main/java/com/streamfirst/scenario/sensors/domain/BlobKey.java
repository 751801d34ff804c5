package com.streamfirst.scenario.sensors.domain;

/**
 * Opaque name of one stored sensor payload. Equal keys denote byte-identical content.
 * Keys are relative, slash-separated paths so they map directly onto a local directory
 * layout and onto object-store keys.
 */
public record BlobKey(String value) {

    public BlobKey {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Blob key cannot be null or empty");
        }
        value = value.replace('\\', '/');
        if (value.startsWith("/")) {
            throw new IllegalArgumentException("Blob key must be relative: " + value);
        }
        for (String segment : value.split("/")) {
            if (segment.equals("..")) {
                throw new IllegalArgumentException("Blob key cannot contain '..' segments: " + value);
            }
        }
    }

    public static BlobKey of(String value) {
        return new BlobKey(value);
    }

    /**
     * Gets the last path component, e.g. "0a1b2c.jpg".
     */
    public String fileName() {
        int lastSlash = value.lastIndexOf('/');
        return lastSlash == -1 ? value : value.substring(lastSlash + 1);
    }

    @Override
    public String toString() {
        return value;
    }
}
