package com.guildsentinel.core.window;

import java.util.Objects;

/**
 * Normalized, length-bounded representation of a message's content, ready
 * for edit-distance comparison.
 *
 * @since 1.0.0
 */
public final class ContentFingerprint {

    private final String text;

    ContentFingerprint(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Create a fingerprint from text that is already normalized.
     *
     * @param normalized normalized text
     * @return fingerprint
     */
    public static ContentFingerprint of(String normalized) {
        return new ContentFingerprint(normalized);
    }

    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public int length() {
        return text.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContentFingerprint that)) {
            return false;
        }
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "ContentFingerprint{'" + text + "'}";
    }
}
