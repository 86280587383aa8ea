package com.guildsentinel.core.window;

import com.guildsentinel.core.model.MessageEvent;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Computes {@link ContentFingerprint}s.
 *
 * <p>
 * Text is lowercased, every run of non letter/digit characters becomes one
 * space, and the result is trimmed. Attachment and sticker names are appended
 * as {@code att <name>} / {@code stk <name>} tokens so that two posts of the
 * same image compare as similar even with no text. The result is truncated to
 * {@value #MAX_LENGTH} characters, which bounds the cost of every pairwise
 * comparison.
 * </p>
 *
 * @since 1.0.0
 */
public final class Fingerprinter {

    /** Upper bound on fingerprint length. */
    public static final int MAX_LENGTH = 256;

    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @param event message to fingerprint
     * @return fingerprint of its text plus attachment and sticker markers
     */
    public ContentFingerprint fingerprint(MessageEvent event) {
        StringBuilder sb = new StringBuilder(normalize(event.getContent()));
        for (String attachment : event.getAttachments()) {
            appendMarker(sb, "att", attachment);
        }
        for (String sticker : event.getStickers()) {
            appendMarker(sb, "stk", sticker);
        }
        String text = sb.length() > MAX_LENGTH ? sb.substring(0, MAX_LENGTH).trim() : sb.toString();
        return new ContentFingerprint(text);
    }

    /**
     * Normalize free text: lowercase, collapse punctuation and whitespace.
     *
     * @param input raw text, may be {@code null}
     * @return normalized text, never {@code null}
     */
    public String normalize(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        String lowered = input.toLowerCase(Locale.ROOT);
        String cleaned = NON_ALNUM.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    private void appendMarker(StringBuilder sb, String kind, String name) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(kind).append(' ').append(normalized);
    }
}
