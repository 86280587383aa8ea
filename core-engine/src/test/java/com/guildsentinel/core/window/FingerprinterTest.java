package com.guildsentinel.core.window;

import com.guildsentinel.core.model.MessageEvent;
import com.guildsentinel.core.support.TestEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Fingerprinter}.
 */
class FingerprinterTest {

    private final Fingerprinter fingerprinter = new Fingerprinter();

    @Test
    @DisplayName("Should lowercase and collapse punctuation and whitespace")
    void shouldNormalizeText() {
        assertThat(fingerprinter.normalize("  FREE   Nitro!!! Click -> here  "))
                .isEqualTo("free nitro click here");
    }

    @Test
    @DisplayName("Should treat null and blank content as empty")
    void shouldHandleBlank() {
        assertThat(fingerprinter.normalize(null)).isEmpty();
        assertThat(fingerprinter.normalize("   ")).isEmpty();
    }

    @Test
    @DisplayName("Should append attachment and sticker markers after the text")
    void shouldAppendMarkers() {
        MessageEvent event = TestEvents.builder("u1", "look", TestEvents.T0)
                .attachment("Cat.PNG")
                .sticker("wave")
                .build();

        assertThat(fingerprinter.fingerprint(event).getText()).isEqualTo("look att cat png stk wave");
    }

    @Test
    @DisplayName("Should fingerprint attachment-only messages")
    void shouldFingerprintAttachmentOnly() {
        MessageEvent event = TestEvents.builder("u1", "", TestEvents.T0)
                .attachment("meme.gif")
                .build();

        ContentFingerprint fp = fingerprinter.fingerprint(event);
        assertThat(fp.isEmpty()).isFalse();
        assertThat(fp.getText()).isEqualTo("att meme gif");
    }

    @Test
    @DisplayName("Should truncate very long content")
    void shouldTruncate() {
        MessageEvent event = TestEvents.builder("u1", "spam ".repeat(200), TestEvents.T0).build();

        assertThat(fingerprinter.fingerprint(event).length()).isLessThanOrEqualTo(Fingerprinter.MAX_LENGTH);
    }
}
