package com.stealerlens.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Repairs text that was decoded with the wrong charset before it reached the engine.
 *
 * A leading byte order mark is removed. Content whose characters all fit in Latin-1 and
 * that re-decodes cleanly as UTF-8 is treated as mojibake and replaced by the re-decoded
 * text; anything else is returned unchanged.
 */
@Component
public class EncodingNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EncodingNormalizer.class);

    private static final char BOM = '\uFEFF';

    public String normalize(String content) {
        if (content == null || content.isEmpty()) {
            return content == null ? "" : content;
        }
        String text = content.charAt(0) == BOM ? content.substring(1) : content;
        if (!looksLikeMojibake(text)) {
            return text;
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String repaired = decoder.decode(ByteBuffer.wrap(text.getBytes(StandardCharsets.ISO_8859_1))).toString();
            log.debug("Re-decoded {} chars of Latin-1 mojibake as UTF-8", text.length());
            return repaired.isEmpty() || repaired.charAt(0) != BOM ? repaired : repaired.substring(1);
        } catch (CharacterCodingException e) {
            log.trace("Content is not double-encoded UTF-8, keeping as-is: {}", e.getMessage());
            return text;
        }
    }

    private static boolean looksLikeMojibake(String text) {
        boolean highLatin = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c > 0xFF) {
                return false;
            }
            if (c >= 0x80) {
                highLatin = true;
            }
        }
        return highLatin;
    }
}
