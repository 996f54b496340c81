package com.unit.catalog.parse;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Parses the text of one unit file into a {@link ParseOutcome}.
 * Implementations are pure and stateless: the same input always yields the same outcome.
 */
public interface UnitFileParser {

    /**
     * Parses decoded file text.
     *
     * @param content the full text of the unit file
     * @return the parsed unit, or a rejection describing why the text was not usable
     */
    ParseOutcome parse(String content);

    /**
     * Parses raw file bytes. Content that is not valid UTF-8 is rejected rather than
     * decoded with replacement characters.
     */
    default ParseOutcome parse(byte[] content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return parse(decoder.decode(ByteBuffer.wrap(content)).toString());
        } catch (CharacterCodingException e) {
            return ParseOutcome.rejected("content is not valid UTF-8");
        }
    }
}
