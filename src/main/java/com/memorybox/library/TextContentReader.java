package com.memorybox.library;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.memorybox.error.ItemValidationException;

/**
 * Reads UTF-8 documents. Binary files and files with invalid UTF-8 are rejected.
 */
public class TextContentReader implements ContentReader<String> {

    @Override
    public String read(Path file) throws ItemValidationException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ItemValidationException(file, "Unreadable document: " + e.getMessage(), e);
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ItemValidationException(file, "Not a UTF-8 document", e);
        }
        if (text.indexOf('\0') >= 0) {
            throw new ItemValidationException(file, "Binary content");
        }
        if (text.isBlank()) {
            throw new ItemValidationException(file, "Empty document");
        }
        return text;
    }
}
