package com.emissions.key;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;

import java.io.IOException;

/**
 * Single-line printer producing {@code {"a": 1, "b": [2, 3]}} separators, so that key
 * material hashes to the same digest as keys written by the existing Python service.
 */
class CanonicalJsonPrinter extends MinimalPrettyPrinter {

    private static final long serialVersionUID = 1L;

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
        g.writeRaw(", ");
    }

    @Override
    public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(", ");
    }

    /**
     * Escapes like Python's {@code ensure_ascii}: {@code \n}-style short escapes where JSON
     * has them, lowercase {@code \\uxxxx} for every other control character, DEL and every
     * non-ASCII UTF-16 unit.
     */
    static final class AsciiOnlyEscapes extends CharacterEscapes {

        private static final long serialVersionUID = 1L;

        private static final int DEL = 0x7F;

        private final int[] asciiEscapes;

        AsciiOnlyEscapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int ch = 0; ch < 0x20; ch++) {
                if (asciiEscapes[ch] == CharacterEscapes.ESCAPE_STANDARD) {
                    asciiEscapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
            asciiEscapes[DEL] = CharacterEscapes.ESCAPE_CUSTOM;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch < 0x20 || ch >= DEL) {
                return new SerializedString(String.format("\\u%04x", ch));
            }
            return null;
        }
    }
}
