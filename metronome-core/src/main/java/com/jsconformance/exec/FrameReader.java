package com.jsconformance.exec;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Splits a byte stream into NUL-terminated chunks.
 */
final class FrameReader {

    private static final int NUL = 0;

    private final InputStream in;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean eof;

    FrameReader(InputStream in) {
        this.in = new BufferedInputStream(in);
    }

    /**
     * @return the next chunk without its terminator, or {@code null} at end of stream.
     *         Bytes after the last terminator are returned as a final chunk.
     */
    String next() throws IOException {
        if (eof) {
            return null;
        }
        buffer.reset();
        int b;
        while ((b = in.read()) != -1) {
            if (b == NUL) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
            buffer.write(b);
        }
        eof = true;
        return buffer.size() == 0 ? null : buffer.toString(StandardCharsets.UTF_8);
    }
}
