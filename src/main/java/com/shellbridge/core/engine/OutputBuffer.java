package com.shellbridge.core.engine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;

/**
 * Growable byte sink for one captured stream. Chunks are appended as they are read
 * and decoded once at the end. Bytes past {@code maxBytes} are read and discarded
 * so the child never blocks on a full pipe.
 */
final class OutputBuffer {

    private static final int CHUNK_SIZE = 8192;

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final long maxBytes;
    private long discarded;

    OutputBuffer(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    /**
     * Reads {@code in} to end of stream.
     */
    void drain(InputStream in) throws IOException {
        byte[] chunk = new byte[CHUNK_SIZE];
        int n;
        while ((n = in.read(chunk)) != -1) {
            append(chunk, n);
        }
    }

    synchronized void append(byte[] chunk, int length) {
        long room = maxBytes - bytes.size();
        if (room >= length) {
            bytes.write(chunk, 0, length);
            return;
        }
        if (room > 0) {
            bytes.write(chunk, 0, (int) room);
        }
        discarded += length - Math.max(room, 0);
    }

    synchronized String decode(Charset charset) {
        return bytes.toString(charset);
    }

    synchronized boolean truncated() {
        return discarded > 0;
    }

    synchronized long size() {
        return bytes.size();
    }
}
