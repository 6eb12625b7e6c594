package com.ashby.mcp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a byte stream into newline-terminated UTF-8 lines.
 * <p>
 * Bytes after the last newline are buffered until a later chunk completes the line.
 * A trailing {@code \r} is stripped. Lines longer than {@code maxLineBytes} are discarded
 * up to the next newline. Not thread-safe: one framer per reader.
 */
public class LineFramer {

    private final int maxLineBytes;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private boolean discarding;
    private long discardedLines;

    public LineFramer(int maxLineBytes) {
        this.maxLineBytes = maxLineBytes;
    }

    public List<String> feed(byte[] chunk, int offset, int length) {
        var lines = new ArrayList<String>();
        int start = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (chunk[i] == '\n') {
                append(chunk, start, i - start);
                if (discarding) {
                    discarding = false;
                    discardedLines++;
                } else {
                    lines.add(decode(pending.toByteArray()));
                }
                pending.reset();
                start = i + 1;
            }
        }
        append(chunk, start, end - start);
        return lines;
    }

    public List<String> feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    /** Number of bytes held for an incomplete line. */
    public int buffered() {
        return pending.size();
    }

    public long discardedLines() {
        return discardedLines;
    }

    private void append(byte[] chunk, int from, int len) {
        if (len <= 0 || discarding) {
            return;
        }
        if (pending.size() + len > maxLineBytes) {
            pending.reset();
            discarding = true;
            return;
        }
        pending.write(chunk, from, len);
    }

    private static String decode(byte[] bytes) {
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == '\r') {
            len--;
        }
        return new String(bytes, 0, len, StandardCharsets.UTF_8);
    }
}
