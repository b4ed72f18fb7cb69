package fr.lapetina.tr064.monitor;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns arbitrarily fragmented chunks into complete lines.
 *
 * Bytes are buffered until a line feed arrives, then decoded as a whole, so a
 * multi-byte character split across chunks is decoded correctly.
 */
final class LineReassembler {

    private static final byte LINE_FEED = '\n';

    private final Charset charset;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    LineReassembler(Charset charset) {
        this.charset = charset;
    }

    /**
     * Appends {@code length} bytes of {@code chunk} and returns the lines completed by them,
     * without their line feed.
     */
    List<String> feed(byte[] chunk, int length) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < length; i++) {
            if (chunk[i] == LINE_FEED) {
                pending.write(chunk, start, i - start);
                lines.add(new String(pending.toByteArray(), charset));
                pending.reset();
                start = i + 1;
            }
        }
        pending.write(chunk, start, length - start);
        return lines;
    }

    int pendingBytes() {
        return pending.size();
    }

    void reset() {
        pending.reset();
    }
}
