package com.passage.proxy.core.utils;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Exposes exactly {@code limit} bytes of a persistent connection stream.
 * <p>
 * Closing this stream does not close the connection: it skips whatever part
 * of the body was not read so the next request on the connection starts at
 * the right position.
 */
public class LimitInputStream extends FilterInputStream {
    private long left;

    public LimitInputStream(InputStream in, long limit) {
        super(in);
        this.left = limit;
    }

    @Override
    public int read() throws IOException {
        if (left <= 0) {
            return -1;
        }
        int res = super.read();
        if (res != -1) {
            left--;
        }
        return res;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (left <= 0) {
            return -1;
        }
        int toRead = (int) Math.min(len, left);
        int res = super.read(b, off, toRead);
        if (res != -1) {
            left -= res;
        }
        return res;
    }

    @Override
    public int available() throws IOException {
        return (int) Math.min(super.available(), left);
    }

    @Override
    public void close() throws IOException {
        drain();
    }

    /**
     * Skips the unread remainder of the body.
     *
     * @throws IOException If the connection ends before the declared length.
     */
    public void drain() throws IOException {
        if (left > 0) {
            in.skipNBytes(left);
            left = 0;
        }
    }

    public long remaining() {
        return left;
    }
}
