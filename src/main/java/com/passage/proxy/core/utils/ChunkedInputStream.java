package com.passage.proxy.core.utils;

import com.passage.proxy.core.exceptions.ProtocolException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Decodes an HTTP/1.1 chunked body from a persistent connection stream.
 * <p>
 * Chunk extensions and trailer fields are read and discarded. End of stream
 * is reported after the terminating zero-size chunk; the connection itself is
 * left open and positioned after the trailer section, also when the stream is
 * closed before being fully read.
 */
public class ChunkedInputStream extends InputStream {
    private static final int MAX_TRAILER_LINES = 100;

    private final InputStream in;
    private long chunkLeft;
    private boolean finished;

    public ChunkedInputStream(InputStream in) {
        this.in = in;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n == -1 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (!ensureChunk()) {
            return -1;
        }
        int n = in.read(b, off, (int) Math.min(len, chunkLeft));
        if (n == -1) {
            throw new IOException("Connection closed inside a chunk");
        }
        chunkLeft -= n;
        if (chunkLeft == 0) {
            expectCrlf();
        }
        return n;
    }

    @Override
    public int available() throws IOException {
        return finished ? 0 : (int) Math.min(in.available(), chunkLeft);
    }

    @Override
    public void close() throws IOException {
        byte[] skip = new byte[IoUtils.DEFAULT_BUFFER_SIZE];
        while (read(skip, 0, skip.length) != -1) {
            // discard the rest of the body
        }
    }

    private boolean ensureChunk() throws IOException {
        if (finished) {
            return false;
        }
        if (chunkLeft > 0) {
            return true;
        }
        String line = IoUtils.readLine(in);
        if (line == null) {
            throw new IOException("Connection closed before chunk size");
        }
        int ext = line.indexOf(';');
        String size = (ext == -1 ? line : line.substring(0, ext)).trim();
        try {
            chunkLeft = Long.parseLong(size, 16);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid chunk size: " + size, e);
        }
        if (chunkLeft < 0) {
            throw new ProtocolException("Invalid chunk size: " + size);
        }
        if (chunkLeft == 0) {
            skipTrailers();
            finished = true;
            return false;
        }
        return true;
    }

    private void expectCrlf() throws IOException {
        String line = IoUtils.readLine(in);
        if (line == null || !line.isEmpty()) {
            throw new ProtocolException("Missing CRLF after chunk data");
        }
    }

    private void skipTrailers() throws IOException {
        int lines = 0;
        String line;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++lines > MAX_TRAILER_LINES) {
                throw new ProtocolException("Too many trailer fields");
            }
        }
    }
}
