package com.passage.proxy.core.utils;

import io.micrometer.core.instrument.Counter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common I/O helpers for the HTTP wire format and byte relaying.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Buffer size used for relays and body copies. */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    /** Default limit for a request line or header line. */
    public static final int MAX_LINE_LENGTH = 8192;

    /**
     * Splices two connections until either side finishes.
     * <p>
     * The client-to-upstream direction runs on {@code executor}, the
     * upstream-to-client direction on the calling thread. Whichever direction
     * ends first closes both connections via {@code onEnd}, which unblocks the
     * other one; the call returns once both directions have stopped.
     *
     * @param clientIn      Bytes coming from the client.
     * @param clientOut     Bytes going to the client.
     * @param upstreamIn    Bytes coming from the origin.
     * @param upstreamOut   Bytes going to the origin.
     * @param executor      Executor for the client-to-upstream direction.
     * @param bytesSent     Optional counter for client-to-upstream bytes.
     * @param bytesReceived Optional counter for upstream-to-client bytes.
     * @param onEnd         Closes both connections; may be called twice.
     */
    public static void relay(InputStream clientIn, OutputStream clientOut, InputStream upstreamIn,
            OutputStream upstreamOut, Executor executor, Counter bytesSent, Counter bytesReceived,
            Runnable onEnd) {

        CompletableFuture<Void> forward = CompletableFuture.runAsync(() -> {
            try {
                transfer(clientIn, upstreamOut, bytesSent);
            } catch (IOException e) {
                log.debug("Relay client->upstream ended: {}", e.getMessage());
            } finally {
                onEnd.run();
            }
        }, executor);

        try {
            transfer(upstreamIn, clientOut, bytesReceived);
        } catch (IOException e) {
            log.debug("Relay upstream->client ended: {}", e.getMessage());
        } finally {
            onEnd.run();
        }

        try {
            forward.join();
        } catch (Exception e) {
            log.debug("Relay joined with exception: {}", e.getMessage());
        }
    }

    /**
     * Copies a stream to the end, flushing after every read so that streamed
     * responses reach the client as they arrive.
     *
     * @param in      Source.
     * @param out     Destination.
     * @param counter Optional counter incremented by the bytes copied.
     * @return Number of bytes copied.
     * @throws IOException If reading or writing fails.
     */
    public static long transfer(InputStream in, OutputStream out, Counter counter) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) >= 0) {
            out.write(buffer, 0, read);
            out.flush();
            total += read;
            if (counter != null) {
                counter.increment(read);
            }
        }
        out.flush();
        return total;
    }

    /**
     * Reads a single line terminated by CRLF or LF, using the default limit.
     *
     * @param in The input stream to read from.
     * @return The line without terminator, or null at end of stream.
     * @throws IOException If an I/O error occurs or the line is too long.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, MAX_LINE_LENGTH);
    }

    /**
     * Reads a single line terminated by CRLF or LF. Bytes are decoded as
     * ISO-8859-1, the HTTP/1.1 wire encoding.
     *
     * @param in        The input stream to read from.
     * @param maxLength The maximum allowed length of the line.
     * @return The line without terminator, or null at end of stream.
     * @throws IOException If an I/O error occurs or the line exceeds maxLength.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int len = 0;
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (c != '\r') {
                if (++len > maxLength) {
                    throw new IOException("Line length exceeds maximum allowed length of " + maxLength);
                }
                buf.write(c);
            }
        }
        if (c == -1 && len == 0) {
            return null;
        }
        return buf.toString(StandardCharsets.ISO_8859_1);
    }

    /**
     * Writes a string in ISO-8859-1.
     *
     * @param out  Destination.
     * @param text Text, typically a status line or header block.
     * @throws IOException If writing fails.
     */
    public static void writeAscii(OutputStream out, String text) throws IOException {
        out.write(text.getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Closes a resource, logging instead of throwing.
     *
     * @param closeable The resource to close; may be null.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Closes a resource, logging instead of throwing.
     *
     * @param closeable The resource to close; may be null.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
