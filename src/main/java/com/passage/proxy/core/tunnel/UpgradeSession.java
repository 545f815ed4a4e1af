package com.passage.proxy.core.tunnel;

import com.passage.proxy.core.pool.UpstreamPool;
import com.passage.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The two connections of one upgrade tunnel and the pool slot it occupies.
 * <p>
 * The input streams are the buffered ones used to read the handshake, so
 * bytes that arrived together with the handshake are not lost. Closing the
 * session closes both sockets and releases the slot; later calls do nothing.
 */
public class UpgradeSession implements AutoCloseable {

    private final Socket client;
    private final InputStream clientIn;
    private final OutputStream clientOut;
    private final Socket upstream;
    private final InputStream upstreamIn;
    private final OutputStream upstreamOut;
    private final UpstreamPool.Permit permit;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public UpgradeSession(Socket client, InputStream clientIn, OutputStream clientOut, Socket upstream,
            InputStream upstreamIn, OutputStream upstreamOut, UpstreamPool.Permit permit) {
        this.client = client;
        this.clientIn = clientIn;
        this.clientOut = clientOut;
        this.upstream = upstream;
        this.upstreamIn = upstreamIn;
        this.upstreamOut = upstreamOut;
        this.permit = permit;
    }

    /**
     * Turns off read timeouts on both sockets; tunneled protocols may stay
     * idle for long periods.
     *
     * @throws SocketException If a socket option cannot be changed.
     */
    public void disableReadTimeouts() throws SocketException {
        client.setSoTimeout(0);
        upstream.setSoTimeout(0);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getClientIn() {
        return clientIn;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public OutputStream getClientOut() {
        return clientOut;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public InputStream getUpstreamIn() {
        return upstreamIn;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public OutputStream getUpstreamOut() {
        return upstreamOut;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            IoUtils.closeQuietly(upstream, "upstream tunnel socket");
            IoUtils.closeQuietly(client, "client tunnel socket");
            permit.close();
        }
    }
}
