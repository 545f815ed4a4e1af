package com.passage.proxy.core.pool;

import com.passage.proxy.config.UpstreamConfig;
import com.passage.proxy.core.exceptions.InvalidTargetUrlException;
import com.passage.proxy.core.exceptions.ProxyException;
import com.passage.proxy.core.target.ResolvedTarget;
import com.passage.proxy.core.utils.SslUtils;
import io.micrometer.core.instrument.MeterRegistry;
import java.security.GeneralSecurityException;
import java.util.Locale;
import javax.net.ssl.SSLContext;

/**
 * The two upstream pools: one for plain origins, one for TLS origins.
 * The pool is chosen by target scheme; {@code ws} and {@code wss} map to
 * their HTTP counterparts.
 */
public class UpstreamPools implements AutoCloseable {

    private final UpstreamPool plain;
    private final UpstreamPool tls;

    public UpstreamPools(UpstreamConfig config, MeterRegistry registry) {
        this(new UpstreamPool("http", null, config, registry),
                new UpstreamPool("https", createSslContext(config), config, registry));
    }

    UpstreamPools(UpstreamPool plain, UpstreamPool tls) {
        this.plain = plain;
        this.tls = tls;
    }

    /**
     * @param scheme URL scheme in any case.
     * @return the pool serving that scheme
     * @throws InvalidTargetUrlException for schemes other than http, https, ws and wss.
     */
    public UpstreamPool forScheme(String scheme) {
        String s = scheme == null ? "" : scheme.toLowerCase(Locale.ROOT);
        return switch (s) {
            case "http", "ws" -> plain;
            case "https", "wss" -> tls;
            default -> throw new InvalidTargetUrlException("Unsupported target scheme: " + scheme);
        };
    }

    public UpstreamPool forTarget(ResolvedTarget target) {
        return forScheme(target.scheme());
    }

    public UpstreamPool plain() {
        return plain;
    }

    public UpstreamPool tls() {
        return tls;
    }

    @Override
    public void close() {
        plain.close();
        tls.close();
    }

    private static SSLContext createSslContext(UpstreamConfig config) {
        try {
            return SslUtils.createClientContext(config.isTrustAllCertificates());
        } catch (GeneralSecurityException e) {
            throw new ProxyException("Failed to initialize upstream TLS context: " + e.getMessage(), e);
        }
    }
}
