package com.passage.proxy.core.utils;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;

/**
 * Provides utility methods for creating the client-side SSL contexts used to
 * reach upstream origins.
 */
public class SslUtils {

    private SslUtils() {
        // Utility class
    }

    /**
     * Creates the SSL context for outbound TLS connections.
     *
     * @param trustAllCertificates {@code true} to skip certificate and hostname
     *                             verification, {@code false} for the JVM defaults.
     * @return An initialized SSL context.
     * @throws GeneralSecurityException If the SSL context cannot be initialized.
     */
    public static SSLContext createClientContext(boolean trustAllCertificates) throws GeneralSecurityException {
        if (!trustAllCertificates) {
            return SSLContext.getDefault();
        }
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, new TrustManager[] { new TrustAllTrustManager() }, new SecureRandom());
        return sslContext;
    }
}
