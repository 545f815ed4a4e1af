package com.passage.proxy.core.proxy;

import com.passage.proxy.core.exceptions.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * The URL entry form served at {@code /}, loaded once from the classpath.
 * The page's {@code {{PROXY_PREFIX}}} placeholder is replaced with the
 * configured prefix.
 */
public final class LandingPage {

    static final String RESOURCE = "public/index.html";
    static final String PREFIX_PLACEHOLDER = "{{PROXY_PREFIX}}";
    static final String CONTENT_TYPE = "text/html; charset=utf-8";

    private final byte[] content;

    private LandingPage(byte[] content) {
        this.content = content;
    }

    /**
     * @param proxyPrefix Prefix the form navigates to.
     * @return the loaded page
     * @throws ConfigException if the page resource is missing or unreadable.
     */
    public static LandingPage load(String proxyPrefix) {
        try (InputStream in = LandingPage.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new ConfigException("Landing page resource not found: " + RESOURCE);
            }
            String html = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return new LandingPage(html.replace(PREFIX_PLACEHOLDER, proxyPrefix).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigException("Failed to read landing page: " + e.getMessage(), e);
        }
    }

    public byte[] content() {
        return content.clone();
    }

    public int length() {
        return content.length;
    }
}
