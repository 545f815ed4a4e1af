package com.passage.proxy.config;

/**
 * Configuration for the per-request access log.
 */
public class LoggingConfig {
    /** Suppresses the per-request lines (access log and target trace). */
    private boolean silent = false;

    /** Logging format (Apache-style placeholders like %h, %r, %s). */
    private String format = "%h %t \"%r\" %>s %b";

    public boolean isSilent() {
        return silent;
    }

    public void setSilent(boolean silent) {
        this.silent = silent;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }
}
