package com.passage.proxy.core.services;

import com.passage.proxy.config.LoggingConfig;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-request logging for the proxy.
 * <p>
 * Writes one Apache-style access line per handled request and one
 * {@code [proxy] -> url} line per resolved target, both through SLF4J. Both
 * are suppressed when {@code logging.silent} is set. Supported format tokens:
 * {@code %h %l %t %r %>s %b %m %q %D}.
 */
public class AccessLogService {

    private static final Logger log = LoggerFactory.getLogger(AccessLogService.class);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z",
            Locale.ENGLISH);

    private final boolean silent;
    private final String format;

    /**
     * Cached formatted timestamp, refreshed at most once per second.
     */
    private volatile String cachedTimestamp = "";
    /** The epoch second at which {@link #cachedTimestamp} was last produced. */
    private volatile long cachedTimestampSec = 0;

    public AccessLogService(LoggingConfig config) {
        this.silent = config.isSilent();
        this.format = config.getFormat();
    }

    public boolean isSilent() {
        return silent;
    }

    /**
     * Logs the target a request is about to be forwarded to.
     *
     * @param href Normalized target URL.
     */
    public void logTarget(String href) {
        if (!silent) {
            log.info("[proxy] -> {}", href);
        }
    }

    /**
     * Logs a handled request using the configured format.
     *
     * @param remoteHost Client's IP.
     * @param method     HTTP method.
     * @param uri        Request URI as received.
     * @param status     Response status code.
     * @param bytes      Response body bytes written to the client.
     * @param durationMs Time spent handling the request.
     */
    public void logRequest(String remoteHost, String method, String uri, int status, long bytes, long durationMs) {
        if (silent) {
            return;
        }
        String query = "";
        int queryIndex = uri.indexOf('?');
        if (queryIndex != -1) {
            query = uri.substring(queryIndex);
        }
        LogRecord logRecord = new LogRecord(remoteHost, "[" + getCachedTimestamp() + "]",
                method + " " + uri + " HTTP/1.1", String.valueOf(status), bytes > 0 ? String.valueOf(bytes) : "-",
                method, query, String.valueOf(durationMs));
        log.info(formatLogLine(format, logRecord));
    }

    record LogRecord(String remoteHost, String time, String requestLine, String status, String bytes,
            String method, String query, String duration) {
    }

    /**
     * Expands the format tokens. Unknown tokens are written literally.
     *
     * @param format    The format string.
     * @param logRecord Request data.
     * @return The formatted line.
     */
    String formatLogLine(String format, LogRecord logRecord) {
        StringBuilder sb = new StringBuilder(format.length() + 100);
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                i = appendToken(sb, format, i, logRecord);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private int appendToken(StringBuilder sb, String format, int currentIdx, LogRecord logRecord) {
        char next = format.charAt(currentIdx + 1);
        int skip = 1;
        switch (next) {
            case 'h' -> sb.append(logRecord.remoteHost());
            case 'l' -> sb.append('-');
            case 't' -> sb.append(logRecord.time());
            case 'r' -> sb.append(logRecord.requestLine());
            case 'm' -> sb.append(logRecord.method());
            case 'q' -> sb.append(logRecord.query());
            case 'D' -> sb.append(logRecord.duration());
            case 'b' -> sb.append(logRecord.bytes());
            case '>' -> {
                if (currentIdx + 2 < format.length() && format.charAt(currentIdx + 2) == 's') {
                    sb.append(logRecord.status());
                    skip = 2;
                } else {
                    sb.append('%');
                    skip = 0;
                }
            }
            default -> {
                sb.append('%');
                skip = 0;
            }
        }
        return currentIdx + skip + 1;
    }

    private String getCachedTimestamp() {
        long nowSec = Instant.now().getEpochSecond();
        if (nowSec != cachedTimestampSec) {
            cachedTimestampSec = nowSec;
            cachedTimestamp = ZonedDateTime.now().format(DATE_FORMATTER);
        }
        return cachedTimestamp;
    }
}
