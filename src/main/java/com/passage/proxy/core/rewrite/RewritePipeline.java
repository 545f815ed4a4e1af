package com.passage.proxy.core.rewrite;

import com.passage.proxy.core.http.ProxyResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the rewrite stages over a response in a fixed order.
 * <p>
 * A stage that throws is skipped: the failure is logged, counted under
 * {@code proxy.rewrite.failures{stage}}, and the next stage receives the
 * snapshot the failing stage was given.
 */
public class RewritePipeline {
    private static final Logger log = LoggerFactory.getLogger(RewritePipeline.class);

    private final List<ResponseRewriter> stages;
    private final Map<String, Counter> failures = new HashMap<>();

    public RewritePipeline(List<ResponseRewriter> stages, MeterRegistry registry) {
        this.stages = List.copyOf(stages);
        for (ResponseRewriter stage : this.stages) {
            failures.put(stage.name(), Counter.builder("proxy.rewrite.failures")
                    .tag("stage", stage.name())
                    .description("Rewrite stages that failed and were skipped")
                    .register(registry));
        }
    }

    /**
     * The proxy's standard stage order: CORS, Location, HLS manifest, security headers.
     *
     * @param proxyPrefix Path prefix under which targets are proxied.
     * @param registry    Registry for failure counters.
     * @return the pipeline
     */
    public static RewritePipeline standard(String proxyPrefix, MeterRegistry registry) {
        return new RewritePipeline(List.of(
                new CorsHeadersRewriter(),
                new LocationHeaderRewriter(proxyPrefix),
                new HlsManifestRewriter(proxyPrefix),
                new SecurityHeadersRewriter()), registry);
    }

    /**
     * @param response      Upstream response.
     * @param requestMethod Method of the request that produced it.
     * @return the rewritten response
     */
    public ProxyResponse apply(ProxyResponse response, String requestMethod) {
        return apply(RewriteContext.of(response, requestMethod)).toResponse();
    }

    public RewriteContext apply(RewriteContext context) {
        RewriteContext current = context;
        for (ResponseRewriter stage : stages) {
            try {
                current = stage.apply(current);
            } catch (RuntimeException e) {
                failures.get(stage.name()).increment();
                log.error("Rewrite stage {} failed for {}: {}", stage.name(), current.getRequestUrl(),
                        e.getMessage(), e);
            }
        }
        return current;
    }

    public List<ResponseRewriter> getStages() {
        return stages;
    }
}
