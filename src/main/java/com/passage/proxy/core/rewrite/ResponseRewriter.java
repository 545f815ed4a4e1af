package com.passage.proxy.core.rewrite;

/**
 * One stage of the response rewrite pipeline.
 * <p>
 * A stage receives a snapshot and returns either the same snapshot or a new
 * one built with {@link RewriteContext#withHeaders} / {@link RewriteContext#withBody}.
 * It must not mutate the headers of the snapshot it was given.
 */
public interface ResponseRewriter {

    /**
     * @param context Snapshot produced by the previous stage.
     * @return The snapshot for the next stage.
     */
    RewriteContext apply(RewriteContext context);

    /**
     * @return stage name used in logs and the {@code stage} metric tag
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
