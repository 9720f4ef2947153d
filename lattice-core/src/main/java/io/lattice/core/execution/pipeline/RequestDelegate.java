package io.lattice.core.execution.pipeline;

import io.lattice.core.execution.RequestContext;
import java.util.concurrent.CompletionStage;

/** A step of the request pipeline, or the whole composed pipeline. */
@FunctionalInterface
public interface RequestDelegate {

    /**
     * Handles the request held by {@code context}.
     *
     * @param context the request context, not null
     * @return stage completing when this step and everything it delegated to are done, not null
     */
    CompletionStage<Void> invoke(RequestContext context);
}
