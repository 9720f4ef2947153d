package io.lattice.core.diagnostics;

import io.lattice.core.execution.ExecutorName;
import io.lattice.core.execution.RequestExecutor;
import java.util.logging.Logger;

/** {@link DiagnosticEvents} that writes lifecycle events to {@code java.util.logging}. */
public class LoggingDiagnosticEvents implements DiagnosticEvents {

    private static final Logger logger = Logger.getLogger(LoggingDiagnosticEvents.class.getName());

    @Override
    public void executorCreated(ExecutorName name, RequestExecutor executor) {
        logger.info(
                "Created request executor: "
                        + name
                        + " (types="
                        + executor.getSchema().getTypes().size()
                        + ", timeout="
                        + executor.getOptions().getExecutionTimeout()
                        + ")");
    }

    @Override
    public void executorEvicted(ExecutorName name, RequestExecutor executor) {
        logger.info("Evicted request executor: " + name);
    }
}
