package io.lattice.core.diagnostics;

import io.lattice.core.execution.ExecutorName;
import io.lattice.core.execution.RequestExecutor;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans lifecycle events out to several {@link DiagnosticEvents} sinks.
 *
 * <p>A failing sink is logged at WARNING and does not prevent later sinks from being notified.
 *
 * @implNote Thread-safe. The sink list is copied at construction time.
 */
public class AggregateDiagnosticEvents implements DiagnosticEvents {

    private static final Logger logger =
            Logger.getLogger(AggregateDiagnosticEvents.class.getName());

    private final List<DiagnosticEvents> sinks;

    public AggregateDiagnosticEvents(List<DiagnosticEvents> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void executorCreated(ExecutorName name, RequestExecutor executor) {
        forEach("executorCreated", sink -> sink.executorCreated(name, executor));
    }

    @Override
    public void executorEvicted(ExecutorName name, RequestExecutor executor) {
        forEach("executorEvicted", sink -> sink.executorEvicted(name, executor));
    }

    public List<DiagnosticEvents> getSinks() {
        return sinks;
    }

    private void forEach(String event, Consumer<DiagnosticEvents> notification) {
        for (DiagnosticEvents sink : sinks) {
            try {
                notification.accept(sink);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Diagnostic sink " + sink.getClass().getName() + " failed on " + event,
                        e);
            }
        }
    }
}
