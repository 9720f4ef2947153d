package io.lattice.core.diagnostics;

import static org.mockito.Mockito.*;

import io.lattice.core.execution.ExecutorName;
import io.lattice.core.execution.RequestExecutor;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AggregateDiagnosticEventsTest {

    private static final ExecutorName CATALOG = ExecutorName.of("catalog");

    @Mock private DiagnosticEvents first;

    @Mock private DiagnosticEvents second;

    @Mock private RequestExecutor executor;

    @Test
    void shouldNotifySinksInOrder() {
        // Given
        AggregateDiagnosticEvents events = new AggregateDiagnosticEvents(List.of(first, second));

        // When
        events.executorCreated(CATALOG, executor);
        events.executorEvicted(CATALOG, executor);

        // Then
        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).executorCreated(CATALOG, executor);
        inOrder.verify(second).executorCreated(CATALOG, executor);
        inOrder.verify(first).executorEvicted(CATALOG, executor);
        inOrder.verify(second).executorEvicted(CATALOG, executor);
    }

    @Test
    void shouldIsolateFailingSink() {
        // Given
        doThrow(new IllegalStateException("sink down"))
                .when(first)
                .executorEvicted(CATALOG, executor);
        AggregateDiagnosticEvents events = new AggregateDiagnosticEvents(List.of(first, second));

        // When
        events.executorEvicted(CATALOG, executor);

        // Then
        verify(second).executorEvicted(CATALOG, executor);
    }
}
