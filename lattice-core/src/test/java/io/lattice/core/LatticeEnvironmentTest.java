package io.lattice.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;

import io.lattice.core.execution.RequestExecutorResolver;
import io.lattice.core.options.FactoryOptionsMonitor;
import io.lattice.core.service.ServiceProvider;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LatticeEnvironmentTest {

    @Mock private RequestExecutorResolver resolver;

    @Mock private FactoryOptionsMonitor optionsMonitor;

    @Mock private ServiceProvider services;

    @Mock private ExecutorService executorService;

    private LatticeEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new LatticeEnvironment(resolver, optionsMonitor, services, executorService);
    }

    @Test
    void shouldExposeComponents() {
        assertThat(environment.getResolver()).isSameAs(resolver);
        assertThat(environment.getOptionsMonitor()).isSameAs(optionsMonitor);
        assertThat(environment.getServices()).isSameAs(services);
    }

    @Test
    void shouldCloseResolverBeforeShuttingDownPool() {
        // When
        environment.close();

        // Then
        InOrder inOrder = inOrder(resolver, executorService);
        inOrder.verify(resolver).close();
        inOrder.verify(executorService).shutdown();
    }
}
