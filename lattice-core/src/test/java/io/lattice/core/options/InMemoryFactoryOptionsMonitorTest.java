package io.lattice.core.options;

import static org.assertj.core.api.Assertions.assertThat;

import io.lattice.core.configure.ConfigureAction;
import io.lattice.core.execution.ExecutorName;
import io.lattice.core.schema.SchemaBuilder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryFactoryOptionsMonitorTest {

    private static final ExecutorName CATALOG = ExecutorName.of("catalog");

    private InMemoryFactoryOptionsMonitor monitor;
    private List<ExecutorName> notified;

    @BeforeEach
    void setUp() {
        monitor = new InMemoryFactoryOptionsMonitor();
        notified = new ArrayList<>();
        monitor.onChange(notified::add);
    }

    @Nested
    class GetTest {

        @Test
        void shouldReturnEmptyOptionsForUnknownName() {
            assertThat(monitor.get(CATALOG)).isSameAs(ExecutorFactoryOptions.empty());
        }
    }

    @Nested
    class ConfigureTest {

        @Test
        void shouldAccumulateConfiguration() {
            // Given
            ConfigureAction<SchemaBuilder> first = ConfigureAction.of(b -> b.addType("A"));
            ConfigureAction<SchemaBuilder> second = ConfigureAction.of(b -> b.addType("B"));

            // When
            monitor.configure(CATALOG, options -> options.addSchemaBuilderAction(first));
            monitor.configure(CATALOG, options -> options.addSchemaBuilderAction(second));

            // Then
            assertThat(monitor.get(CATALOG).getSchemaBuilderActions()).containsExactly(first, second);
            assertThat(notified).containsExactly(CATALOG, CATALOG);
        }

        @Test
        void shouldRemoveOptionsAction() {
            // Given
            ConfigureAction<ExecutorOptions> action =
                    ConfigureAction.of(o -> o.setIncludeExceptionDetails(true));
            monitor.configure(CATALOG, options -> options.addExecutorOptionsAction(action));

            // When
            monitor.configure(CATALOG, options -> options.removeExecutorOptionsAction(action));

            // Then
            assertThat(monitor.get(CATALOG).getExecutorOptionsActions()).isEmpty();
        }

        @Test
        void shouldReplaceOptionsWithPut() {
            // Given
            ExecutorFactoryOptions replacement =
                    ExecutorFactoryOptions.builder().schemaBuilder(new SchemaBuilder()).build();

            // When
            monitor.put(CATALOG, replacement);

            // Then
            assertThat(monitor.get(CATALOG)).isSameAs(replacement);
            assertThat(notified).containsExactly(CATALOG);
        }
    }

    @Nested
    class RemoveTest {

        @Test
        void shouldNotifyOnlyWhenSomethingWasRemoved() {
            // Given
            monitor.put(CATALOG, ExecutorFactoryOptions.empty());
            notified.clear();

            // When
            boolean removed = monitor.remove(CATALOG);
            boolean removedAgain = monitor.remove(CATALOG);

            // Then
            assertThat(removed).isTrue();
            assertThat(removedAgain).isFalse();
            assertThat(notified).containsExactly(CATALOG);
        }
    }

    @Nested
    class SubscriptionTest {

        @Test
        void shouldStopNotifyingAfterClose() {
            // Given
            List<ExecutorName> received = new ArrayList<>();
            FactoryOptionsMonitor.Subscription subscription = monitor.onChange(received::add);

            // When
            subscription.close();
            monitor.put(CATALOG, ExecutorFactoryOptions.empty());

            // Then
            assertThat(received).isEmpty();
            assertThat(notified).containsExactly(CATALOG);
        }

        @Test
        void shouldKeepNotifyingWhenListenerFails() {
            // Given
            InMemoryFactoryOptionsMonitor isolated = new InMemoryFactoryOptionsMonitor();
            List<ExecutorName> received = new ArrayList<>();
            isolated.onChange(
                    name -> {
                        throw new IllegalStateException("listener bug");
                    });
            isolated.onChange(received::add);

            // When
            isolated.put(CATALOG, ExecutorFactoryOptions.empty());

            // Then
            assertThat(received).containsExactly(CATALOG);
        }
    }
}
