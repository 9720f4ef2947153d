package io.lattice.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.configure.ConfigureAction;
import io.lattice.core.exception.SchemaNameMismatchException;
import io.lattice.core.execution.ExecutorName;
import io.lattice.core.options.ExecutorFactoryOptions;
import io.lattice.core.service.DefaultServiceProvider;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SchemaAssemblerTest {

    private static final ExecutorName CATALOG = ExecutorName.of("catalog");

    private DefaultServiceProvider services;
    private SchemaAssembler assembler;

    @BeforeEach
    void setUp() {
        services = new DefaultServiceProvider();
        assembler = new SchemaAssembler(services);
    }

    @Nested
    class PrebuiltSchemaTest {

        @Test
        void shouldReturnMatchingPrebuiltSchemaWithoutRunningActions() {
            // Given
            Schema prebuilt = new SchemaBuilder().name("catalog").create();
            AtomicInteger actionRuns = new AtomicInteger();
            ExecutorFactoryOptions options =
                    ExecutorFactoryOptions.builder()
                            .schema(prebuilt)
                            .addSchemaBuilderAction(
                                    ConfigureAction.of(b -> actionRuns.incrementAndGet()))
                            .build();

            // When
            Schema schema = assembler.resolve(CATALOG, options, CancellationToken.NONE);

            // Then
            assertThat(schema).isSameAs(prebuilt);
            assertThat(actionRuns).hasValue(0);
        }

        @Test
        void shouldRejectPrebuiltSchemaWithOtherName() {
            // Given
            ExecutorFactoryOptions options =
                    ExecutorFactoryOptions.builder()
                            .schema(new SchemaBuilder().name("orders").create())
                            .build();

            // When/Then
            assertThatThrownBy(() -> assembler.resolve(CATALOG, options, CancellationToken.NONE))
                    .isInstanceOfSatisfying(
                            SchemaNameMismatchException.class,
                            e -> {
                                assertThat(e.getExpected()).isEqualTo(CATALOG);
                                assertThat(e.getActual()).isEqualTo("orders");
                            });
        }
    }

    @Nested
    class BuilderActionsTest {

        @Test
        void shouldApplyActionsSettingDifferentFields() {
            // Given
            ExecutorFactoryOptions options =
                    ExecutorFactoryOptions.builder()
                            .addSchemaBuilderAction(ConfigureAction.of(b -> b.addType("Product")))
                            .addSchemaBuilderAction(
                                    ConfigureAction.of(b -> b.description("Product catalog")))
                            .build();

            // When
            Schema schema = assembler.resolve(CATALOG, options, CancellationToken.NONE);

            // Then
            assertThat(schema.getTypes()).containsExactly("Product");
            assertThat(schema.getDescription()).contains("Product catalog");
            assertThat(schema.getServices()).isSameAs(services);
        }

        @Test
        void shouldLetLastActionWinForSameField() {
            // Given
            ExecutorFactoryOptions options =
                    ExecutorFactoryOptions.builder()
                            .addSchemaBuilderAction(ConfigureAction.of(b -> b.description("A")))
                            .addSchemaBuilderAction(
                                    ConfigureAction.ofAsync(
                                            (b, token) -> {
                                                b.description("B");
                                                return CompletableFuture.completedFuture(null);
                                            }))
                            .build();

            // When
            Schema schema = assembler.resolve(CATALOG, options, CancellationToken.NONE);

            // Then
            assertThat(schema.getDescription()).contains("B");
        }

        @Test
        void shouldForceExecutorNameOverActionAndInterceptorNames() {
            // Given
            ExecutorFactoryOptions options =
                    ExecutorFactoryOptions.builder()
                            .addSchemaBuilderAction(ConfigureAction.of(b -> b.name("orders")))
                            .addSchemaBuilderAction(
                                    ConfigureAction.of(
                                            b ->
                                                    b.addTypeInterceptor(
                                                            new TypeInterceptor() {
                                                                @Override
                                                                public void onBeforeCompleteName(
                                                                        SchemaDefinition definition) {
                                                                    definition.setName("renamed");
                                                                }
                                                            })))
                            .build();

            // When
            Schema schema = assembler.resolve(CATALOG, options, CancellationToken.NONE);

            // Then
            assertThat(schema.getName()).isEqualTo("catalog");
        }

        @Test
        void shouldNotMutateConfiguredBuilder() {
            // Given
            SchemaBuilder configured = new SchemaBuilder().addType("Product");
            ExecutorFactoryOptions options =
                    ExecutorFactoryOptions.builder()
                            .schemaBuilder(configured)
                            .addSchemaBuilderAction(ConfigureAction.of(b -> b.addType("Review")))
                            .build();

            // When
            Schema first = assembler.resolve(CATALOG, options, CancellationToken.NONE);
            Schema second = assembler.resolve(CATALOG, options, CancellationToken.NONE);

            // Then
            assertThat(first.getTypes()).containsExactly("Product", "Review");
            assertThat(second.getTypes()).containsExactly("Product", "Review");
            assertThat(configured.getTypes()).containsExactly("Product");
            assertThat(configured.getName()).isNull();
        }
    }
}
