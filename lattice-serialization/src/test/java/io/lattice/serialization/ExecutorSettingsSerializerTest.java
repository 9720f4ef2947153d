package io.lattice.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.lattice.core.options.ExecutorSettings;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExecutorSettingsSerializerTest {

    @Test
    void roundTrip_allSettings() {
        ExecutorSettings original =
                ExecutorSettings.builder()
                        .executionTimeout(Duration.ofSeconds(10))
                        .includeExceptionDetails(false)
                        .queryCacheSize(200)
                        .contextData(Map.of("tenant", "acme"))
                        .build();

        String json = ExecutorSettingsSerializer.toJson(original);
        ExecutorSettings restored = ExecutorSettingsSerializer.fromJson(json);

        assertThat(restored).isEqualTo(original);
        assertThat(json).contains("\"PT10S\"").contains("\"includeExceptionDetails\"");
    }

    @Test
    void toJson_omitsUnsetSettings() {
        ExecutorSettings settings =
                ExecutorSettings.builder().executionTimeout(Duration.ofMillis(1500)).build();

        String json = ExecutorSettingsSerializer.toJson(settings);

        assertThat(json)
                .contains("PT1.5S")
                .doesNotContain("queryCacheSize")
                .doesNotContain("includeExceptionDetails")
                .doesNotContain("contextData");
        assertThat(ExecutorSettingsSerializer.fromJson(json).getQueryCacheSize()).isNull();
    }

    @Test
    void fromJson_ignoresUnknownProperties() {
        ExecutorSettings settings =
                ExecutorSettingsSerializer.fromJson(
                        "{\"queryCacheSize\": 50, \"enableTracing\": true}");

        assertThat(settings.getQueryCacheSize()).isEqualTo(50);
        assertThat(settings.getExecutionTimeout()).isNull();
        assertThat(settings.getContextData()).isEmpty();
    }

    @Test
    void fromJson_rejectsMalformedInput() {
        assertThatThrownBy(() -> ExecutorSettingsSerializer.fromJson("{\"queryCacheSize\": "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to deserialize executor settings");
    }

    @Test
    void documentFromJson_keepsDocumentOrder() {
        String json =
                """
                {
                  "executors": {
                    "orders": { "executionTimeout": "PT5S" },
                    "catalog": { "includeExceptionDetails": true, "queryCacheSize": 200 }
                  }
                }
                """;

        ExecutorSettingsDocument document = ExecutorSettingsSerializer.documentFromJson(json);

        assertThat(document.executors()).containsOnlyKeys("orders", "catalog");
        assertThat(document.executors().keySet()).containsExactly("orders", "catalog");
        assertThat(document.executors().get("orders").getExecutionTimeout())
                .isEqualTo(Duration.ofSeconds(5));
        assertThat(document.executors().get("catalog").getIncludeExceptionDetails()).isTrue();
    }

    @Test
    void documentFromJson_treatsMissingExecutorsAsEmpty() {
        assertThat(ExecutorSettingsSerializer.documentFromJson("{}").executors()).isEmpty();
    }

    @Test
    void documentFromJson_rejectsNullDocument() {
        assertThatThrownBy(() -> ExecutorSettingsSerializer.documentFromJson("null"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
