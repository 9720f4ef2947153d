package io.lattice.core.options;

import io.lattice.core.configure.ConfigureAction;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative, immutable overrides for {@link ExecutorOptions}.
 *
 * <p>Every field is optional; a {@code null} field leaves the corresponding option untouched.
 * Settings are typically loaded from an external document and turned into a configure action
 * with {@link #toAction()}.
 *
 * @see ExecutorOptions
 */
public final class ExecutorSettings {

    private final Duration executionTimeout;
    private final Boolean includeExceptionDetails;
    private final Integer queryCacheSize;
    private final Map<String, String> contextData;

    private ExecutorSettings(Builder builder) {
        this.executionTimeout = builder.executionTimeout;
        this.includeExceptionDetails = builder.includeExceptionDetails;
        this.queryCacheSize = builder.queryCacheSize;
        this.contextData = Map.copyOf(builder.contextData);
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public Boolean getIncludeExceptionDetails() {
        return includeExceptionDetails;
    }

    public Integer getQueryCacheSize() {
        return queryCacheSize;
    }

    public Map<String, String> getContextData() {
        return contextData;
    }

    /**
     * Writes the non-null settings into {@code options}.
     *
     * @param options the options to update, not null
     */
    public void applyTo(ExecutorOptions options) {
        if (executionTimeout != null) {
            options.setExecutionTimeout(executionTimeout);
        }
        if (includeExceptionDetails != null) {
            options.setIncludeExceptionDetails(includeExceptionDetails);
        }
        if (queryCacheSize != null) {
            options.setQueryCacheSize(queryCacheSize);
        }
        contextData.forEach(options::putContextData);
    }

    /**
     * Returns a synchronous configure action that applies these settings.
     *
     * @return the action, never null
     */
    public ConfigureAction<ExecutorOptions> toAction() {
        return ConfigureAction.of(this::applyTo);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExecutorSettings that)) {
            return false;
        }
        return Objects.equals(executionTimeout, that.executionTimeout)
                && Objects.equals(includeExceptionDetails, that.includeExceptionDetails)
                && Objects.equals(queryCacheSize, that.queryCacheSize)
                && contextData.equals(that.contextData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionTimeout, includeExceptionDetails, queryCacheSize, contextData);
    }

    @Override
    public String toString() {
        return "ExecutorSettings{executionTimeout="
                + executionTimeout
                + ", includeExceptionDetails="
                + includeExceptionDetails
                + ", queryCacheSize="
                + queryCacheSize
                + ", contextData="
                + contextData
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration executionTimeout;
        private Boolean includeExceptionDetails;
        private Integer queryCacheSize;
        private Map<String, String> contextData = Map.of();

        private Builder() {}

        public Builder executionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
            return this;
        }

        public Builder includeExceptionDetails(Boolean includeExceptionDetails) {
            this.includeExceptionDetails = includeExceptionDetails;
            return this;
        }

        public Builder queryCacheSize(Integer queryCacheSize) {
            this.queryCacheSize = queryCacheSize;
            return this;
        }

        public Builder contextData(Map<String, String> contextData) {
            this.contextData = contextData == null ? Map.of() : Map.copyOf(contextData);
            return this;
        }

        public ExecutorSettings build() {
            return new ExecutorSettings(this);
        }
    }
}
