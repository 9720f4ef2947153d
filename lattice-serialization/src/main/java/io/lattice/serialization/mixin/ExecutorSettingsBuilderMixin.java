package io.lattice.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * Jackson mixin for {@code ExecutorSettings.Builder}.
 *
 * <p>Sets {@code withPrefix = ""} so JSON field names map directly to the builder's setter
 * names.
 *
 * @see ExecutorSettingsMixin
 */
@JsonPOJOBuilder(withPrefix = "")
public abstract class ExecutorSettingsBuilderMixin {}
