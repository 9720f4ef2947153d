package io.lattice.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.lattice.core.options.ExecutorSettings;

/**
 * Jackson mixin that binds {@code ExecutorSettings} deserialization to its builder.
 *
 * <p>Applied to {@code ExecutorSettings.class} via {@code LatticeJacksonModule.setupModule()}.
 * Unset settings are left out of the written JSON so a round trip keeps them unset.
 *
 * @apiNote The companion mixin {@link ExecutorSettingsBuilderMixin} must also be registered so
 *     Jackson knows how to invoke the builder's setters and {@code build()} method.
 * @see ExecutorSettingsBuilderMixin
 * @see io.lattice.serialization.LatticeJacksonModule
 */
@JsonDeserialize(builder = ExecutorSettings.Builder.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public abstract class ExecutorSettingsMixin {}
