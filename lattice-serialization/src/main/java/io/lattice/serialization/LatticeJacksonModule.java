package io.lattice.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.lattice.core.options.ExecutorSettings;
import io.lattice.serialization.mixin.ExecutorSettingsBuilderMixin;
import io.lattice.serialization.mixin.ExecutorSettingsMixin;
import java.io.Serial;

/**
 * Jackson {@code SimpleModule} that registers all Lattice serialization configuration in one
 * place.
 *
 * <p>{@code ExecutorSettings} is an immutable builder-pattern type; its mixin pair tells
 * Jackson to deserialize through {@code ExecutorSettings.Builder}.
 *
 * @implNote All registrations are explicit; no classpath scanning.
 * @see ExecutorSettingsSerializer for the convenience factory API
 */
public class LatticeJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4410925760871093415L;

    public LatticeJacksonModule() {
        super("LatticeJacksonModule");
    }

    /**
     * Applies mixin annotations to builder-pattern types.
     *
     * @param context the setup context provided by Jackson, not null
     */
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(ExecutorSettings.class, ExecutorSettingsMixin.class);
        context.setMixInAnnotations(
                ExecutorSettings.Builder.class, ExecutorSettingsBuilderMixin.class);
    }
}
