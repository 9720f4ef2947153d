package io.lattice.serialization;

import io.lattice.core.configure.ConfigureAction;
import io.lattice.core.execution.ExecutorName;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.options.ExecutorSettings;
import io.lattice.core.options.InMemoryFactoryOptionsMonitor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Feeds executor settings from JSON documents into an {@link InMemoryFactoryOptionsMonitor}.
 *
 * <p>Each loaded name gets one executor-options action applying its {@link ExecutorSettings},
 * appended after the actions configured in code. Reloading replaces that action only for
 * names whose settings changed, and removes it for names that disappeared from the document.
 * The monitor then notifies its subscribers, so a resolver evicts exactly the executors whose
 * settings changed.
 *
 * <h3>Contracts</h3>
 *
 * <ul>
 *   <li><b>Postcondition</b>: a malformed document leaves all settings untouched
 *   <li><b>Invariant</b>: unchanged names produce no change notification
 * </ul>
 *
 * @implNote Thread-safe. Loads are serialized on this instance.
 */
public class JsonFactoryOptionsSource {

    private static final Logger logger = Logger.getLogger(JsonFactoryOptionsSource.class.getName());

    private final InMemoryFactoryOptionsMonitor monitor;
    private final Map<ExecutorName, Installed> installed = new HashMap<>();

    public JsonFactoryOptionsSource(InMemoryFactoryOptionsMonitor monitor) {
        this.monitor = monitor;
    }

    /**
     * Loads a settings document from {@code path}.
     *
     * @param path the JSON file, not null
     * @return names whose settings changed, never null
     * @throws UncheckedIOException if the file cannot be read
     * @throws IllegalArgumentException if the document is malformed
     */
    public Set<ExecutorName> load(Path path) {
        try {
            return load(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read executor settings from " + path, e);
        }
    }

    /**
     * Loads a settings document.
     *
     * @apiNote <b>Side effects</b>: updates the monitor's options and fires one change
     *     notification per changed name.
     * @param json the document, not null
     * @return names whose settings changed, in document order followed by removed names
     * @throws IllegalArgumentException if the document is malformed
     */
    public synchronized Set<ExecutorName> load(String json) {
        ExecutorSettingsDocument document = ExecutorSettingsSerializer.documentFromJson(json);

        Map<ExecutorName, ExecutorSettings> incoming = new LinkedHashMap<>();
        document.executors()
                .forEach(
                        (name, settings) ->
                                incoming.put(
                                        ExecutorName.of(name),
                                        settings == null
                                                ? ExecutorSettings.builder().build()
                                                : settings));

        Set<ExecutorName> changed = new LinkedHashSet<>();
        for (Map.Entry<ExecutorName, ExecutorSettings> entry : incoming.entrySet()) {
            ExecutorName name = entry.getKey();
            ExecutorSettings settings = entry.getValue();
            Installed current = installed.get(name);
            if (current != null && current.settings().equals(settings)) {
                continue;
            }

            ConfigureAction<ExecutorOptions> action = settings.toAction();
            monitor.configure(
                    name,
                    options -> {
                        if (current != null) {
                            options.removeExecutorOptionsAction(current.action());
                        }
                        return options.addExecutorOptionsAction(action);
                    });
            installed.put(name, new Installed(settings, action));
            changed.add(name);
        }

        for (ExecutorName name : new ArrayList<>(installed.keySet())) {
            if (!incoming.containsKey(name)) {
                Installed removed = installed.remove(name);
                monitor.configure(
                        name, options -> options.removeExecutorOptionsAction(removed.action()));
                changed.add(name);
            }
        }

        logger.info(
                "Loaded executor settings for "
                        + incoming.size()
                        + " executors, "
                        + changed.size()
                        + " changed");
        return changed;
    }

    /**
     * Returns the settings currently applied for {@code name}.
     *
     * @param name the executor name, not null
     * @return the settings, or empty if none were loaded for {@code name}
     */
    public synchronized Optional<ExecutorSettings> getSettings(ExecutorName name) {
        Installed current = installed.get(name);
        return current == null ? Optional.empty() : Optional.of(current.settings());
    }

    private record Installed(ExecutorSettings settings, ConfigureAction<ExecutorOptions> action) {}
}
