package me.internalizable.atelier.adapter;

import me.internalizable.atelier.api.adapter.ApplicationAdapter;
import me.internalizable.atelier.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Knows which application sits behind each channel.
 *
 * <p>An explicit binding wins. Otherwise a channel named after an adapter's default channel
 * belongs to that adapter. Anything else is unbound and gets transport-level validation only.</p>
 */
public class AdapterRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, ApplicationAdapter> adapters = new ConcurrentHashMap<>();
    private final Map<String, String> bindings = new ConcurrentHashMap<>();

    /**
     * A registry holding the built-in adapters and the channel bindings from the config.
     *
     * @throws IllegalArgumentException if the config binds a channel to an unknown adapter
     */
    @Nonnull
    public static AdapterRegistry withBuiltins(@Nonnull RelayConfig config) {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(new FigmaAdapter());
        registry.register(new BlenderAdapter());
        registry.register(new PhotoshopAdapter());
        if (config.getChannelAdapters() != null) {
            config.getChannelAdapters().forEach(registry::bind);
        }
        return registry;
    }

    public void register(@Nonnull ApplicationAdapter adapter) {
        Objects.requireNonNull(adapter, "adapter");
        ApplicationAdapter previous = adapters.putIfAbsent(adapter.id(), adapter);
        if (previous != null) {
            throw new IllegalArgumentException("Adapter already registered: " + adapter.id());
        }
        LOGGER.debug("Registered adapter {} ({} tools)", adapter.id(), adapter.tools().size());
    }

    /**
     * Bind a channel to an adapter, replacing any earlier binding.
     */
    public void bind(@Nonnull String channel, @Nonnull String adapterId) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(adapterId, "adapterId");
        if (!adapters.containsKey(adapterId)) {
            throw new IllegalArgumentException("Unknown adapter '" + adapterId + "' for channel '" + channel + "'");
        }
        bindings.put(channel, adapterId);
        LOGGER.debug("Channel '{}' bound to adapter {}", channel, adapterId);
    }

    /**
     * The adapter serving a channel.
     */
    @Nonnull
    public Optional<ApplicationAdapter> forChannel(@Nonnull String channel) {
        String bound = bindings.get(channel);
        if (bound != null) {
            return Optional.ofNullable(adapters.get(bound));
        }
        for (ApplicationAdapter adapter : adapters.values()) {
            if (adapter.defaultChannel().equals(channel)) {
                return Optional.of(adapter);
            }
        }
        return Optional.empty();
    }

    @Nonnull
    public Optional<ApplicationAdapter> forApplication(@Nonnull String adapterId) {
        return Optional.ofNullable(adapters.get(adapterId));
    }

    /**
     * All adapters, sorted by id.
     */
    @Nonnull
    public List<ApplicationAdapter> all() {
        List<ApplicationAdapter> list = new ArrayList<>(adapters.values());
        list.sort((a, b) -> a.id().compareTo(b.id()));
        return List.copyOf(list);
    }
}
