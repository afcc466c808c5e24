package com.fleetgate.channel.registry;

import com.fleetgate.channel.adapter.PluginHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of channel handlers keyed by type.
 */
@Slf4j
public class PluginHandlerRegistry {

    private final Map<String, PluginHandler> handlers = new ConcurrentHashMap<>();

    public PluginHandlerRegistry() {
    }

    public PluginHandlerRegistry(Collection<? extends PluginHandler> initial) {
        initial.forEach(this::register);
    }

    public void register(PluginHandler handler) {
        String key = normalize(handler.type());
        PluginHandler previous = handlers.put(key, handler);
        if (previous != null && previous != handler) {
            log.warn("Replaced plugin handler for type {}", key);
        } else {
            log.debug("Registered plugin handler: {}", key);
        }
    }

    public Optional<PluginHandler> get(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(normalize(type)));
    }

    public List<String> types() {
        List<String> types = new ArrayList<>(handlers.keySet());
        types.sort(null);
        return types;
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
