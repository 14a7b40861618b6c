package com.platform.datakeeper.action;

import com.platform.datakeeper.config.DataKeeperProperties;
import com.platform.datakeeper.error.ActionExecutionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Kind name to plugin lookup. Built from the plugin beans, then extended at startup
 * with providers found in jars under the plugin directory. A kind is registered once;
 * later duplicates are ignored with a warning.
 */
@Slf4j
@Component
public class ActionPluginRegistry {
    
    private final Map<String, ActionPlugin> plugins = new ConcurrentHashMap<>();
    private final DataKeeperProperties properties;
    
    public ActionPluginRegistry(List<ActionPlugin> builtIn, DataKeeperProperties properties) {
        this.properties = properties;
        builtIn.forEach(this::register);
    }
    
    @PostConstruct
    public void init() {
        discoverExternal();
        log.info("Action plugins available: {}", kinds());
    }
    
    /**
     * @return false if the kind was already taken
     */
    public boolean register(ActionPlugin plugin) {
        ActionPlugin existing = plugins.putIfAbsent(plugin.kind(), plugin);
        if (existing != null && existing != plugin) {
            log.warn("Ignoring plugin {} for kind '{}': already provided by {}",
                plugin.getClass().getName(), plugin.kind(), existing.getClass().getName());
            return false;
        }
        return true;
    }
    
    public Optional<ActionPlugin> find(String kind) {
        return Optional.ofNullable(plugins.get(kind));
    }
    
    /**
     * @throws ActionExecutionException (constraint) when no plugin provides the kind
     */
    public ActionPlugin require(String kind) {
        return find(kind).orElseThrow(() ->
            ActionExecutionException.constraint("no action plugin registered for kind '" + kind + "'"));
    }
    
    public Set<String> kinds() {
        return new TreeSet<>(plugins.keySet());
    }
    
    private void discoverExternal() {
        if (properties.getPluginDir() == null || properties.getPluginDir().isBlank()) {
            return;
        }
        Path dir = Path.of(properties.getPluginDir());
        if (!Files.isDirectory(dir)) {
            log.warn("Plugin directory {} does not exist", dir);
            return;
        }
        
        List<URL> jars = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path jar : files.filter(p -> p.toString().endsWith(".jar")).sorted().toList()) {
                jars.add(jar.toUri().toURL());
            }
        } catch (MalformedURLException e) {
            log.error("Invalid plugin jar path in {}: {}", dir, e.getMessage());
            return;
        } catch (IOException e) {
            log.error("Cannot list plugin directory {}: {}", dir, e.getMessage());
            return;
        }
        if (jars.isEmpty()) {
            return;
        }
        
        URLClassLoader loader = new URLClassLoader(jars.toArray(URL[]::new), getClass().getClassLoader());
        try {
            for (ActionPlugin plugin : ServiceLoader.load(ActionPlugin.class, loader)) {
                if (register(plugin)) {
                    log.info("Loaded external plugin {} for kind '{}'", plugin.getClass().getName(), plugin.kind());
                }
            }
        } catch (ServiceConfigurationError e) {
            log.error("Failed to load plugins from {}: {}", dir, e.getMessage());
        }
    }
}
