package com.containerkit.engine.tool;

import com.containerkit.engine.error.EngineException;
import com.containerkit.engine.error.ToolNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process tool registry.
 *
 * Every {@link Tool} bean is registered at startup; further tools can be
 * added or removed at runtime. Backed by a {@link ConcurrentHashMap} so
 * lookups never block and registration is an atomic check-and-set.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public ToolRegistry() {}

    public ToolRegistry(List<? extends Tool> initialTools) {
        initialTools.forEach(this::register);
    }

    // ------------------------------------------------------------------
    // Mutation
    // ------------------------------------------------------------------

    /**
     * @throws EngineException VALIDATION if the name is blank or already taken;
     *                         the existing registration is left untouched
     */
    public void register(Tool tool) {
        String name = tool.name();
        if (name == null || name.isBlank()) {
            throw EngineException.validation("Tool name must not be blank");
        }
        Tool existing = tools.putIfAbsent(name, tool);
        if (existing != null) {
            throw EngineException.validation("Tool '" + name + "' is already registered");
        }
        log.info("Registered tool '{}' [{}]", name, tool.category());
    }

    /** @throws ToolNotFoundException if no tool has that name */
    public void unregister(String name) {
        if (tools.remove(name) == null) {
            throw new ToolNotFoundException(name);
        }
        log.info("Unregistered tool '{}'", name);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<Tool> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public Tool getTool(String name) {
        return get(name).orElseThrow(() -> new ToolNotFoundException(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    /** All registered names; order is not guaranteed. */
    public List<String> list() {
        return List.copyOf(tools.keySet());
    }

    public List<String> listByCategory(ToolCategory category) {
        return tools.values().stream()
                .filter(t -> t.category() == category)
                .map(Tool::name)
                .sorted()
                .toList();
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .map(ToolDescriptor::from)
                .sorted(Comparator.comparing(ToolDescriptor::name))
                .toList();
    }

    public int size() {
        return tools.size();
    }
}
