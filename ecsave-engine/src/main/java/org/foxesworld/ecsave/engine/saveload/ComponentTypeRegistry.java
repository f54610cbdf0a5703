package org.foxesworld.ecsave.engine.saveload;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Every component type a save may contain, keyed by tag and by class.
 * Built once at startup, from explicit {@code register} calls and/or {@link #discover}.
 */
public final class ComponentTypeRegistry {
    private static final Logger log = LogManager.getLogger(ComponentTypeRegistry.class);

    private final ObjectMapper mapper;
    private final Map<String, ComponentType<?>> byTag = new LinkedHashMap<>();
    private final Map<Class<?>, ComponentType<?>> byClass = new IdentityHashMap<>();

    public ComponentTypeRegistry(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Registry filled from every {@link ComponentTypeProvider} on the class path.
     */
    public static ComponentTypeRegistry discover(ObjectMapper mapper) {
        ComponentTypeRegistry registry = new ComponentTypeRegistry(mapper);
        Set<String> providerIds = new HashSet<>();
        ServiceLoader<ComponentTypeProvider> loader = ServiceLoader.load(ComponentTypeProvider.class);

        for (ComponentTypeProvider p : loader) {
            String id = Objects.requireNonNull(p.id(), "provider.id()");
            if (!providerIds.add(id)) {
                throw new IllegalStateException("Duplicate ComponentTypeProvider id: " + id);
            }
            List<ComponentType<?>> types;
            try {
                types = Objects.requireNonNull(p.types(mapper), "provider.types()");
            } catch (RuntimeException e) {
                log.error("ComponentTypeProvider failed: id={} provider={}", id, p.getClass().getName(), e);
                throw e;
            }
            for (ComponentType<?> t : types) registry.register(t);
            log.info("ComponentTypeProvider registered: {} ({} types)", id, types.size());
        }
        return registry;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <T> ComponentType<T> register(Class<T> type) {
        return register(ComponentType.of(type, mapper));
    }

    public <T> ComponentType<T> register(String tag, Class<T> type) {
        return register(ComponentType.of(tag, type, mapper));
    }

    public <T> ComponentType<T> register(ComponentType<T> type) {
        Objects.requireNonNull(type, "type");
        if (byTag.containsKey(type.tag())) {
            throw new IllegalStateException("Duplicate component type tag: " + type.tag());
        }
        if (byClass.containsKey(type.type())) {
            throw new IllegalStateException("Component class already registered: " + type.type().getName()
                    + " as " + byClass.get(type.type()).tag());
        }
        byTag.put(type.tag(), type);
        byClass.put(type.type(), type);
        log.debug("Component type registered: {}", type);
        return type;
    }

    @SuppressWarnings("unchecked")
    public <T> ComponentType<T> require(Class<T> type) {
        ComponentType<?> t = byClass.get(type);
        if (t == null) {
            throw new UnsupportedTypeException("Unregistered component type: " + (type == null ? "null" : type.getName()));
        }
        return (ComponentType<T>) t;
    }

    public ComponentType<?> require(String tag) {
        ComponentType<?> t = tag == null ? null : byTag.get(tag.trim());
        if (t == null) throw new UnsupportedTypeException("Unknown component type tag: " + tag);
        return t;
    }

    public boolean isRegistered(Class<?> type) {
        return byClass.containsKey(type);
    }

    /**
     * Resolves a caller type list, all or nothing.
     *
     * @throws UnsupportedTypeException for the first unregistered class
     * @throws IllegalArgumentException if a class is listed twice
     */
    public List<ComponentType<?>> resolve(List<Class<?>> types) {
        Objects.requireNonNull(types, "types");
        List<ComponentType<?>> out = new ArrayList<>(types.size());
        Set<Class<?>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Class<?> c : types) {
            if (!seen.add(c)) throw new IllegalArgumentException("Type listed twice: " + c.getName());
            out.add(require(c));
        }
        return out;
    }

    /** Same as {@link #resolve} but by tag. */
    public List<ComponentType<?>> resolveTags(List<String> tags) {
        Objects.requireNonNull(tags, "tags");
        List<ComponentType<?>> out = new ArrayList<>(tags.size());
        Set<String> seen = new HashSet<>();
        for (String tag : tags) {
            ComponentType<?> t = require(tag);
            if (!seen.add(t.tag())) throw new IllegalArgumentException("Type listed twice: " + t.tag());
            out.add(t);
        }
        return out;
    }

    /** Registration order. */
    public Set<String> tags() {
        return Collections.unmodifiableSet(byTag.keySet());
    }
}
