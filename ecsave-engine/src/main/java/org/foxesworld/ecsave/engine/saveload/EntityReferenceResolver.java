package org.foxesworld.ecsave.engine.saveload;

import java.util.Objects;

/**
 * Rewrites the entity-valued fields of a component between live ids and ordinals.
 * Plain fields pass through. The shape of the component is only known to its
 * {@link EntityFields} / {@link MapEntities} implementation.
 */
public final class EntityReferenceResolver {

    private EntityReferenceResolver() {}

    /** live ids -&gt; ordinals; fails on references to unmarked entities */
    public static <T> T toWire(ComponentType<T> type, T component, EntityTranslator translator) {
        return apply(type, component, translator.toWireMapper());
    }

    /** ordinals -&gt; live ids; allocates referenced entities that do not exist yet */
    public static <T> T fromWire(ComponentType<T> type, T component, EntityTranslator translator) {
        return apply(type, component, translator.toLiveMapper());
    }

    static <T> T apply(ComponentType<T> type, T component, EntityMapper mapper) {
        Objects.requireNonNull(component, "component");
        T mapped = type.entityFields().map(component, mapper);
        if (!type.type().isInstance(mapped)) {
            throw new IllegalStateException("Entity mapping of " + type.tag() + " returned "
                    + (mapped == null ? "null" : mapped.getClass().getName()));
        }
        return mapped;
    }

    @SuppressWarnings("unchecked")
    static <T> T viaCapability(T component, EntityMapper mapper) {
        if (component instanceof MapEntities<?> m) {
            return (T) m.mapEntities(mapper);
        }
        return component;
    }
}
