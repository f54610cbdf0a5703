package org.foxesworld.ecsave.engine.saveload;

/**
 * Entity-field rewriting for one component type. Lets a type that cannot implement
 * {@link MapEntities} (a class from another library, say) still take part in reference
 * rewriting when it is registered.
 */
@FunctionalInterface
public interface EntityFields<T> {

    /** @return a copy with rewritten entity fields, or {@code component} itself when it has none */
    T map(T component, EntityMapper mapper);

    /** Defers to {@link MapEntities} when the component implements it, else identity. */
    static <T> EntityFields<T> fromCapability() {
        return EntityReferenceResolver::viaCapability;
    }

    /** For types without entity fields. */
    static <T> EntityFields<T> none() {
        return (component, mapper) -> component;
    }
}
