package org.foxesworld.ecsave.engine.saveload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * A persistable component type: stable tag, Java class, payload codec and entity-field mapping.
 * The tag, not the position in a type list, identifies the data in a save.
 */
public final class ComponentType<T> {

    private final String tag;
    private final Class<T> type;
    private final ComponentCodec<T> codec;
    private final EntityFields<T> entityFields;

    private ComponentType(String tag, Class<T> type, ComponentCodec<T> codec, EntityFields<T> entityFields) {
        this.tag = normTag(tag);
        this.type = Objects.requireNonNull(type, "type");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.entityFields = Objects.requireNonNull(entityFields, "entityFields");
    }

    /** Tagged with the class's simple name, encoded with {@code mapper}. */
    public static <T> ComponentType<T> of(Class<T> type, ObjectMapper mapper) {
        return of(defaultTag(type), type, mapper);
    }

    public static <T> ComponentType<T> of(String tag, Class<T> type, ObjectMapper mapper) {
        return of(tag, type, new JacksonComponentCodec<>(mapper, type));
    }

    public static <T> ComponentType<T> of(String tag, Class<T> type, ComponentCodec<T> codec) {
        return new ComponentType<>(tag, type, codec, EntityFields.fromCapability());
    }

    /** Same type, with explicit entity-field rewriting instead of {@link MapEntities}. */
    public ComponentType<T> withEntityFields(EntityFields<T> fields) {
        return new ComponentType<>(tag, type, codec, fields);
    }

    public static String defaultTag(Class<?> type) {
        return type.getSimpleName();
    }

    public String tag() { return tag; }

    public Class<T> type() { return type; }

    public EntityFields<T> entityFields() { return entityFields; }

    public JsonNode encode(T component) {
        return codec.encode(component);
    }

    public T decode(JsonNode payload) {
        return codec.decode(payload);
    }

    @Override
    public String toString() {
        return tag + "(" + type.getName() + ")";
    }

    private static String normTag(String tag) {
        if (tag == null) throw new IllegalArgumentException("tag is null");
        String t = tag.trim();
        if (t.isEmpty()) throw new IllegalArgumentException("tag is blank");
        return t;
    }
}
