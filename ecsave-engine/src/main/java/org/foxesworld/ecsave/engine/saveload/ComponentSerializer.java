package org.foxesworld.ecsave.engine.saveload;

import org.foxesworld.ecsave.engine.saveload.SaveDocument.ComponentRecord;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.TypeBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes one component type: a record for every persisted entity that owns it.
 */
public final class ComponentSerializer {

    private ComponentSerializer() {}

    /**
     * Records follow the translator's ordinal order. Live components are not modified.
     *
     * @throws UnknownEntityException if a component references an entity outside the save
     */
    public static <T> TypeBlock serialize(ComponentType<T> type, TypedStorage<T> storage, EntityTranslator translator) {
        if (!storage.exists()) return new TypeBlock(type.tag(), List.of());

        List<ComponentRecord> records = new ArrayList<>();
        for (int entity : translator.entities()) {
            T component = storage.get(entity);
            if (component == null) continue;

            T wire = EntityReferenceResolver.toWire(type, component, translator);
            records.add(new ComponentRecord(translator.toOrdinal(entity), type.encode(wire)));
        }
        return new TypeBlock(type.tag(), records);
    }
}
