package org.foxesworld.ecsave.engine.saveload;

import org.foxesworld.ecsave.engine.saveload.SaveDocument.ComponentRecord;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.TypeBlock;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads one component type's block back into the world.
 */
public final class ComponentDeserializer {

    private ComponentDeserializer() {}

    /**
     * The record's own entity and every entity it references are created on first sight.
     *
     * @return number of components inserted
     * @throws EncodingException if the block holds two records for one ordinal (nothing is inserted)
     */
    public static <T> int deserialize(ComponentType<T> type, TypeBlock block, EntityTranslator translator, TypedStorage<T> storage) {
        checkOrdinalsDistinct(block);
        int inserted = 0;
        for (ComponentRecord record : block.records()) {
            int live = translator.toLive(record.ordinal());
            T decoded = type.decode(record.payload());
            T component = EntityReferenceResolver.fromWire(type, decoded, translator);
            storage.insert(live, component);
            inserted++;
        }
        return inserted;
    }

    private static void checkOrdinalsDistinct(TypeBlock block) {
        Set<Integer> seen = new HashSet<>();
        for (ComponentRecord record : block.records()) {
            if (!seen.add(record.ordinal())) {
                throw new EncodingException("Block '" + block.tag() + "' holds ordinal " + record.ordinal() + " more than once");
            }
        }
    }
}
