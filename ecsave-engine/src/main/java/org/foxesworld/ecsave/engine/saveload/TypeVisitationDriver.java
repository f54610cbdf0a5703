package org.foxesworld.ecsave.engine.saveload;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.TypeBlock;

import java.util.*;

/**
 * Walks a type list once per operation, strictly in order, handing each type's storage to the
 * serializer or deserializer. Knows types only through the registry.
 */
public final class TypeVisitationDriver {
    private static final Logger log = LogManager.getLogger(TypeVisitationDriver.class);

    private final ComponentTypeRegistry registry;

    public TypeVisitationDriver(ComponentTypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ComponentTypeRegistry registry() {
        return registry;
    }

    /**
     * One block per listed type, empty when no persisted entity owns it.
     *
     * @throws UnsupportedTypeException before anything is serialized
     */
    public SaveDocument runSave(List<Class<?>> types, EntityTranslator translator, WorldAccess world) {
        return runSaveResolved(registry.resolve(types), translator, world);
    }

    public SaveDocument runSaveResolved(List<ComponentType<?>> types, EntityTranslator translator, WorldAccess world) {
        Objects.requireNonNull(translator, "translator");
        Objects.requireNonNull(world, "world");
        if (translator.isLoading()) throw new IllegalArgumentException("save needs a save-side translator");

        List<TypeBlock> blocks = new ArrayList<>(types.size());
        for (ComponentType<?> type : types) {
            TypeBlock block = saveType(type, translator, world);
            log.debug("Serialized {}: {} records", type.tag(), block.records().size());
            blocks.add(block);
        }
        return SaveDocument.of(blocks);
    }

    /**
     * Missing blocks are treated as empty. Blocks for types not in the list are left alone.
     *
     * @return number of components inserted
     * @throws UnsupportedTypeException before anything is deserialized
     */
    public int runLoad(List<Class<?>> types, SaveDocument document, EntityTranslator translator, WorldAccess world) {
        return runLoadResolved(registry.resolve(types), document, translator, world);
    }

    public int runLoadResolved(List<ComponentType<?>> types, SaveDocument document, EntityTranslator translator, WorldAccess world) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(translator, "translator");
        Objects.requireNonNull(world, "world");
        if (!translator.isLoading()) throw new IllegalArgumentException("load needs a load-side translator");

        Set<String> listed = new HashSet<>();
        int inserted = 0;
        for (ComponentType<?> type : types) {
            listed.add(type.tag());
            Optional<TypeBlock> block = document.block(type.tag());
            if (block.isEmpty() || block.get().isEmpty()) {
                log.debug("Nothing to load for {}", type.tag());
                continue;
            }
            int n = loadType(type, block.get(), translator, world);
            log.debug("Deserialized {}: {} components", type.tag(), n);
            inserted += n;
        }

        for (String tag : document.tags()) {
            if (!listed.contains(tag)) log.warn("Save contains block '{}' which is not in the type list; skipped", tag);
        }
        return inserted;
    }

    private static <T> TypeBlock saveType(ComponentType<T> type, EntityTranslator translator, WorldAccess world) {
        return ComponentSerializer.serialize(type, new TypedStorage<>(world, type.type()), translator);
    }

    private static <T> int loadType(ComponentType<T> type, TypeBlock block, EntityTranslator translator, WorldAccess world) {
        return ComponentDeserializer.deserialize(type, block, translator, new TypedStorage<>(world, type.type()));
    }
}
