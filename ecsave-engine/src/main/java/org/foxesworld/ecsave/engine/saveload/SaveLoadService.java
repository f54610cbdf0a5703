package org.foxesworld.ecsave.engine.saveload;

import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.ecsave.core.io.ByteCodec;
import org.foxesworld.ecsave.engine.ecs.EcsWorld;
import org.foxesworld.ecsave.engine.saveload.config.SaveLoadConfig;
import org.foxesworld.ecsave.engine.saveload.format.JsonSaveFormat;
import org.foxesworld.ecsave.engine.saveload.store.SaveSlot;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Save and load for one {@link EcsWorld}.
 *
 * <p>A save writes every marked entity's components of the listed types; a load recreates
 * those entities (marked again) with fresh ids and rewrites references between them.
 * Every failure aborts the operation. A failed {@link #load} leaves the world half
 * written, so callers that cannot afford that should use {@link #loadFresh} and swap.
 */
public final class SaveLoadService {
    private static final Logger log = LogManager.getLogger(SaveLoadService.class);

    private final EcsWorld world;
    private final TypeVisitationDriver driver;
    private final MarkerRegistry<?> markers;
    private final ByteCodec<SaveDocument> format;
    private final SaveLoadConfig config;
    private final SaveSlot slot;

    public SaveLoadService(EcsWorld world, ComponentTypeRegistry registry, SaveLoadConfig config) {
        this(world, new TypeVisitationDriver(registry), MarkerRegistry.persistent(),
                jsonFormat(registry, config), config);
    }

    public SaveLoadService(EcsWorld world,
                           TypeVisitationDriver driver,
                           MarkerRegistry<?> markers,
                           ByteCodec<SaveDocument> format,
                           SaveLoadConfig config) {
        this.world = Objects.requireNonNull(world, "world");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.markers = Objects.requireNonNull(markers, "markers");
        this.format = Objects.requireNonNull(format, "format");
        this.config = Objects.requireNonNull(config, "config");
        this.slot = new SaveSlot(config.saveFile(), format);
    }

    private static JsonSaveFormat jsonFormat(ComponentTypeRegistry registry, SaveLoadConfig config) {
        if (!config.prettyJson()) return new JsonSaveFormat(registry.mapper());
        return new JsonSaveFormat(registry.mapper().copy().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public EcsWorld world() { return world; }

    public MarkerRegistry<?> markers() { return markers; }

    public SaveLoadConfig config() { return config; }

    // ---------------- save ----------------

    /**
     * @throws UnsupportedTypeException if a listed type is not registered (nothing is read)
     * @throws UnknownEntityException   if a persisted component references an unmarked entity
     * @throws DuplicateEntityException if the world reports a marked entity twice
     */
    public SaveDocument capture(List<Class<?>> types) {
        List<ComponentType<?>> resolved = driver.registry().resolve(types);
        List<Integer> marked = markers.collectMarked(world);

        try (EntityTranslator translator = EntityTranslator.begin(marked)) {
            SaveDocument doc = driver.runSaveResolved(resolved, translator, world);
            log.info("Captured {} entities, {} components, {} types", translator.size(), doc.recordCount(), resolved.size());
            return doc;
        } catch (SaveLoadException e) {
            log.error("Save failed: {}", e.getMessage());
            throw e;
        }
    }

    /** {@link #capture} encoded with the configured format. */
    public byte[] save(List<Class<?>> types) {
        SaveDocument doc = capture(types);
        try {
            return format.encode(doc);
        } catch (IOException e) {
            throw new EncodingException("Cannot encode save: " + e.getMessage(), e);
        }
    }

    public void saveToSlot(List<Class<?>> types) throws IOException {
        slot.write(capture(types));
    }

    // ---------------- load ----------------

    /**
     * Loads into {@code target} as is: nothing is cleared, restored entities are added.
     *
     * @return ordinal -&gt; restored live id
     */
    public SortedMap<Integer, Integer> restore(SaveDocument document, List<Class<?>> types, WorldAccess target) {
        List<ComponentType<?>> resolved = driver.registry().resolve(types);
        return restoreResolved(document, resolved, target);
    }

    /**
     * Loads into this service's world, clearing it first when {@code load.clear-world} is set.
     * The data is decoded and the types resolved before the world is touched.
     */
    public EcsWorld load(byte[] data, List<Class<?>> types) {
        SaveDocument document = decode(data);
        return loadInto(document, types);
    }

    public EcsWorld loadFromSlot(List<Class<?>> types) throws IOException {
        return loadInto(slot.read(), types);
    }

    /** Loads into a new world, leaving this service's world alone. */
    public EcsWorld loadFresh(byte[] data, List<Class<?>> types) {
        SaveDocument document = decode(data);
        List<ComponentType<?>> resolved = driver.registry().resolve(types);
        EcsWorld fresh = new EcsWorld();
        restoreResolved(document, resolved, fresh);
        return fresh;
    }

    public boolean hasSave() {
        return slot.exists();
    }

    public boolean deleteSave() throws IOException {
        return slot.delete();
    }

    // ---------------- internals ----------------

    private EcsWorld loadInto(SaveDocument document, List<Class<?>> types) {
        List<ComponentType<?>> resolved = driver.registry().resolve(types);
        if (config.clearWorldOnLoad()) {
            log.debug("Clearing world before load");
            world.reset();
        }
        restoreResolved(document, resolved, world);
        return world;
    }

    private SortedMap<Integer, Integer> restoreResolved(SaveDocument document, List<ComponentType<?>> resolved, WorldAccess target) {
        try (EntityTranslator translator = EntityTranslator.discovering(target, markers)) {
            int inserted = driver.runLoadResolved(resolved, document, translator, target);
            SortedMap<Integer, Integer> restored = translator.ordinals();
            log.info("Restored {} entities, {} components, {} types", restored.size(), inserted, resolved.size());
            return restored;
        } catch (SaveLoadException e) {
            log.error("Load failed: {}", e.getMessage());
            throw e;
        }
    }

    private SaveDocument decode(byte[] data) {
        Objects.requireNonNull(data, "data");
        try {
            return format.decode(data);
        } catch (IOException e) {
            throw new EncodingException("Cannot decode save: " + e.getMessage(), e);
        }
    }
}
