package org.foxesworld.ecsave.engine.saveload;

import java.util.*;

/**
 * Live entity id &lt;-&gt; ordinal table for exactly one save or one load.
 *
 * <p>A save translator is built by {@link #begin(List)} from the marked entities: entity
 * {@code i} of the list gets ordinal {@code i}. A load translator starts empty and
 * allocates a live entity the first time an ordinal is seen; every later sighting of that
 * ordinal, whether from the entity's own record or from a reference, returns the same id.
 *
 * <p>Not thread-safe. Close it when the operation ends; a closed translator rejects every
 * call so stale ordinals can never resolve against another world.
 */
public final class EntityTranslator implements AutoCloseable {

    private final Map<Integer, Integer> liveToOrdinal = new HashMap<>();
    private final Map<Integer, Integer> ordinalToLive = new HashMap<>();
    private final List<Integer> order = new ArrayList<>();

    // load side only
    private final WorldAccess world;
    private final MarkerRegistry<?> markers;

    private boolean closed;

    private EntityTranslator(WorldAccess world, MarkerRegistry<?> markers) {
        this.world = world;
        this.markers = markers;
    }

    /**
     * Save side. Assigns ordinals 0..n-1 in list order.
     *
     * @throws DuplicateEntityException if an id occurs twice
     */
    public static EntityTranslator begin(List<Integer> entities) {
        Objects.requireNonNull(entities, "entities");
        EntityTranslator t = new EntityTranslator(null, null);
        for (Integer e : entities) {
            Objects.requireNonNull(e, "entity");
            int ordinal = t.order.size();
            if (t.liveToOrdinal.putIfAbsent(e, ordinal) != null) {
                throw new DuplicateEntityException(e);
            }
            t.ordinalToLive.put(ordinal, e);
            t.order.add(e);
        }
        return t;
    }

    /**
     * Load side. New entities are created in {@code world} and tagged by {@code markers}.
     */
    public static EntityTranslator discovering(WorldAccess world, MarkerRegistry<?> markers) {
        return new EntityTranslator(
                Objects.requireNonNull(world, "world"),
                Objects.requireNonNull(markers, "markers"));
    }

    public boolean isLoading() {
        return world != null;
    }

    /** @throws UnknownEntityException if the entity is not part of this operation */
    public int toOrdinal(int entity) {
        ensureOpen();
        Integer ordinal = liveToOrdinal.get(entity);
        if (ordinal == null) {
            throw new UnknownEntityException(
                    "Entity " + entity + " is referenced but not persisted (is it marked?)", entity);
        }
        return ordinal;
    }

    /**
     * On load: get-or-create. On save: lookup only.
     *
     * @throws UnknownEntityException for a negative ordinal, or an ordinal a save never assigned
     */
    public int toLive(int ordinal) {
        ensureOpen();
        Integer live = ordinalToLive.get(ordinal);
        if (live != null) return live;

        if (ordinal < 0 || world == null) {
            throw new UnknownEntityException("No entity for ordinal " + ordinal, ordinal);
        }

        int created = world.createEntity();
        markers.mark(world, created);
        ordinalToLive.put(ordinal, created);
        liveToOrdinal.put(created, ordinal);
        order.add(created);
        return created;
    }

    /** live -> ordinal, for writing */
    public EntityMapper toWireMapper() {
        return this::toOrdinal;
    }

    /** ordinal -> live, for reading */
    public EntityMapper toLiveMapper() {
        return this::toLive;
    }

    public int size() {
        return order.size();
    }

    /**
     * Live ids in the order they were assigned (save) or allocated (load).
     */
    public List<Integer> entities() {
        return Collections.unmodifiableList(order);
    }

    /** Snapshot of ordinal -&gt; live id, ascending ordinal. */
    public SortedMap<Integer, Integer> ordinals() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(ordinalToLive));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        liveToOrdinal.clear();
        ordinalToLive.clear();
        order.clear();
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("EntityTranslator already closed");
    }
}
