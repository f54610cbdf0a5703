package org.foxesworld.ecsave.engine.ecs;

import java.util.*;

/**
 * Typed component columns indexed by entity slot. Each column remembers the full
 * (generation-qualified) id that owns a slot, so lookups with a stale id miss.
 */
public final class ComponentStore {

    // typed storage: Class -> column (slot index as array index)
    private final Map<Class<?>, Column> typed = new IdentityHashMap<>();

    private int capacity = 0;

    private static final class Column {
        Object[] values;
        int[] owners;

        Column(int capacity) {
            values = new Object[capacity];
            owners = new int[capacity];
        }

        boolean holds(int entity) {
            int i = EntityManager.index(entity);
            return i < values.length && values[i] != null && owners[i] == entity;
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T get(int entity, Class<T> type) {
        Column col = typed.get(type);
        if (col == null || entity <= 0 || !col.holds(entity)) return null;
        return (T) col.values[EntityManager.index(entity)];
    }

    public <T> void put(int entity, Class<T> type, T value) {
        if (entity <= 0) throw new IllegalArgumentException("entity must be > 0");
        Objects.requireNonNull(value, "value");
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("value " + value.getClass().getName() + " is not a " + type.getName());
        }
        int index = EntityManager.index(entity);
        ensureCapacity(index);
        Column col = typed.computeIfAbsent(type, k -> new Column(capacity));
        col.values[index] = value;
        col.owners[index] = entity;
    }

    public <T> boolean has(int entity, Class<T> type) {
        Column col = typed.get(type);
        return col != null && entity > 0 && col.holds(entity);
    }

    public <T> void remove(int entity, Class<T> type) {
        Column col = typed.get(type);
        if (col == null || entity <= 0 || !col.holds(entity)) return;
        col.values[EntityManager.index(entity)] = null;
    }

    /** True once any component of this type has ever been stored. */
    public boolean hasStorage(Class<?> type) {
        return typed.containsKey(type);
    }

    /** Entity ids owning the type, ascending slot order. */
    public List<Integer> owners(Class<?> type) {
        Column col = typed.get(type);
        if (col == null) return List.of();
        List<Integer> out = new ArrayList<>();
        for (int i = 1; i < col.values.length; i++) {
            if (col.values[i] != null) out.add(col.owners[i]);
        }
        return out;
    }

    /** Snapshot for tests and debugging (avoid per frame). */
    @SuppressWarnings("unchecked")
    public <T> Map<Integer, T> view(Class<T> type) {
        Column col = typed.get(type);
        if (col == null) return Map.of();
        LinkedHashMap<Integer, T> out = new LinkedHashMap<>();
        for (int i = 1; i < col.values.length; i++) {
            Object v = col.values[i];
            if (v != null) out.put(col.owners[i], (T) v);
        }
        return Collections.unmodifiableMap(out);
    }

    /** Remove ALL components for an entity (critical for destroyEntity). */
    public void removeAll(int entity) {
        if (entity <= 0) return;
        int index = EntityManager.index(entity);
        for (Column col : typed.values()) {
            if (col.holds(entity)) col.values[index] = null;
        }
    }

    public void reset() {
        typed.clear();
        capacity = 0;
    }

    // ---------------- internals ----------------

    private void ensureCapacity(int index) {
        if (index < capacity) return;

        int newCap = nextPow2(index + 1);
        if (newCap <= capacity) newCap = index + 1;

        for (Column col : typed.values()) {
            col.values = Arrays.copyOf(col.values, newCap);
            col.owners = Arrays.copyOf(col.owners, newCap);
        }

        capacity = newCap;
    }

    private static int nextPow2(int v) {
        int x = 1;
        while (x < v) x <<= 1;
        return x;
    }
}
