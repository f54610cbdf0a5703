package org.foxesworld.ecsave.engine.ecs;

import java.util.BitSet;
import java.util.function.IntConsumer;

/**
 * Issues generation-qualified entity ids.
 *
 * <p>An id packs a slot index (low {@value #INDEX_BITS} bits, starting at 1) and the slot's
 * generation (the bits above). Slots are recycled after {@link #destroy(int)}, but the
 * generation is bumped, so an id held past its entity's death never names the entity that
 * reuses the slot. The first entity of every fresh slot has generation 0, hence id == index.
 */
public final class EntityManager {

    public static final int INDEX_BITS = 20;
    public static final int MAX_INDEX = (1 << INDEX_BITS) - 1;
    private static final int GENERATION_MASK = (1 << (31 - INDEX_BITS)) - 1;

    private int nextIndex = 1;
    private final BitSet alive = new BitSet();
    private int[] generation = new int[256];

    // free-list without boxing
    private int[] free = new int[256];
    private int freeSize = 0;

    public static int index(int id) {
        return id & MAX_INDEX;
    }

    public static int generation(int id) {
        return id >>> INDEX_BITS;
    }

    static int compose(int index, int generation) {
        return (generation << INDEX_BITS) | index;
    }

    public int create() {
        final int index;
        if (freeSize > 0) {
            index = free[--freeSize];
        } else {
            if (nextIndex > MAX_INDEX) {
                throw new IllegalStateException("Entity limit reached (" + MAX_INDEX + ")");
            }
            index = nextIndex++;
            ensureGenerationCapacity(index);
        }
        alive.set(index);
        return compose(index, generation[index]);
    }

    public boolean isAlive(int id) {
        if (id <= 0) return false;
        int index = index(id);
        return index > 0 && alive.get(index) && generation[index] == generation(id);
    }

    /** @return true if the entity was alive */
    public boolean destroy(int id) {
        if (!isAlive(id)) return false;

        int index = index(id);
        alive.clear(index);
        generation[index] = (generation[index] + 1) & GENERATION_MASK;

        // push into free-list
        if (freeSize == free.length) {
            int[] n = new int[free.length << 1];
            System.arraycopy(free, 0, n, 0, free.length);
            free = n;
        }
        free[freeSize++] = index;
        return true;
    }

    public int count() {
        return alive.cardinality();
    }

    /** Ascending slot order. */
    public void forEachAlive(IntConsumer fn) {
        for (int i = alive.nextSetBit(1); i >= 0; i = alive.nextSetBit(i + 1)) {
            fn.accept(compose(i, generation[i]));
        }
    }

    /** Full reset, e.g. before a load replaces the world. */
    public void reset() {
        alive.clear();
        nextIndex = 1;
        freeSize = 0;
        generation = new int[256];
    }

    private void ensureGenerationCapacity(int index) {
        if (index < generation.length) return;
        int n = generation.length;
        while (n <= index) n <<= 1;
        int[] grown = new int[n];
        System.arraycopy(generation, 0, grown, 0, generation.length);
        generation = grown;
    }
}
