package org.foxesworld.ecsave.engine.saveload;

/**
 * Components used by the save/load tests. Registered through {@link TestComponentTypes}.
 */
public final class TestComponents {

    private TestComponents() {}

    public record Position(int x, int y) {}

    public record Target(int ref) implements MapEntities<Target> {
        @Override
        public Target mapEntities(EntityMapper mapper) {
            return new Target(mapper.map(ref));
        }
    }

    /** Optional leader plus a member list, both entity-valued. */
    public record Squad(String name, Integer leader, int[] members) implements MapEntities<Squad> {
        @Override
        public Squad mapEntities(EntityMapper mapper) {
            return new Squad(name, mapper.mapOptional(leader), mapper.mapAll(members));
        }
    }

    /** Holds an entity id but does not implement MapEntities; registered with explicit EntityFields. */
    public static final class Follow {
        public int leader;
        public float distance;

        public Follow() {}

        Follow(int leader, float distance) {
            this.leader = leader;
            this.distance = distance;
        }
    }

    /** No fields at all. */
    public static final class Flag {
        public Flag() {}
    }

    /** Registered but never attached to anything. */
    public record Unused(int value) {}

    /** Never registered. */
    public record Stray(int value) {}
}
