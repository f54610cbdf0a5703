package org.foxesworld.ecsave.engine.ecs.components;

import org.foxesworld.ecsave.engine.saveload.EntityMapper;
import org.foxesworld.ecsave.engine.saveload.MapEntities;

import java.util.Arrays;

/**
 * Scene-graph links. Both fields hold entity ids.
 */
public final class HierarchyComponent implements MapEntities<HierarchyComponent> {

    /** null for roots */
    public Integer parent;
    public int[] children = new int[0];

    public HierarchyComponent() {}

    public HierarchyComponent(Integer parent, int... children) {
        this.parent = parent;
        this.children = children == null ? new int[0] : children;
    }

    @Override
    public HierarchyComponent mapEntities(EntityMapper mapper) {
        return new HierarchyComponent(mapper.mapOptional(parent), mapper.mapAll(children));
    }

    @Override
    public String toString() {
        return "HierarchyComponent{parent=" + parent + ", children=" + Arrays.toString(children) + '}';
    }
}
