package org.foxesworld.ecsave.engine.ecs.components;

/**
 * Marker: entities carrying it are written by a save.
 * Restored entities get it back on load.
 */
public final class PersistentComponent {

    public static final PersistentComponent INSTANCE = new PersistentComponent();

    public PersistentComponent() {}
}
