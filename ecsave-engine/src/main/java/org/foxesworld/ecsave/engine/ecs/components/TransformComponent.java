package org.foxesworld.ecsave.engine.ecs.components;

public final class TransformComponent {
    public float x, y, z;
    public float rotY;

    public TransformComponent() {}

    public TransformComponent(float x, float y, float z) {
        this.x = x; this.y = y; this.z = z;
    }

    public TransformComponent(float x, float y, float z, float rotY) {
        this(x, y, z);
        this.rotY = rotY;
    }
}
