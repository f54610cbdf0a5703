package org.foxesworld.ecsave.engine.saveload;

import org.foxesworld.ecsave.engine.ecs.EcsWorld;
import org.foxesworld.ecsave.engine.ecs.components.PersistentComponent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class EntityTranslatorTest {

    @Test
    void beginAssignsOrdinalsInListOrder() {
        EntityTranslator t = EntityTranslator.begin(List.of(7, 3, 12));

        assertThat(t.toOrdinal(7)).isZero();
        assertThat(t.toOrdinal(3)).isEqualTo(1);
        assertThat(t.toOrdinal(12)).isEqualTo(2);
        assertThat(t.toLive(1)).isEqualTo(3);
        assertThat(t.entities()).containsExactly(7, 3, 12);
        assertThat(t.isLoading()).isFalse();
    }

    @Test
    void duplicateEntityFailsFast() {
        assertThatThrownBy(() -> EntityTranslator.begin(List.of(1, 2, 1)))
                .isInstanceOf(DuplicateEntityException.class)
                .satisfies(e -> assertThat(((DuplicateEntityException) e).entity()).isEqualTo(1));
    }

    @Test
    void unknownEntityOnSave() {
        EntityTranslator t = EntityTranslator.begin(List.of(1));

        assertThatThrownBy(() -> t.toOrdinal(5))
                .isInstanceOf(UnknownEntityException.class)
                .satisfies(e -> assertThat(((UnknownEntityException) e).id()).isEqualTo(5));
        assertThatThrownBy(() -> t.toLive(1)).isInstanceOf(UnknownEntityException.class);
    }

    @Test
    void loadSideCreatesOnFirstSightAndReusesAfter() {
        EcsWorld world = new EcsWorld();
        EntityTranslator t = EntityTranslator.discovering(world, MarkerRegistry.persistent());

        int a = t.toLive(4);
        int b = t.toLive(0);
        int again = t.toLive(4);

        assertThat(again).isEqualTo(a);
        assertThat(b).isNotEqualTo(a);
        assertThat(world.entities().count()).isEqualTo(2);
        assertThat(t.toOrdinal(a)).isEqualTo(4);
        assertThat(t.ordinals()).containsExactly(
                entry(0, b),
                entry(4, a));
    }

    @Test
    void allocatedEntitiesAreMarked() {
        EcsWorld world = new EcsWorld();
        EntityTranslator t = EntityTranslator.discovering(world, MarkerRegistry.persistent());

        int e = t.toLive(0);

        assertThat(world.hasComponent(e, PersistentComponent.class)).isTrue();
    }

    @Test
    void negativeOrdinalIsUnknown() {
        EntityTranslator t = EntityTranslator.discovering(new EcsWorld(), MarkerRegistry.persistent());

        assertThatThrownBy(() -> t.toLive(-1)).isInstanceOf(UnknownEntityException.class);
    }

    @Test
    void closedTranslatorRejectsCalls() {
        EntityTranslator t = EntityTranslator.begin(List.of(1));
        t.close();

        assertThat(t.isClosed()).isTrue();
        assertThatThrownBy(() -> t.toOrdinal(1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> t.toLive(0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void mappersDelegate() {
        EntityTranslator t = EntityTranslator.begin(List.of(10, 20));

        assertThat(t.toWireMapper().mapAll(new int[]{20, 10})).containsExactly(1, 0);
        assertThat(t.toWireMapper().mapOptional(null)).isNull();
        assertThat(t.toLiveMapper().map(1)).isEqualTo(20);
    }
}
