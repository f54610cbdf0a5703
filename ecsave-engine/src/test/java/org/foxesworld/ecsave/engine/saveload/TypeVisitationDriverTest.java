package org.foxesworld.ecsave.engine.saveload;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.foxesworld.ecsave.engine.ecs.EcsWorld;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.ComponentRecord;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.TypeBlock;
import org.foxesworld.ecsave.engine.saveload.TestComponents.*;
import org.foxesworld.ecsave.engine.saveload.format.ObjectMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeVisitationDriverTest {

    private final MarkerRegistry<?> markers = MarkerRegistry.persistent();
    private ComponentTypeRegistry registry;
    private TypeVisitationDriver driver;
    private EcsWorld world;

    @BeforeEach
    void setUp() {
        registry = new ComponentTypeRegistry(ObjectMappers.standard());
        registry.register(Position.class);
        registry.register(Target.class);
        registry.register(Unused.class);
        driver = new TypeVisitationDriver(registry);
        world = new EcsWorld();
    }

    private int marked() {
        int e = world.createEntity();
        markers.mark(world, e);
        return e;
    }

    @Test
    void oneBlockPerTypeInListOrder() {
        int a = marked();
        world.insertComponent(a, Position.class, new Position(1, 2));

        SaveDocument doc = driver.runSave(List.of(Target.class, Unused.class, Position.class),
                EntityTranslator.begin(markers.collectMarked(world)), world);

        assertThat(doc.tags()).containsExactly("Target", "Unused", "Position");
        assertThat(doc.block("Target").orElseThrow().isEmpty()).isTrue();
        assertThat(doc.block("Unused").orElseThrow().isEmpty()).isTrue();
        assertThat(doc.block("Position").orElseThrow().records()).hasSize(1);
    }

    @Test
    void unmarkedOwnersAreIgnored() {
        int a = marked();
        int loose = world.createEntity();
        world.insertComponent(a, Position.class, new Position(1, 1));
        world.insertComponent(loose, Position.class, new Position(9, 9));

        SaveDocument doc = driver.runSave(List.of(Position.class),
                EntityTranslator.begin(markers.collectMarked(world)), world);

        List<ComponentRecord> records = doc.block("Position").orElseThrow().records();
        assertThat(records).hasSize(1);
        assertThat(records.get(0).ordinal()).isZero();
        assertThat(records.get(0).payload().get("x").asInt()).isEqualTo(1);
    }

    @Test
    void unsupportedTypeFailsBeforeAnyVisit() {
        int a = marked();
        world.insertComponent(a, Target.class, new Target(999));

        // Target would fail with UnknownEntity if it were visited first
        assertThatThrownBy(() -> driver.runSave(List.of(Target.class, Stray.class),
                EntityTranslator.begin(markers.collectMarked(world)), world))
                .isInstanceOf(UnsupportedTypeException.class);
    }

    @Test
    void recordsFollowOrdinalOrder() {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            int e = marked();
            ids.add(e);
            world.insertComponent(e, Position.class, new Position(i, -i));
        }

        SaveDocument doc = driver.runSave(List.of(Position.class),
                EntityTranslator.begin(List.of(ids.get(3), ids.get(1), ids.get(0), ids.get(2))), world);

        assertThat(doc.block("Position").orElseThrow().records())
                .extracting(ComponentRecord::ordinal)
                .containsExactly(0, 1, 2, 3);
        assertThat(doc.block("Position").orElseThrow().records())
                .extracting(r -> r.payload().get("x").asInt())
                .containsExactly(3, 1, 0, 2);
    }

    @Test
    void translatorDirectionIsChecked() {
        EntityTranslator load = EntityTranslator.discovering(world, markers);
        EntityTranslator save = EntityTranslator.begin(List.of());

        assertThatThrownBy(() -> driver.runSave(List.of(Position.class), load, world))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> driver.runLoad(List.of(Position.class), SaveDocument.empty(), save, world))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loadingEmptyOrMissingBlocksIsANoOp() {
        SaveDocument doc = SaveDocument.of(List.of(new TypeBlock("Position", List.of())));

        int inserted = driver.runLoad(List.of(Position.class, Target.class), doc,
                EntityTranslator.discovering(world, markers), world);

        assertThat(inserted).isZero();
        assertThat(world.entities().count()).isZero();
    }

    @Test
    void blocksOutsideTheTypeListAreSkipped() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        SaveDocument doc = SaveDocument.of(List.of(
                new TypeBlock("Position", List.of(new ComponentRecord(0, f.objectNode().put("x", 4).put("y", 5)))),
                new TypeBlock("Target", List.of(new ComponentRecord(0, f.objectNode().put("ref", 0))))));

        int inserted = driver.runLoad(List.of(Position.class), doc,
                EntityTranslator.discovering(world, markers), world);

        assertThat(inserted).isEqualTo(1);
        assertThat(world.components().view(Target.class)).isEmpty();
        assertThat(world.components().view(Position.class).values()).containsExactly(new Position(4, 5));
    }

    @Test
    void undecodablePayloadIsAnEncodingError() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        SaveDocument doc = SaveDocument.of(List.of(
                new TypeBlock("Position", List.of(new ComponentRecord(0, f.objectNode().put("x", "not a number"))))));

        assertThatThrownBy(() -> driver.runLoad(List.of(Position.class), doc,
                EntityTranslator.discovering(world, markers), world))
                .isInstanceOf(EncodingException.class)
                .hasCauseInstanceOf(com.fasterxml.jackson.core.JsonProcessingException.class);
    }

    @Test
    void repeatedOrdinalFailsBeforeAnythingIsInserted() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        SaveDocument doc = SaveDocument.of(List.of(new TypeBlock("Position", List.of(
                new ComponentRecord(0, f.objectNode().put("x", 1).put("y", 1)),
                new ComponentRecord(1, f.objectNode().put("x", 3).put("y", 3)),
                new ComponentRecord(0, f.objectNode().put("x", 2).put("y", 2))))));

        assertThatThrownBy(() -> driver.runLoad(List.of(Position.class), doc,
                EntityTranslator.discovering(world, markers), world))
                .isInstanceOf(EncodingException.class);
        assertThat(world.entities().count()).isZero();
    }
}
