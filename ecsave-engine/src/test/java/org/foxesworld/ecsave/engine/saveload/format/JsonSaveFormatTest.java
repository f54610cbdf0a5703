package org.foxesworld.ecsave.engine.saveload.format;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.foxesworld.ecsave.engine.saveload.EncodingException;
import org.foxesworld.ecsave.engine.saveload.SaveDocument;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.ComponentRecord;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.TypeBlock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSaveFormatTest {

    private final JsonSaveFormat format = JsonSaveFormat.compact();
    private final JsonNodeFactory f = JsonNodeFactory.instance;

    private SaveDocument decode(String json) throws IOException {
        return format.decode(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void writesTagKeyedPairs() throws IOException {
        SaveDocument doc = SaveDocument.of(List.of(
                new TypeBlock("Component3", List.of(new ComponentRecord(1, f.objectNode().put("target", 0)))),
                new TypeBlock("Component1", List.of(
                        new ComponentRecord(0, f.nullNode()),
                        new ComponentRecord(1, f.nullNode())))));

        String json = new String(format.encode(doc), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("{\"Component3\":[[1,{\"target\":0}]],\"Component1\":[[0,null],[1,null]]}");
    }

    @Test
    void readsBackTheSameStructure() throws IOException {
        SaveDocument doc = decode("{\"B\":[[2,{\"v\":[1,2]}]],\"A\":[]}");

        assertThat(doc.tags()).containsExactly("B", "A");
        assertThat(doc.block("A").orElseThrow().isEmpty()).isTrue();
        ComponentRecord r = doc.block("B").orElseThrow().records().get(0);
        assertThat(r.ordinal()).isEqualTo(2);
        assertThat(r.payload().get("v").get(1).asInt()).isEqualTo(2);
        assertThat(doc.recordCount()).isEqualTo(1);
    }

    @Test
    void emptyObjectIsAnEmptyDocument() throws IOException {
        assertThat(decode("{}")).isEqualTo(SaveDocument.empty());
    }

    @Test
    void prettyOutputStillParses() throws IOException {
        SaveDocument doc = SaveDocument.of(List.of(
                new TypeBlock("P", List.of(new ComponentRecord(0, f.objectNode().put("x", 1))))));

        byte[] pretty = JsonSaveFormat.pretty().encode(doc);

        assertThat(new String(pretty, StandardCharsets.UTF_8)).contains("\n");
        assertThat(format.decode(pretty)).isEqualTo(doc);
    }

    @Test
    void rejectsWrongShapes() {
        assertThatThrownBy(() -> decode("[]")).isInstanceOf(EncodingException.class);
        assertThatThrownBy(() -> decode("{\"A\":{}}")).isInstanceOf(EncodingException.class);
        assertThatThrownBy(() -> decode("{\"A\":[[0]]}")).isInstanceOf(EncodingException.class);
        assertThatThrownBy(() -> decode("{\"A\":[[\"0\",{}]]}")).isInstanceOf(EncodingException.class);
        assertThatThrownBy(() -> decode("{\"A\":[[1.5,{}]]}")).isInstanceOf(EncodingException.class);
    }

    @Test
    void syntaxErrorsSurfaceAsIOException() {
        assertThatThrownBy(() -> decode("{\"A\":")).isInstanceOf(IOException.class);
    }
}
