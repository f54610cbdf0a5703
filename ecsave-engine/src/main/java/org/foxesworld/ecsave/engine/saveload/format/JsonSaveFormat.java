package org.foxesworld.ecsave.engine.saveload.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.foxesworld.ecsave.core.io.ByteCodec;
import org.foxesworld.ecsave.engine.saveload.EncodingException;
import org.foxesworld.ecsave.engine.saveload.SaveDocument;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.ComponentRecord;
import org.foxesworld.ecsave.engine.saveload.SaveDocument.TypeBlock;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Save document as one JSON object:
 * <pre>
 * {"Position":[[0,{"x":1.0,"y":2.0}]],"Target":[[1,{"ref":0}]]}
 * </pre>
 * Keys are type tags in type-list order, values are {@code [ordinal, payload]} pairs.
 * Any Jackson mapper can back it, so binary dataformats plug in the same way.
 */
public final class JsonSaveFormat extends ByteCodec<SaveDocument> {

    private final ObjectMapper mapper;

    public JsonSaveFormat(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static JsonSaveFormat compact() {
        return new JsonSaveFormat(ObjectMappers.standard());
    }

    public static JsonSaveFormat pretty() {
        return new JsonSaveFormat(ObjectMappers.standard().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    @Override
    protected byte[] encodeBytes(SaveDocument document) throws IOException {
        return mapper.writeValueAsBytes(toTree(document));
    }

    @Override
    protected SaveDocument decodeBytes(byte[] data) throws IOException {
        return fromTree(mapper.readTree(data));
    }

    public ObjectNode toTree(SaveDocument document) {
        ObjectNode root = mapper.createObjectNode();
        for (TypeBlock block : document.blocks()) {
            ArrayNode records = root.putArray(block.tag());
            for (ComponentRecord r : block.records()) {
                records.addArray().add(r.ordinal()).add(r.payload());
            }
        }
        return root;
    }

    public SaveDocument fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new EncodingException("Save root must be a JSON object, got "
                    + (root == null ? "nothing" : root.getNodeType()));
        }
        List<TypeBlock> blocks = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            blocks.add(readBlock(f.getKey(), f.getValue()));
        }
        return SaveDocument.of(blocks);
    }

    private static TypeBlock readBlock(String tag, JsonNode node) {
        if (!node.isArray()) {
            throw new EncodingException("Block '" + tag + "' must be an array");
        }
        List<ComponentRecord> records = new ArrayList<>(node.size());
        for (JsonNode pair : node) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new EncodingException("Block '" + tag + "' holds a record that is not an [ordinal, payload] pair: " + pair);
            }
            JsonNode ordinal = pair.get(0);
            if (!ordinal.isIntegralNumber() || !ordinal.canConvertToInt()) {
                throw new EncodingException("Block '" + tag + "' has a non-integer ordinal: " + ordinal);
            }
            records.add(new ComponentRecord(ordinal.intValue(), pair.get(1)));
        }
        return new TypeBlock(tag, records);
    }
}
