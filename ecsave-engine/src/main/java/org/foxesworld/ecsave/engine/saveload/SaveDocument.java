package org.foxesworld.ecsave.engine.saveload;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Format-independent save: type blocks in type-list order, each holding
 * {@code (ordinal, payload)} records in ordinal order.
 */
public final class SaveDocument {

    public record ComponentRecord(int ordinal, JsonNode payload) {
        public ComponentRecord {
            Objects.requireNonNull(payload, "payload");
        }
    }

    public record TypeBlock(String tag, List<ComponentRecord> records) {
        public TypeBlock {
            Objects.requireNonNull(tag, "tag");
            records = List.copyOf(records);
        }

        public boolean isEmpty() {
            return records.isEmpty();
        }
    }

    private final Map<String, TypeBlock> blocks;

    private SaveDocument(Map<String, TypeBlock> blocks) {
        this.blocks = blocks;
    }

    /** @throws IllegalArgumentException on a repeated tag */
    public static SaveDocument of(List<TypeBlock> blocks) {
        Map<String, TypeBlock> map = new LinkedHashMap<>();
        for (TypeBlock b : blocks) {
            if (map.putIfAbsent(b.tag(), b) != null) {
                throw new IllegalArgumentException("Duplicate type block: " + b.tag());
            }
        }
        return new SaveDocument(Collections.unmodifiableMap(map));
    }

    public static SaveDocument empty() {
        return new SaveDocument(Map.of());
    }

    public Optional<TypeBlock> block(String tag) {
        return Optional.ofNullable(blocks.get(tag));
    }

    public Collection<TypeBlock> blocks() {
        return blocks.values();
    }

    public Set<String> tags() {
        return blocks.keySet();
    }

    public int recordCount() {
        int n = 0;
        for (TypeBlock b : blocks.values()) n += b.records().size();
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SaveDocument other)) return false;
        // block order is part of the document
        return new ArrayList<>(blocks.values()).equals(new ArrayList<>(other.blocks.values()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(blocks.values()).hashCode();
    }

    @Override
    public String toString() {
        return "SaveDocument" + blocks.values();
    }
}
