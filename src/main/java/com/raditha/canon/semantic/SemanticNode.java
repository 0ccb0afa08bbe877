package com.raditha.canon.semantic;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One value of the canonical semantic tree. Immutable.
 * <p>
 * Scalar values are held as {@code null}, {@link Boolean}, {@link BigInteger}, {@link BigDecimal},
 * {@link String} or {@link Instant}; opaque values hold their source text. Mapping entries keep
 * document order, which is insignificant for equality.
 * <p>
 * {@link #equals(Object)} is semantic equality: ids and the synthetic flag are ignored, floats
 * compare by numeric value, and an INT never equals a FLOAT.
 */
public final class SemanticNode {

    private final NodeId id;
    private final SemanticKind kind;
    private final Object value;
    private final List<SemanticNode> items;
    private final Map<String, SemanticNode> entries;
    private final boolean synthetic;

    private SemanticNode(NodeId id, SemanticKind kind, Object value, List<SemanticNode> items,
                         Map<String, SemanticNode> entries, boolean synthetic) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value;
        this.items = items;
        this.entries = entries;
        this.synthetic = synthetic;
    }

    public static SemanticNode scalar(NodeId id, SemanticKind kind, Object value) {
        if (kind.isContainer()) {
            throw new IllegalArgumentException(kind + " is not a scalar kind");
        }
        checkValue(kind, value);
        return new SemanticNode(id, kind, value, List.of(), Map.of(), false);
    }

    public static SemanticNode sequence(NodeId id, List<SemanticNode> items) {
        return new SemanticNode(id, SemanticKind.SEQUENCE, null, List.copyOf(items), Map.of(), false);
    }

    public static SemanticNode mapping(NodeId id, Map<String, SemanticNode> entries) {
        return new SemanticNode(id, SemanticKind.MAPPING, null, List.of(),
                Collections.unmodifiableMap(new LinkedHashMap<>(entries)), false);
    }

    private static void checkValue(SemanticKind kind, Object value) {
        boolean ok = switch (kind) {
            case NULL -> value == null;
            case BOOL -> value instanceof Boolean;
            case INT -> value instanceof BigInteger;
            case FLOAT -> value instanceof BigDecimal;
            case STRING, OPAQUE -> value instanceof String;
            case TIMESTAMP -> value instanceof Instant;
            case SEQUENCE, MAPPING -> false;
        };
        if (!ok) {
            throw new IllegalArgumentException("Value " + value + " does not fit kind " + kind);
        }
    }

    public NodeId id() {
        return id;
    }

    public SemanticKind kind() {
        return kind;
    }

    public Object value() {
        return value;
    }

    public List<SemanticNode> items() {
        return items;
    }

    public Map<String, SemanticNode> entries() {
        return entries;
    }

    /**
     * Whether the node was materialized from a default value rather than read from the source.
     */
    public boolean isSynthetic() {
        return synthetic;
    }

    public boolean isContainer() {
        return kind.isContainer();
    }

    /**
     * Children in order: sequence items, or mapping values in entry order.
     */
    public List<SemanticNode> children() {
        if (kind == SemanticKind.MAPPING) {
            return new ArrayList<>(entries.values());
        }
        return items;
    }

    public SemanticNode withId(NodeId newId) {
        return new SemanticNode(newId, kind, value, items, entries, synthetic);
    }

    public SemanticNode withItems(List<SemanticNode> newItems) {
        if (kind != SemanticKind.SEQUENCE) {
            throw new IllegalStateException("Not a sequence: " + this);
        }
        return new SemanticNode(id, kind, null, List.copyOf(newItems), Map.of(), synthetic);
    }

    public SemanticNode withEntries(Map<String, SemanticNode> newEntries) {
        if (kind != SemanticKind.MAPPING) {
            throw new IllegalStateException("Not a mapping: " + this);
        }
        return new SemanticNode(id, kind, null, List.of(),
                Collections.unmodifiableMap(new LinkedHashMap<>(newEntries)), synthetic);
    }

    /**
     * Marks this node, and every node below it, as synthetic or not.
     */
    public SemanticNode asSynthetic(boolean flag) {
        List<SemanticNode> newItems = new ArrayList<>();
        for (SemanticNode item : items) {
            newItems.add(item.asSynthetic(flag));
        }
        Map<String, SemanticNode> newEntries = new LinkedHashMap<>();
        entries.forEach((k, v) -> newEntries.put(k, v.asSynthetic(flag)));
        return new SemanticNode(id, kind, value, List.copyOf(newItems),
                Collections.unmodifiableMap(newEntries), flag);
    }

    /**
     * Plain Java view: {@code Map}, {@code List}, or the scalar value.
     */
    public Object toPlain() {
        return switch (kind) {
            case SEQUENCE -> {
                List<Object> list = new ArrayList<>();
                items.forEach(i -> list.add(i.toPlain()));
                yield list;
            }
            case MAPPING -> {
                Map<String, Object> map = new LinkedHashMap<>();
                entries.forEach((k, v) -> map.put(k, v.toPlain()));
                yield map;
            }
            default -> value;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SemanticNode other) || kind != other.kind) {
            return false;
        }
        return switch (kind) {
            case NULL -> true;
            case FLOAT -> ((BigDecimal) value).compareTo((BigDecimal) other.value) == 0;
            case SEQUENCE -> items.equals(other.items);
            case MAPPING -> entries.equals(other.entries);
            default -> value.equals(other.value);
        };
    }

    @Override
    public int hashCode() {
        return switch (kind) {
            case NULL -> 0;
            case FLOAT -> 31 * kind.ordinal() + ((BigDecimal) value).stripTrailingZeros().hashCode();
            case SEQUENCE -> 31 * kind.ordinal() + items.hashCode();
            case MAPPING -> 31 * kind.ordinal() + entries.hashCode();
            default -> 31 * kind.ordinal() + value.hashCode();
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SEQUENCE -> "SEQUENCE#" + id + items;
            case MAPPING -> "MAPPING#" + id + entries;
            default -> kind + "#" + id + "(" + value + ")";
        };
    }
}
