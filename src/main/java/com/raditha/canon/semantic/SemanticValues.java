package com.raditha.canon.semantic;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds semantic nodes from plain Java values.
 */
public final class SemanticValues {

    private SemanticValues() {
    }

    /**
     * Build a node tree with fresh ids in the given lineage.
     */
    public static SemanticNode of(String lineage, Object value) {
        return build(value, ignored -> NodeId.fresh(lineage), NodeId.fresh(lineage));
    }

    /**
     * Build a node tree with ids derived from {@code id} and the path below it, so that the same
     * value always gets the same ids.
     */
    public static SemanticNode deterministic(NodeId id, Object value) {
        return build(value, null, id);
    }

    private static SemanticNode build(Object value, Function<Object, NodeId> ids, NodeId id) {
        if (value instanceof SemanticNode node) {
            if (node.kind() == SemanticKind.MAPPING) {
                return build(node.entries(), ids, id);
            }
            if (node.kind() == SemanticKind.SEQUENCE) {
                return build(node.items(), ids, id);
            }
            return node.withId(id);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, SemanticNode> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                String key = String.valueOf(e.getKey());
                NodeId childId = ids == null ? id.child(key) : ids.apply(key);
                entries.put(key, build(e.getValue(), ids, childId));
            }
            return SemanticNode.mapping(id, entries);
        }
        if (value instanceof List<?> list) {
            List<SemanticNode> items = new ArrayList<>();
            for (int i = 0; i < list.size(); i++) {
                NodeId childId = ids == null ? id.child(String.valueOf(i)) : ids.apply(i);
                items.add(build(list.get(i), ids, childId));
            }
            return SemanticNode.sequence(id, items);
        }
        return scalar(id, value);
    }

    public static SemanticNode scalar(NodeId id, Object value) {
        if (value == null) {
            return SemanticNode.scalar(id, SemanticKind.NULL, null);
        }
        if (value instanceof Boolean b) {
            return SemanticNode.scalar(id, SemanticKind.BOOL, b);
        }
        if (value instanceof BigInteger i) {
            return SemanticNode.scalar(id, SemanticKind.INT, i);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return SemanticNode.scalar(id, SemanticKind.INT, BigInteger.valueOf(((Number) value).longValue()));
        }
        if (value instanceof BigDecimal d) {
            return SemanticNode.scalar(id, SemanticKind.FLOAT, d);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite floats are not supported: " + d);
            }
            return SemanticNode.scalar(id, SemanticKind.FLOAT, new BigDecimal(String.valueOf(d)));
        }
        if (value instanceof Instant instant) {
            return SemanticNode.scalar(id, SemanticKind.TIMESTAMP, instant);
        }
        if (value instanceof OffsetDateTime odt) {
            return SemanticNode.scalar(id, SemanticKind.TIMESTAMP, odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return SemanticNode.scalar(id, SemanticKind.TIMESTAMP, zdt.toInstant());
        }
        if (value instanceof LocalDateTime ldt) {
            return SemanticNode.scalar(id, SemanticKind.TIMESTAMP, ldt.toInstant(ZoneOffset.UTC));
        }
        if (value instanceof LocalDate date) {
            return SemanticNode.scalar(id, SemanticKind.TIMESTAMP, date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof Enum<?>) {
            return SemanticNode.scalar(id, SemanticKind.STRING, value.toString());
        }
        throw new IllegalArgumentException("Unsupported value type " + value.getClass().getName());
    }
}
