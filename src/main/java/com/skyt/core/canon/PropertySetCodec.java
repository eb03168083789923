package com.skyt.core.canon;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertySet;
import com.skyt.core.property.PropertyValue;
import com.skyt.core.property.RecordValue;
import com.skyt.core.property.RecursionSchema;
import com.skyt.core.property.SequenceValue;
import com.skyt.core.property.StructureHashPair;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Jackson tree conversion for {@link PropertySet}. The value layout of each
 * kind follows its shape, so the kind key alone is enough to decode it.
 */
final class PropertySetCodec {

    private PropertySetCodec() {}

    // =========================================================================
    // Encoding
    // =========================================================================

    static ObjectNode encode(PropertySet set, ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        for (Map.Entry<PropertyKind, PropertyValue> entry : set.asMap().entrySet()) {
            root.set(entry.getKey().getKey(), encodeValue(entry.getValue(), mapper));
        }
        return root;
    }

    private static JsonNode encodeValue(PropertyValue value, ObjectMapper mapper) {
        return switch (value.getShape()) {
            case RECORD -> {
                ObjectNode node = mapper.createObjectNode();
                for (Map.Entry<String, Object> e : ((RecordValue) value).getEntries().entrySet()) {
                    Object v = e.getValue();
                    if (v instanceof Long)         node.put(e.getKey(), (Long) v);
                    else if (v instanceof Boolean) node.put(e.getKey(), (Boolean) v);
                    else                           node.put(e.getKey(), String.valueOf(v));
                }
                yield node;
            }
            case SEQUENCE -> {
                ArrayNode node = mapper.createArrayNode();
                ((SequenceValue) value).getItems().forEach(node::add);
                yield node;
            }
            case HASH_PAIR -> {
                StructureHashPair pair = (StructureHashPair) value;
                ObjectNode node = mapper.createObjectNode();
                node.put("literal", pair.getLiteralHash());
                node.put("nameInvariant", pair.getNameInvariantHash());
                yield node;
            }
            case RECURSION_SCHEMA -> {
                RecursionSchema schema = (RecursionSchema) value;
                ObjectNode node = mapper.createObjectNode();
                node.put("recursive", schema.isRecursive());
                node.put("branching", schema.getBranching().name());
                node.put("baseCaseCount", schema.getBaseCaseCount());
                node.put("recursiveCallCount", schema.getRecursiveCallCount());
                node.put("divideAndConquer", schema.isDivideAndConquer());
                yield node;
            }
        };
    }

    // =========================================================================
    // Decoding
    // =========================================================================

    /** Decodes a snapshot; an empty object is the null-filled set. */
    static PropertySet decode(JsonNode node) {
        if (node == null || !node.isObject() || node.size() == 0) {
            return PropertySet.nullFilled();
        }
        PropertySet.Builder builder = PropertySet.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            PropertyKind kind = PropertyKind.fromKey(field.getKey());
            builder.put(kind, decodeValue(kind, field.getValue()));
        }
        return builder.build();
    }

    private static PropertyValue decodeValue(PropertyKind kind, JsonNode node) {
        return switch (kind.getShape()) {
            case RECORD -> {
                RecordValue.Builder record = RecordValue.builder();
                Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
                while (entries.hasNext()) {
                    Map.Entry<String, JsonNode> e = entries.next();
                    JsonNode v = e.getValue();
                    if (v.isBoolean())             record.put(e.getKey(), v.booleanValue());
                    else if (v.isIntegralNumber()) record.put(e.getKey(), v.longValue());
                    else                           record.put(e.getKey(), v.asText());
                }
                yield record.build();
            }
            case SEQUENCE -> {
                List<String> items = new ArrayList<>();
                node.forEach(item -> items.add(item.asText()));
                yield SequenceValue.of(items);
            }
            case HASH_PAIR -> new StructureHashPair(
                    node.path("literal").asText(),
                    node.path("nameInvariant").asText());
            case RECURSION_SCHEMA -> new RecursionSchema(
                    node.path("recursive").asBoolean(false),
                    RecursionSchema.Branching.valueOf(node.path("branching").asText("NONE")),
                    node.path("baseCaseCount").asInt(0),
                    node.path("recursiveCallCount").asInt(0),
                    node.path("divideAndConquer").asBoolean(false));
        };
    }
}
