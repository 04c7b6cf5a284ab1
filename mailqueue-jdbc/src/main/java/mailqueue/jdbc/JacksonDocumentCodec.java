package mailqueue.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import mailqueue.spi.DocumentStoreException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts document data to and from the JSON stored in the {@code data} column.
 *
 * <p>{@link Instant} values are written as {@code {"$timestamp": "<ISO-8601>"}} and read back
 * as {@code Instant}. Integral numbers decode as {@code Long} (or {@code BigInteger} when
 * they do not fit), other numbers as {@code Double}.
 */
public final class JacksonDocumentCodec {
  static final String TIMESTAMP_KEY = "$timestamp";

  private final ObjectMapper mapper;
  private final JsonNodeFactory nodes;

  public JacksonDocumentCodec() {
    this(new ObjectMapper());
  }

  public JacksonDocumentCodec(ObjectMapper mapper) {
    this.mapper = mapper;
    this.nodes = mapper.getNodeFactory();
  }

  public String encode(Map<String, Object> data) {
    try {
      return mapper.writeValueAsString(toNode(data));
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Failed to encode document", e);
    }
  }

  public Map<String, Object> decode(String json) {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException("Failed to decode document", e);
    }
    if (root == null || !root.isObject()) {
      throw new DocumentStoreException("Document data is not a JSON object");
    }
    return toMap(root);
  }

  private JsonNode toNode(Object value) {
    if (value == null) {
      return nodes.nullNode();
    }
    if (value instanceof String s) {
      return nodes.textNode(s);
    }
    if (value instanceof Boolean b) {
      return nodes.booleanNode(b);
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return nodes.numberNode(((Number) value).longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      return nodes.numberNode(((Number) value).doubleValue());
    }
    if (value instanceof BigInteger n) {
      return nodes.numberNode(n);
    }
    if (value instanceof BigDecimal n) {
      return nodes.numberNode(n);
    }
    if (value instanceof Instant instant) {
      ObjectNode node = nodes.objectNode();
      node.put(TIMESTAMP_KEY, instant.toString());
      return node;
    }
    if (value instanceof Map<?, ?> map) {
      ObjectNode node = nodes.objectNode();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        node.set(String.valueOf(entry.getKey()), toNode(entry.getValue()));
      }
      return node;
    }
    if (value instanceof List<?> list) {
      ArrayNode node = nodes.arrayNode(list.size());
      for (Object item : list) {
        node.add(toNode(item));
      }
      return node;
    }
    throw new DocumentStoreException("Unsupported document value type: " + value.getClass().getName());
  }

  private Object fromNode(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isTextual()) {
      return node.textValue();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isIntegralNumber()) {
      return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isArray()) {
      List<Object> list = new ArrayList<>(node.size());
      for (JsonNode item : node) {
        list.add(fromNode(item));
      }
      return list;
    }
    if (node.isObject()) {
      if (node.size() == 1 && node.get(TIMESTAMP_KEY) != null && node.get(TIMESTAMP_KEY).isTextual()) {
        try {
          return Instant.parse(node.get(TIMESTAMP_KEY).textValue());
        } catch (DateTimeParseException e) {
          throw new DocumentStoreException("Invalid timestamp: " + node.get(TIMESTAMP_KEY).textValue(), e);
        }
      }
      return toMap(node);
    }
    throw new DocumentStoreException("Unsupported JSON node: " + node.getNodeType());
  }

  private Map<String, Object> toMap(JsonNode node) {
    Map<String, Object> map = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      map.put(field.getKey(), fromNode(field.getValue()));
    }
    return map;
  }
}
