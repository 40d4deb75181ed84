package io.intellixity.cursorpaging.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON form of a filter tree:\n
 *
 * <pre>
 * { "and": [ ... ] }  { "or": [ ... ] }  { "not": &lt;element&gt; }
 * { "eq": { "field": "status", "value": "OPEN", "not": false } }
 * { "in": { "field": "status", "values": [ ... ] } }
 * { "range": { "field": "score", "lower": 1, "upper": 5 } }
 * </pre>
 */
public final class QueryElementJson {
  private QueryElementJson() {}

  public static void write(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (QueryElement child : lg.elements()) {
        write(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      write(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      String opKey = c.operator().name().toLowerCase(Locale.ROOT);
      g.writeStartObject();
      g.writeObjectFieldStart(opKey);
      g.writeStringField("field", c.property());
      if (c.not()) g.writeBooleanField("not", true);
      if (c.operator() == Operator.RANGE) {
        g.writeFieldName("lower");
        serializers.defaultSerializeValue(c.lower(), g);
        g.writeFieldName("upper");
        serializers.defaultSerializeValue(c.upper(), g);
      } else if (c.operator() == Operator.IN || c.operator() == Operator.NIN) {
        g.writeFieldName("values");
        serializers.defaultSerializeValue(c.value(), g);
      } else {
        g.writeFieldName("value");
        serializers.defaultSerializeValue(c.value(), g);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported QueryElement: " + el.getClass().getName());
  }

  public static QueryElement parse(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new IllegalArgumentException("Filter element must be an object: " + n);

    if (n.has("and")) return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    if (n.has("or")) return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));

    if (n.has("not")) {
      QueryElement child = parse(n.get("not"), codec);
      if (child == null) return null;
      return new NotElement(child);
    }

    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      Operator op = tryOp(k);
      if (op == null) continue;
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
      return parseCondition(op, body, codec);
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parse(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static QueryElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    JsonNode f = body.get("field");
    if (f == null || f.isNull()) throw new IllegalArgumentException(op + " requires field");
    String field = f.asText();
    JsonNode notNode = body.get("not");
    boolean not = notNode != null && (notNode.isBoolean() ? notNode.booleanValue() : Boolean.parseBoolean(notNode.asText()));

    if (op == Operator.RANGE) {
      return new Condition(field, op, null, value(body.get("lower"), codec), value(body.get("upper"), codec), not);
    }
    if (op == Operator.IN || op == Operator.NIN) {
      return new Condition(field, op, value(body.get("values"), codec), null, null, not);
    }
    return new Condition(field, op, value(body.get("value"), codec), null, null, not);
  }

  private static Object value(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static Operator tryOp(String key) {
    if (key == null) return null;
    for (Operator op : Operator.values()) {
      if (op.name().equalsIgnoreCase(key)) return op;
    }
    return null;
  }
}
