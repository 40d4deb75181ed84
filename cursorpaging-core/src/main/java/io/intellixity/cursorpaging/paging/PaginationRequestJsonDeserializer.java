package io.intellixity.cursorpaging.paging;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.cursorpaging.query.QueryElementJson;
import io.intellixity.cursorpaging.query.SortField;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Canonical JSON deserializer for {@link PaginationRequest}; goes through the builder so mode rules apply. */
public final class PaginationRequestJsonDeserializer extends JsonDeserializer<PaginationRequest> {
  @Override
  public PaginationRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("PaginationRequest JSON must be an object");

    PaginationRequest.Builder b = PaginationRequest.builder();

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        fields.add(new SortField(f, d));
      }
      b.sort(SortSpec.of(fields));
    }

    Integer limit = intOrNull(root, "limit");
    if (limit != null) b.limit(limit);
    b.skip(intOrNull(root, "skip"));

    b.cursor(textOrNull(root.get("cursor")));

    String direction = textOrNull(root.get("direction"));
    if (direction != null) b.direction(Direction.valueOf(direction.toUpperCase(Locale.ROOT)));

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) b.filter(QueryElementJson.parse(filter, codec));

    JsonNode total = root.get("totalCount");
    if (total != null && !total.isNull()) b.includeTotalCount(total.asBoolean());

    return b.build();
  }

  private static Integer intOrNull(JsonNode root, String field) {
    JsonNode n = root.get(field);
    if (n == null || n.isNull()) return null;
    if (n.isNumber()) {
      if (!n.isIntegralNumber() || !n.canConvertToInt()) {
        throw new InvalidLimitException(field + " must be a 32-bit integer but was " + n.asText());
      }
      return n.intValue();
    }
    try {
      return Integer.parseInt(n.asText().trim());
    } catch (NumberFormatException e) {
      throw new InvalidLimitException(field + " must be a 32-bit integer but was '" + n.asText() + "'", e);
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
