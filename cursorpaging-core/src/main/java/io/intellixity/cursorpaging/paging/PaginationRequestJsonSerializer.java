package io.intellixity.cursorpaging.paging;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.cursorpaging.query.QueryElementJson;
import io.intellixity.cursorpaging.query.SortField;

import java.io.IOException;

/** Canonical JSON serializer for {@link PaginationRequest}. */
public final class PaginationRequestJsonSerializer extends JsonSerializer<PaginationRequest> {
  @Override
  public void serialize(PaginationRequest r, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (r == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    g.writeArrayFieldStart("sort");
    for (SortField sf : r.sortSpec().fields()) {
      g.writeStartObject();
      g.writeStringField("field", sf.field());
      g.writeStringField("dir", sf.direction().name());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeNumberField("limit", r.limit());

    PagingMode mode = r.mode();
    if (mode instanceof PagingMode.Offset o) {
      g.writeNumberField("skip", o.skip());
    } else if (mode instanceof PagingMode.Cursor c) {
      g.writeStringField("cursor", c.token().value());
      g.writeStringField("direction", c.direction().name());
    }

    if (r.filter() != null) {
      g.writeFieldName("filter");
      QueryElementJson.write(r.filter(), g, serializers);
    }

    g.writeBooleanField("totalCount", r.includeTotalCount());
    g.writeEndObject();
  }
}
