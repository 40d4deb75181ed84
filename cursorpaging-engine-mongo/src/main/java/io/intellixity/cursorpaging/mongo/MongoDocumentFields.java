package io.intellixity.cursorpaging.mongo;

import io.intellixity.cursorpaging.exec.FieldReader;
import org.bson.Document;

import java.util.Map;

/** Reads sort key values from documents; dotted paths walk into embedded documents. */
public final class MongoDocumentFields implements FieldReader<Document> {
  public static final MongoDocumentFields INSTANCE = new MongoDocumentFields();

  private MongoDocumentFields() {}

  @Override
  public Object read(Document row, String field) {
    if (row == null || field == null || field.isBlank()) return null;
    if (row.containsKey(field)) return row.get(field);

    Object cur = row;
    for (String p : field.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }
}
