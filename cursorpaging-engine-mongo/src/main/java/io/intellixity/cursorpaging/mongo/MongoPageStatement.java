package io.intellixity.cursorpaging.mongo;

import org.bson.Document;

/** Backend-native statement for one page fetch or count. */
public record MongoPageStatement(
    Kind kind,
    String collection,
    Document filter,
    Document sort,
    Integer skip,
    Integer limit
) {
  public enum Kind {
    FIND,
    COUNT
  }
}
