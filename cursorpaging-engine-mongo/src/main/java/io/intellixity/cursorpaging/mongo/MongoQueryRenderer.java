package io.intellixity.cursorpaging.mongo;

import io.intellixity.cursorpaging.query.*;
import org.bson.Document;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders filters ({@link QueryElement}) to MongoDB BSON ({@link Document}),
 * applying De Morgan for NOT groups and rewriting EQ/NE null to missing-or-null semantics.
 *
 * Values pass through unchanged; the driver's codec registry encodes them.
 */
final class MongoQueryRenderer {
  private MongoQueryRenderer() {}

  static Document toBson(QueryElement filter) {
    if (filter == null) return new Document();
    return render(filter, false);
  }

  private static Document render(QueryElement el, boolean negate) {
    if (el == null) return new Document();

    if (el instanceof NotElement n) {
      return render(n.element(), !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (clause == null) clause = Clause.AND;
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;

      List<Document> parts = new ArrayList<>();
      for (QueryElement child : g.elements()) {
        Document d = render(child, negate);
        if (d != null && !d.isEmpty()) parts.add(d);
      }
      if (parts.isEmpty()) return new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document((clause == Clause.OR) ? "$or" : "$and", parts);
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String path = c.property();
    if (path.isBlank()) throw new QueryValidationException("Blank field path in filter");

    boolean not = c.not() ^ negate;
    Operator op = c.operator();

    Document positive = switch (op) {
      case EQ -> new Document(path, c.value());
      case NE -> new Document(path, new Document("$ne", c.value()));
      case GT -> new Document(path, new Document("$gt", requireNonNull(op, c.value())));
      case GE -> new Document(path, new Document("$gte", requireNonNull(op, c.value())));
      case LT -> new Document(path, new Document("$lt", requireNonNull(op, c.value())));
      case LE -> new Document(path, new Document("$lte", requireNonNull(op, c.value())));
      case IN -> new Document(path, new Document("$in", toList(c.value())));
      case NIN -> new Document(path, new Document("$nin", toList(c.value())));
      case RANGE -> new Document(path,
          new Document("$gte", requireNonNull("RANGE.lower", c.lower()))
              .append("$lte", requireNonNull("RANGE.upper", c.upper())));
      case LIKE -> likePositive(path, String.valueOf(requireNonNull(op, c.value())));
    };

    return not ? new Document("$nor", List.of(positive)) : positive;
  }

  private static Object requireNonNull(Object op, Object v) {
    if (v == null) throw new QueryValidationException(op + " requires non-null value");
    return v;
  }

  private static Document likePositive(String path, String likePattern) {
    // '%' -> '.*', '_' -> '.'
    StringBuilder re = new StringBuilder();
    re.append("^");
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append(".");
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    re.append("$");
    return new Document(path, new Document("$regex", re.toString()));
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    return List.of(v);
  }
}
