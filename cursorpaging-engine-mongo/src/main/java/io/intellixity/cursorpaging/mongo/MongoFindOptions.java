package io.intellixity.cursorpaging.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.model.Collation;
import com.mongodb.client.model.CountOptions;
import org.bson.Document;
import org.bson.conversions.Bson;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Driver options applied to both the page find and the total count. Null fields are left to the server.
 *
 * The collation must be the one the sort fields compare under; cursors taken under one collation
 * seek wrongly under another.
 */
public record MongoFindOptions(Collation collation, Bson hint, Duration maxTime, String comment) {
  public static final MongoFindOptions NONE = new MongoFindOptions(null, null, null, null);

  public MongoFindOptions {
    if (maxTime != null && (maxTime.isNegative() || maxTime.isZero())) {
      throw new IllegalArgumentException("maxTime must be positive: " + maxTime);
    }
  }

  public MongoFindOptions withCollation(Collation c) { return new MongoFindOptions(c, hint, maxTime, comment); }
  public MongoFindOptions withHint(Bson h) { return new MongoFindOptions(collation, h, maxTime, comment); }
  public MongoFindOptions withMaxTime(Duration d) { return new MongoFindOptions(collation, hint, d, comment); }
  public MongoFindOptions withComment(String c) { return new MongoFindOptions(collation, hint, maxTime, c); }

  FindIterable<Document> applyTo(FindIterable<Document> find) {
    if (collation != null) find = find.collation(collation);
    if (hint != null) find = find.hint(hint);
    if (maxTime != null) find = find.maxTime(maxTime.toMillis(), TimeUnit.MILLISECONDS);
    if (comment != null) find = find.comment(comment);
    return find;
  }

  CountOptions toCountOptions() {
    CountOptions o = new CountOptions();
    if (collation != null) o.collation(collation);
    if (hint != null) o.hint(hint);
    if (maxTime != null) o.maxTime(maxTime.toMillis(), TimeUnit.MILLISECONDS);
    if (comment != null) o.comment(comment);
    return o;
  }

  /** Which options are set, for logging. */
  String describe() {
    if (this.equals(NONE)) return "none";
    StringBuilder sb = new StringBuilder();
    if (collation != null) sb.append("collation,");
    if (hint != null) sb.append("hint,");
    if (maxTime != null) sb.append("maxTime,");
    if (comment != null) sb.append("comment,");
    return sb.substring(0, sb.length() - 1);
  }
}
