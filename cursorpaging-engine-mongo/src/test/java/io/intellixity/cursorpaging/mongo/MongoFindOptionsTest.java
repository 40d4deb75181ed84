package io.intellixity.cursorpaging.mongo;

import com.mongodb.client.model.Collation;
import com.mongodb.client.model.CountOptions;
import org.bson.BsonString;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class MongoFindOptionsTest {

  @Test
  void countOptionsCarryEveryFindOption() {
    Collation collation = Collation.builder().locale("en").build();
    MongoFindOptions options = MongoFindOptions.NONE
        .withCollation(collation)
        .withHint(new Document("score", -1).append("_id", 1))
        .withMaxTime(Duration.ofMillis(1500))
        .withComment("orders-page");

    CountOptions count = options.toCountOptions();
    assertEquals(collation, count.getCollation());
    assertEquals(new Document("score", -1).append("_id", 1), count.getHint());
    assertEquals(1500L, count.getMaxTime(TimeUnit.MILLISECONDS));
    assertEquals(new BsonString("orders-page"), count.getComment());
    assertEquals("collation,hint,maxTime,comment", options.describe());
  }

  @Test
  void noneLeavesTheDriverDefaults() {
    CountOptions count = MongoFindOptions.NONE.toCountOptions();

    assertNull(count.getCollation());
    assertNull(count.getHint());
    assertEquals(0L, count.getMaxTime(TimeUnit.MILLISECONDS));
    assertNull(count.getComment());
    assertEquals("none", MongoFindOptions.NONE.describe());
  }

  @Test
  void maxTimeMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> MongoFindOptions.NONE.withMaxTime(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> MongoFindOptions.NONE.withMaxTime(Duration.ofSeconds(-1)));
    assertEquals("maxTime", MongoFindOptions.NONE.withMaxTime(Duration.ofSeconds(1)).describe());
  }
}
