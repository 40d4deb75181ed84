package io.intellixity.cursorpaging.exec;

import io.intellixity.cursorpaging.cursor.BsonCursorCodec;
import io.intellixity.cursorpaging.paging.*;
import io.intellixity.cursorpaging.query.QueryElement;
import io.intellixity.cursorpaging.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.intellixity.cursorpaging.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryTranslatorTest {
  private static final SortSpec SCORE_ID = SortSpec.of(SortField.desc("score"), SortField.asc("_id"));

  private final BsonCursorCodec codec = new BsonCursorCodec();
  private final QueryTranslator translator = new QueryTranslator(codec);

  private CursorToken cursor(Object score, Object id) {
    return codec.encode(new SortKeyTuple(List.of("score", "_id"), List.of(score, id)));
  }

  @Test
  void firstPage_keepsBaseFilterAndSort_fetchesOneExtra() {
    QueryElement base = eq("status", "OPEN");
    PageQuery q = translator.translate(PaginationRequest.builder().sort(SCORE_ID).filter(base).limit(10).build());

    assertEquals(base, q.filter());
    assertEquals(SCORE_ID.fields(), q.sort());
    assertEquals(11, q.limit());
    assertNull(q.skip());
  }

  @Test
  void offsetMode_ignoresCursor() {
    PaginationRequest r = PaginationRequest.builder()
        .sort(SCORE_ID).skip(2).cursor(cursor(5, 1)).limit(3).build();
    PageQuery q = translator.translate(r);

    assertNull(q.filter());
    assertEquals(SCORE_ID.fields(), q.sort());
    assertEquals(2, q.skip());
    assertEquals(4, q.limit());
  }

  @Test
  void nextCursor_buildsLexicographicSeekPredicate() {
    QueryElement base = eq("status", "OPEN");
    PaginationRequest r = PaginationRequest.builder()
        .sort(SCORE_ID).cursor(cursor(5, 1)).filter(base).limit(2).build();
    PageQuery q = translator.translate(r);

    QueryElement expected = and(base, or(lt("score", 5), eq("score", null), and(eq("score", 5), gt("_id", 1))));
    assertEquals(expected, q.filter());
    assertEquals(SCORE_ID.fields(), q.sort());
    assertEquals(3, q.limit());
    assertNull(q.skip());
  }

  @Test
  void previousCursor_invertsOperatorsAndReversesSort() {
    PageQuery q = translator.translate(PaginationRequest.before(SCORE_ID, cursor(5, 1), 2));

    assertEquals(or(gt("score", 5), and(eq("score", 5), or(lt("_id", 1), eq("_id", null)))), q.filter());
    assertEquals(List.of(SortField.asc("score"), SortField.desc("_id")), q.sort());
  }

  @Test
  void threeFields_chainEqualitiesBeforeEachComparison() {
    SortSpec spec = SortSpec.of(SortField.asc("a"), SortField.asc("b"), SortField.asc("c"));
    CursorToken token = codec.encode(new SortKeyTuple(spec.fieldNames(), List.of(1, 2, 3)));
    PageQuery q = translator.translate(PaginationRequest.after(spec, token, 5));

    QueryElement expected = or(
        gt("a", 1),
        and(eq("a", 1), gt("b", 2)),
        and(eq("a", 1), eq("b", 2), gt("c", 3)));
    assertEquals(expected, q.filter());
  }

  @Test
  void singleDescendingField_alsoMatchesNullsWhichSortLast() {
    SortSpec spec = SortSpec.of(SortField.desc("_id"));
    CursorToken token = codec.encode(new SortKeyTuple(List.of("_id"), List.of(10)));

    assertEquals(or(lt("_id", 10), eq("_id", null)), translator.translate(PaginationRequest.after(spec, token, 5)).filter());
  }

  @Test
  void malformedCursor_propagatesInvalidCursor() {
    PaginationRequest r = PaginationRequest.after(SCORE_ID, CursorToken.of("garbage"), 2);
    assertThrows(InvalidCursorException.class, () -> translator.translate(r));
  }

  @Test
  void cursorFromAnotherSort_isRejected() {
    CursorToken token = codec.encode(new SortKeyTuple(List.of("name"), List.of("Apple")));
    assertThrows(InvalidCursorException.class, () -> translator.translate(PaginationRequest.after(SCORE_ID, token, 2)));
  }

  @Test
  void limitThatCannotFetchOneExtra_isRejected() {
    PaginationRequest r = PaginationRequest.first(SCORE_ID, Integer.MAX_VALUE);
    assertThrows(InvalidLimitException.class, () -> translator.translate(r));
  }

  @Test
  void nullKeyAscending_matchesEveryPresentValue() {
    SortSpec spec = SortSpec.of(SortField.asc("score"), SortField.asc("_id"));
    CursorToken token = codec.encode(new SortKeyTuple(spec.fieldNames(), Arrays.asList(null, 1)));

    QueryElement expected = or(ne("score", null), and(eq("score", null), gt("_id", 1)));
    assertEquals(expected, translator.translate(PaginationRequest.after(spec, token, 1)).filter());
  }

  @Test
  void nullKeyDescending_dropsTheComparisonNothingSortsPast() {
    CursorToken token = codec.encode(new SortKeyTuple(List.of("score", "_id"), Arrays.asList(null, 4)));

    QueryElement expected = and(eq("score", null), gt("_id", 4));
    assertEquals(expected, translator.translate(PaginationRequest.after(SCORE_ID, token, 1)).filter());
  }

  @Test
  void nullKeyAtTheEndOfTheScan_matchesNothing() {
    SortSpec spec = SortSpec.of(SortField.desc("score"));
    CursorToken token = codec.encode(new SortKeyTuple(List.of("score"), Arrays.asList((Object) null)));

    assertEquals(in("score", List.of()), translator.translate(PaginationRequest.after(spec, token, 1)).filter());
  }
}
