package io.intellixity.cursorpaging.exec;

/** Reads a sort field's value out of a raw row. Missing fields read as null. */
@FunctionalInterface
public interface FieldReader<R> {
  Object read(R row, String field);
}
