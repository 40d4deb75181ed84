package io.intellixity.cursorpaging.query;

/** Node of a backend-agnostic filter tree. Backends render it to their native filter form. */
public interface QueryElement {
}
