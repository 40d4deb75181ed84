package io.intellixity.cursorpaging.query;

public enum Clause { AND, OR }
