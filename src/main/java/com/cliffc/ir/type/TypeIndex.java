package com.cliffc.ir.type;

// The index integer; no fixed width
public final class TypeIndex extends Type {
  private TypeIndex() { super(Kind.INDEX); }
  public static final TypeIndex INDEX = new TypeIndex();
}
