package com.cliffc.ir.type;

// Unranked tensor; only the element type is known
public final class TypeUTensor extends Type {
  public final Type _elem;
  private TypeUTensor( Type elem ) { super(Kind.UTENSOR); _elem = elem; }
  public static TypeUTensor make( Type elem ) { return new TypeUTensor(elem); }
}
