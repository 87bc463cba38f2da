package com.cliffc.ir.type;

// Ranked tensor; a dimension may be UNKNOWN
public final class TypeTensor extends Type {
  private final int[] _shape;
  public final Type _elem;
  private TypeTensor( int[] shape, Type elem ) { super(Kind.TENSOR); _shape = shape; _elem = elem; }
  public static TypeTensor make( Type elem, int... shape ) { return new TypeTensor(shape.clone(),elem); }
  public int[] shape() { return _shape; }
}
