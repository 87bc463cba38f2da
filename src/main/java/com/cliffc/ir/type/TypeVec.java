package com.cliffc.ir.type;

// Fixed shape vector; every dimension is known
public final class TypeVec extends Type {
  private final int[] _shape;
  public final Type _elem;
  private TypeVec( int[] shape, Type elem ) { super(Kind.VEC); _shape = shape; _elem = elem; }
  public static TypeVec make( Type elem, int... shape ) {
    for( int d : shape ) assert d > 0 : "vector dims are always known";
    return new TypeVec(shape.clone(),elem);
  }
  public int[] shape() { return _shape; }
}
