package com.cliffc.ir.type;

// Sized integer
public final class TypeInt extends Type {
  public final int _width;
  private TypeInt( int width ) { super(Kind.INT); _width = width; }
  public static TypeInt make( int width ) {
    assert width > 0 : "bad integer width "+width;
    return switch( width ) {
    case  1 -> I1;
    case 32 -> I32;
    case 64 -> I64;
    default -> new TypeInt(width);
    };
  }
  public static final TypeInt I1  = new TypeInt( 1);
  public static final TypeInt I32 = new TypeInt(32);
  public static final TypeInt I64 = new TypeInt(64);
}
