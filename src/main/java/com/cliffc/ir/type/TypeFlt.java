package com.cliffc.ir.type;

// Floating point; one shared instance per width
public final class TypeFlt extends Type {
  private TypeFlt( Kind kind ) { super(kind); assert isFloat(); }
  public static final TypeFlt BF16 = new TypeFlt(Kind.BF16);
  public static final TypeFlt F16  = new TypeFlt(Kind.F16 );
  public static final TypeFlt F32  = new TypeFlt(Kind.F32 );
  public static final TypeFlt F64  = new TypeFlt(Kind.F64 );
}
