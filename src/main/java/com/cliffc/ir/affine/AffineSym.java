package com.cliffc.ir.affine;

// Symbol identifier, printed as s<pos>
public final class AffineSym extends AffineExpr {
  public final int _pos;
  AffineSym( int pos ) { super(Kind.SYM); assert pos >= 0; _pos = pos; }
}
