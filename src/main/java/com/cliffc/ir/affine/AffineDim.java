package com.cliffc.ir.affine;

// Dimension identifier, printed as d<pos>
public final class AffineDim extends AffineExpr {
  public final int _pos;
  AffineDim( int pos ) { super(Kind.DIM); assert pos >= 0; _pos = pos; }
}
