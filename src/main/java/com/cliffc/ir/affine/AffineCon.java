package com.cliffc.ir.affine;

// Integer constant
public final class AffineCon extends AffineExpr {
  public final long _con;
  AffineCon( long con ) { super(Kind.CON); _con = con; }
}
