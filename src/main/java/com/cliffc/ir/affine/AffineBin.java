package com.cliffc.ir.affine;

// Binary operation: add, mul, floordiv, ceildiv or mod
public final class AffineBin extends AffineExpr {
  public final AffineExpr _lhs, _rhs;
  AffineBin( Kind kind, AffineExpr lhs, AffineExpr rhs ) {
    super(kind);
    assert isBinary();
    _lhs = lhs;
    _rhs = rhs;
  }
}
