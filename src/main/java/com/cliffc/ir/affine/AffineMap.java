package com.cliffc.ir.affine;

import com.cliffc.ir.print.AsmPrinter;

/** A function from dimension and symbol positions to a tuple of affine
 *  expressions, optionally bounded by a list of range sizes.
 *
 *  Maps are compared by identity: the module printer hoists each distinct
 *  map object once, even when two of them print the same.
 */
public final class AffineMap {
  public final int _ndims, _nsyms;
  private final AffineExpr[] _results;
  private final AffineExpr[] _sizes; // Range sizes; null if not bounded

  private AffineMap( int ndims, int nsyms, AffineExpr[] results, AffineExpr[] sizes ) {
    assert ndims >= 0 && nsyms >= 0;
    _ndims = ndims;
    _nsyms = nsyms;
    _results = results;
    _sizes = sizes;
  }
  public static AffineMap make( int ndims, int nsyms, AffineExpr... results ) {
    return new AffineMap(ndims,nsyms,results.clone(),null);
  }
  public static AffineMap makeBounded( int ndims, int nsyms, AffineExpr[] results, AffineExpr[] sizes ) {
    assert sizes != null;
    return new AffineMap(ndims,nsyms,results.clone(),sizes.clone());
  }

  public int numResults() { return _results.length; }
  public AffineExpr result( int i ) { return _results[i]; }
  // Shared, not a copy; do not modify
  public AffineExpr[] results() { return _results; }
  public boolean isBounded() { return _sizes != null; }
  public AffineExpr[] rangeSizes() { return _sizes; }

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.println(this); }
}
