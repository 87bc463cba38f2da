package com.cliffc.ir.affine;

import com.cliffc.ir.print.AsmPrinter;

/** An affine expression tree over dimension and symbol placeholders.
 *
 *  Immutable, and subtrees are shared by reference: the same node can hang
 *  off many parents and many maps.  There is no structural equality; two
 *  expressions built separately are different expressions.
 */
public abstract class AffineExpr {
  // Closed set of expression kinds.  Printers switch over this exhaustively.
  public enum Kind { DIM, SYM, CON, ADD, MUL, FLOORDIV, CEILDIV, MOD }

  public final Kind _kind;
  AffineExpr( Kind kind ) { _kind = kind; }

  public boolean isBinary() { return _kind.ordinal() >= Kind.ADD.ordinal(); }

  // Leaves
  public static AffineDim dim( int pos ) { return new AffineDim(pos); }
  public static AffineSym sym( int pos ) { return new AffineSym(pos); }
  public static AffineCon con( long  c ) { return new AffineCon(c); }
  // Binary ops
  public static AffineBin add     ( AffineExpr l, AffineExpr r ) { return new AffineBin(Kind.ADD     ,l,r); }
  public static AffineBin mul     ( AffineExpr l, AffineExpr r ) { return new AffineBin(Kind.MUL     ,l,r); }
  public static AffineBin floorDiv( AffineExpr l, AffineExpr r ) { return new AffineBin(Kind.FLOORDIV,l,r); }
  public static AffineBin ceilDiv ( AffineExpr l, AffineExpr r ) { return new AffineBin(Kind.CEILDIV ,l,r); }
  public static AffineBin mod     ( AffineExpr l, AffineExpr r ) { return new AffineBin(Kind.MOD     ,l,r); }

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.println(this); }
}
