package com.cliffc.ir.module;

import com.cliffc.ir.affine.AffineCon;
import com.cliffc.ir.affine.AffineExpr;

/** Bounded loop: for x = lower to upper step c.  The induction variable is
 *  a value in its own right and gets numbered with the other values. */
public final class ForStmt extends Stmt {
  public final AffineExpr _lo, _hi;
  public final AffineCon _step;
  public final StmtBlock _body = new StmtBlock(null,this);
  public final IndVar _iv = new IndVar(this);
  public ForStmt( AffineExpr lo, AffineExpr hi, AffineCon step ) {
    super(Kind.FOR);
    _lo = lo;
    _hi = hi;
    _step = step;
  }
  public ForStmt( AffineExpr lo, AffineExpr hi ) { this(lo,hi,AffineExpr.con(1)); }
}
