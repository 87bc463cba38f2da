package com.cliffc.ir.module;

public final class OpStmt extends Stmt {
  public final Op _op;
  public OpStmt( Op op ) {
    super(Kind.OP);
    assert op._block==null && op._stmt==null : "operation already placed";
    _op = op;
    op._stmt = this;
  }
}
