package com.cliffc.ir.module;

import com.cliffc.ir.util.Ary;

// Ordered list of statements; the body of a function, a loop or an if-clause
public class StmtBlock {
  private final MLFunc _fn;     // Set for a function body
  private final Stmt _owner;    // Set for a loop or if body
  public final Ary<Stmt> _stmts = new Ary<>(Stmt.class);

  StmtBlock( MLFunc fn, Stmt owner ) { _fn = fn; _owner = owner; }

  public <S extends Stmt> S add( S s ) {
    assert s._parent == null : "statement already placed";
    s._parent = this;
    _stmts.add(s);
    return s;
  }
  // Wrap and append an operation
  public OpStmt add( Op op ) { return add(new OpStmt(op)); }

  public MLFunc func() {
    if( _fn != null ) return _fn;
    return _owner==null ? null : _owner.func();
  }
}
