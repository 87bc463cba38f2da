package com.cliffc.ir.module;

// Conditional with a then clause and an optional else clause.  The condition
// is not modelled yet.
public final class IfStmt extends Stmt {
  public final StmtBlock _then = new StmtBlock(null,this);
  private StmtBlock _else;
  public IfStmt() { super(Kind.IF); }

  public boolean hasElse() { return _else != null; }
  public StmtBlock elseClause() { return _else; }
  public StmtBlock makeElse() {
    if( _else==null ) _else = new StmtBlock(null,this);
    return _else;
  }
}
