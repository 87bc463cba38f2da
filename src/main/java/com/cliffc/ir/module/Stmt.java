package com.cliffc.ir.module;

import com.cliffc.ir.print.AsmPrinter;

/** A node of an ML function body. */
public abstract class Stmt {
  public enum Kind {
    OP,                         // A plain operation
    FOR,                        // Bounded loop with a nested body
    IF,                         // Conditional with then and optional else
  }
  public final Kind _kind;
  StmtBlock _parent;            // Enclosing body, null if detached
  Stmt( Kind kind ) { _kind = kind; }

  // Owning function, or null if any link up the tree is missing
  public MLFunc func() { return _parent==null ? null : _parent.func(); }

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.println(this); }
}
