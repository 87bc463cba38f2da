package com.cliffc.ir.module;

import com.cliffc.ir.type.TypeIndex;

// Induction variable of a for statement
public final class IndVar extends Value {
  public final ForStmt _for;
  IndVar( ForStmt fs ) { super(Kind.IV,TypeIndex.INDEX); _for = fs; }
}
