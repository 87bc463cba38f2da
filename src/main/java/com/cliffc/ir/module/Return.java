package com.cliffc.ir.module;

public final class Return extends Term {
  public Return( Value... rets ) { super(Kind.RET,rets); }
}
