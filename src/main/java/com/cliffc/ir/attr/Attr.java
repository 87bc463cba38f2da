package com.cliffc.ir.attr;

import com.cliffc.ir.print.AsmPrinter;

/** Compile-time constant attached to an operation by name. */
public abstract class Attr {
  public enum Kind { BOOL, INT, FLT, STR, ARY, MAP }

  public final Kind _kind;
  Attr( Kind kind ) { _kind = kind; }

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.println(this); }
}
