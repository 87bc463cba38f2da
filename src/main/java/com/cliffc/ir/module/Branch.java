package com.cliffc.ir.module;

// Unconditional branch, passing values to the destination's arguments
public final class Branch extends Term {
  public final Block _dest;
  public Branch( Block dest, Value... args ) { super(Kind.BR,args); _dest = dest; }
}
