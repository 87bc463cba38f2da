package com.cliffc.ir.module;

// Block terminator.  Terminators use values but never define them.
public abstract class Term {
  public enum Kind { BR, RET }
  public final Kind _kind;
  private final Value[] _operands;
  Term( Kind kind, Value[] operands ) { _kind = kind; _operands = operands==null ? Op.NO_VALUES : operands; }
  public int numOperands() { return _operands.length; }
  public Value operand( int i ) { return _operands[i]; }
  public Value[] operands() { return _operands; }
}
