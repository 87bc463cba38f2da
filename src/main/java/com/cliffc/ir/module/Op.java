package com.cliffc.ir.module;

import com.cliffc.ir.attr.Attr;
import com.cliffc.ir.attr.NamedAttr;
import com.cliffc.ir.print.AsmPrinter;
import com.cliffc.ir.type.Type;

/** A generic operation: a name, operand values, named attributes and zero or
 *  more typed results.
 *
 *  Lives either in a basic block of a CFG function or wrapped by an OpStmt in
 *  an ML function; the owner is recorded when it is inserted.
 */
public class Op {
  public final String _name;
  private final Value[] _operands;
  private NamedAttr[] _attrs;
  private final OpResult[] _results;
  Block _block;                 // Owning block, if in a CFG function
  OpStmt _stmt;                 // Owning statement, if in an ML function

  public Op( String name, Value[] operands, NamedAttr[] attrs, Type... resultTypes ) {
    _name = name;
    _operands = operands==null ? NO_VALUES : operands;
    _attrs = attrs==null ? NO_ATTRS : attrs;
    _results = new OpResult[resultTypes.length];
    for( int i=0; i<resultTypes.length; i++ )
      _results[i] = new OpResult(this,i,resultTypes[i]);
  }
  public Op( String name, Value[] operands, Type... resultTypes ) { this(name,operands,null,resultTypes); }
  static final Value[] NO_VALUES = new Value[0];
  static final NamedAttr[] NO_ATTRS = new NamedAttr[0];

  public int numOperands() { return _operands.length; }
  public Value operand( int i ) { return _operands[i]; }
  public Value[] operands() { return _operands; }

  public int numResults() { return _results.length; }
  public OpResult result( int i ) { return _results[i]; }
  public OpResult[] results() { return _results; }

  public NamedAttr[] attrs() { return _attrs; }
  // Append a named attribute
  public Op addAttr( String name, Attr attr ) {
    NamedAttr[] as = new NamedAttr[_attrs.length+1];
    System.arraycopy(_attrs,0,as,0,_attrs.length);
    as[_attrs.length] = new NamedAttr(name,attr);
    _attrs = as;
    return this;
  }

  public Block block() { return _block; }
  public OpStmt stmt() { return _stmt; }

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.println(this); }
}
