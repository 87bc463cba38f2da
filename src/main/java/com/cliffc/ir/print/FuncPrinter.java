package com.cliffc.ir.print;

import com.cliffc.ir.IR;
import com.cliffc.ir.attr.NamedAttr;
import com.cliffc.ir.module.*;
import com.cliffc.ir.util.SB;

import java.util.IdentityHashMap;

/** Printing state common to both function body shapes.
 *
 *  Numbers values densely from 0, in an order chosen by the subclass, before
 *  anything is printed.  All results of one operation share the id of result
 *  0; a use of any result of an operation with other than exactly one result
 *  prints the result index too, as in %7#0.
 *
 *  Partially built IR is a normal input.  A use of a value that never got a
 *  number prints a sentinel, and printing carries on.
 */
public abstract class FuncPrinter extends ModulePrinter {
  private final IdentityHashMap<Value,Integer> _valueIDs = new IdentityHashMap<>();
  private int _nextValueID;

  FuncPrinter( ModulePrinter other ) { super(other._state); }

  // Print the whole function
  public abstract SB print( SB sb );

  // --------------------------------------------------------------------------
  // Value numbering

  void numberValueID( Value v ) {
    if( _valueIDs.containsKey(v) )
      throw new IllegalStateException("Value numbered multiple times");
    _valueIDs.put(v,_nextValueID++);
  }
  // Count of numbered values
  public int numValueIDs() { return _nextValueID; }

  public SB printValueID( SB sb, Value v ) { return printValueID(sb,v,false); }
  public SB printValueID( SB sb, Value v, boolean dontPrintResultNo ) {
    int resultNo = -1;
    Value lookup = v;
    // Multi-result ops are numbered by their first result
    if( v instanceof OpResult res && res._op.numResults() != 1 ) {
      resultNo = res._idx;
      lookup = res._op.result(0);
    }
    Integer id = _valueIDs.get(lookup);
    if( id==null ) return sb.p(IR.INVALID_VALUE);
    sb.p('%').p(id);
    if( resultNo != -1 && !dontPrintResultNo )
      sb.p('#').p(resultNo);
    return sb;
  }

  // Comma separated value uses
  public SB printValueIDs( SB sb, Value[] vs ) {
    for( int i=0; i<vs.length; i++ )
      printValueID(i==0 ? sb : sb.p(", "),vs[i]);
    return sb;
  }
  // Comma separated types of values.  A missing value has no type either.
  public SB printValueTypes( SB sb, Value[] vs ) {
    for( int i=0; i<vs.length; i++ ) {
      if( i>0 ) sb.p(", ");
      if( vs[i]==null ) sb.p(IR.INVALID_VALUE);
      else print(sb,vs[i].type());
    }
    return sb;
  }

  // --------------------------------------------------------------------------
  // Operations; same for both body shapes.  No indent, no newline.

  public SB printOperation( SB sb, Op op ) {
    if( op.numResults() != 0 )
      printValueID(sb,op.result(0),true).p(" = ");

    // Known operations print their own way
    CustomAsm asm = _state._ops==null ? null : _state._ops.lookup(op._name);
    if( asm != null )
      return asm.print(op,this,sb);

    // Generic form
    printValueIDs(sb.p('"').p(op._name).p("\"("),op.operands()).p(')');
    NamedAttr[] attrs = op.attrs();
    if( attrs.length > 0 ) {
      sb.p('{');
      for( int i=0; i<attrs.length; i++ )
        print((i==0 ? sb : sb.p(", ")).p(attrs[i]._name).p(": "),attrs[i]._attr);
      sb.p('}');
    }

    // Type signature
    printValueTypes(sb.p(" : ("),op.operands()).p(") -> ");
    if( op.numResults()==1 )
      return print(sb,op.result(0).type());
    return printValueTypes(sb.p('('),op.results()).p(')');
  }
}
