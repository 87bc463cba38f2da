package com.cliffc.ir.print;

import com.cliffc.ir.IR;
import com.cliffc.ir.module.*;
import com.cliffc.ir.util.SB;

import java.util.IdentityHashMap;

/** Prints a function made of basic blocks.
 *
 *  Blocks are numbered by position and all values numbered before any text
 *  is produced, so a branch to a later block or a use of a later value
 *  resolves.
 */
public final class CFGFuncPrinter extends FuncPrinter {
  private final CFGFunc _fn;
  private final IdentityHashMap<Block,Integer> _blockIDs = new IdentityHashMap<>();

  public CFGFuncPrinter( CFGFunc fn, ModulePrinter other ) {
    super(other);
    _fn = fn;
    int id=0;
    for( Block bb : fn._blocks ) {
      _blockIDs.put(bb,id++);
      numberValuesInBlock(bb);
    }
  }

  // Arguments first, then one id per operation with results.  Terminators
  // define nothing.
  private void numberValuesInBlock( Block bb ) {
    for( BlockArg arg : bb._args )
      numberValueID(arg);
    for( Op op : bb._ops )
      if( op.numResults() != 0 )
        numberValueID(op.result(0));
  }

  @Override public SB print( SB sb ) {
    printSignature(sb.p("cfgfunc "),_fn).p(" {").nl();
    for( Block bb : _fn._blocks )
      print(sb,bb);
    return sb.p('}').nl().nl();
  }

  // bb1(%0: i32, %1: f32):
  public SB print( SB sb, Block bb ) {
    printBlockID(sb,bb);
    if( !bb._args.isEmpty() ) {
      sb.p('(');
      for( BlockArg arg : bb._args )
        print(printValueID(sb,arg).p(": "),arg.type()).p(", ");
      sb.unchar(2).p(')');
    }
    sb.p(':').nl();
    for( Op op : bb._ops )
      print(sb,op).nl();
    return print(sb,bb.term()).nl();
  }

  public SB print( SB sb, Op op ) { return printOperation(sb.p("  "),op); }

  public SB print( SB sb, Term term ) {
    if( term==null ) return sb.p("  ").p(IR.MISSING_TERM);
    return switch( term._kind ) {
    case BR  -> print(sb,(Branch)term);
    case RET -> print(sb,(Return)term);
    };
  }

  // br bb2(%0, %1) : i32, f32
  private SB print( SB sb, Branch br ) {
    printBlockID(sb.p("  br "),br._dest);
    if( br.numOperands() != 0 ) {
      printValueIDs(sb.p('('),br.operands()).p(") : ");
      printValueTypes(sb,br.operands());
    }
    return sb;
  }

  // return %0, %1 : i32, f32
  private SB print( SB sb, Return ret ) {
    sb.p("  return");
    if( ret.numOperands() != 0 ) {
      printValueIDs(sb.s(),ret.operands()).p(" : ");
      printValueTypes(sb,ret.operands());
    }
    return sb;
  }

  // Blocks not in this function print a sentinel
  public SB printBlockID( SB sb, Block bb ) {
    Integer id = _blockIDs.get(bb);
    return id==null ? sb.p("bb").p(IR.INVALID_BLOCK) : sb.p("bb").p(id);
  }
}
