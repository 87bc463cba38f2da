package com.cliffc.ir.module;

import com.cliffc.ir.print.AsmPrinter;
import com.cliffc.ir.type.Type;
import com.cliffc.ir.util.Ary;

/** A basic block: arguments, straight-line operations, one terminator.
 *  Blocks have no names; the printer numbers them by position. */
public class Block {
  public final CFGFunc _fn;
  public final Ary<BlockArg> _args = new Ary<>(BlockArg.class);
  public final Ary<Op> _ops = new Ary<>(Op.class);
  private Term _term;           // Null until the block is finished

  Block( CFGFunc fn ) { _fn = fn; }

  public BlockArg addArg( Type t ) {
    BlockArg arg = new BlockArg(this,_args.len(),t);
    _args.add(arg);
    return arg;
  }
  public Op add( Op op ) {
    assert op._block==null && op._stmt==null : "operation already placed";
    op._block = this;
    _ops.add(op);
    return op;
  }
  public Term term() { return _term; }
  public <T extends Term> T setTerm( T term ) { _term = term; return term; }

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.print(this); }
}
