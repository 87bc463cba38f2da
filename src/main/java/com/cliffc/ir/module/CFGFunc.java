package com.cliffc.ir.module;

import com.cliffc.ir.type.TypeFun;
import com.cliffc.ir.util.Ary;

// Function body is an ordered list of basic blocks; the first is the entry
public class CFGFunc extends Func {
  public final Ary<Block> _blocks = new Ary<>(Block.class);
  public CFGFunc( String name, TypeFun sig ) { super(Kind.CFG,name,sig); }

  // Make a new empty block at the end of the function
  public Block addBlock() {
    Block bb = new Block(this);
    _blocks.add(bb);
    return bb;
  }
}
