package com.cliffc.ir.module;

import com.cliffc.ir.type.Type;

public final class BlockArg extends Value {
  public final Block _block;
  public final int _idx;
  BlockArg( Block block, int idx, Type type ) { super(Kind.ARG,type); _block = block; _idx = idx; }
}
