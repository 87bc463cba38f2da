package com.cliffc.ir.module;

import com.cliffc.ir.type.Type;

// One result of an operation.  All results of one operation share a single
// printed id; _idx picks out which one.
public final class OpResult extends Value {
  public final Op _op;
  public final int _idx;
  OpResult( Op op, int idx, Type type ) { super(Kind.RESULT,type); _op = op; _idx = idx; }
}
