package com.cliffc.ir.module;

import com.cliffc.ir.type.TypeFun;

// Function body is a tree of statements; control flow is only for and if
public class MLFunc extends Func {
  public final StmtBlock _body;
  public MLFunc( String name, TypeFun sig ) {
    super(Kind.ML,name,sig);
    _body = new StmtBlock(this,null);
  }
}
