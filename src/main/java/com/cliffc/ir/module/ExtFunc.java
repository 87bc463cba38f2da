package com.cliffc.ir.module;

import com.cliffc.ir.type.TypeFun;

// External function declaration
public class ExtFunc extends Func {
  public ExtFunc( String name, TypeFun sig ) { super(Kind.EXT,name,sig); }
}
