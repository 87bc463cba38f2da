package com.cliffc.ir.module;

import com.cliffc.ir.print.CustomAsm;

import java.util.HashMap;

/** The set of operations known to a context, by name.  A registered
 *  operation prints with its own custom form instead of the generic one. */
public class OpSet {
  private final HashMap<String,CustomAsm> _ops = new HashMap<>();

  public OpSet register( String name, CustomAsm asm ) {
    CustomAsm old = _ops.put(name,asm);
    assert old==null : "operation "+name+" registered twice";
    return this;
  }
  // Custom printer for the named operation, or null if unknown
  public CustomAsm lookup( String name ) { return _ops.get(name); }
}
