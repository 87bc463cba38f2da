package com.cliffc.ir.module;

import com.cliffc.ir.print.AsmPrinter;
import com.cliffc.ir.util.Ary;

/** A compilation unit: an ordered list of functions.
 *
 *  The optional operation set plays the role of the context; when present its
 *  custom printers are used for the operations it knows.
 */
public class IRModule {
  public final Ary<Func> _funcs = new Ary<>(Func.class);
  private final OpSet _ops;

  public IRModule() { this(null); }
  public IRModule( OpSet ops ) { _ops = ops; }

  public OpSet opSet() { return _ops; }

  public <F extends Func> F add( F fn ) {
    assert fn._module == null : "function already in a module";
    fn._module = this;
    _funcs.add(fn);
    return fn;
  }

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.print(this); }
}
