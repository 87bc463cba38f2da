package com.cliffc.ir.module;

import com.cliffc.ir.print.AsmPrinter;
import com.cliffc.ir.type.TypeFun;

/** A function: a name, a signature and (except for declarations) a body in
 *  one of two shapes. */
public abstract class Func {
  public enum Kind {
    EXT,                        // External declaration; signature only
    CFG,                        // Basic blocks with terminators
    ML,                         // Nested for/if statement tree
  }

  public final Kind _kind;
  public final String _name;
  public final TypeFun _sig;
  IRModule _module;             // Owning module, or null if detached

  Func( Kind kind, String name, TypeFun sig ) { _kind = kind; _name = name; _sig = sig; }

  public IRModule module() { return _module; }
  public OpSet opSet() { return _module==null ? null : _module.opSet(); }

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.print(this); }
}
