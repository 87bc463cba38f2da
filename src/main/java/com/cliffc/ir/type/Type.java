package com.cliffc.ir.type;

import com.cliffc.ir.print.AsmPrinter;

/** IR types.
 *
 *  A closed set of kinds; each kind has exactly one textual form.  Types are
 *  plain immutable objects and are not interned.
 */
public abstract class Type {
  public enum Kind {
    INDEX,                      // Abstract unsized index integer: affineint
    BF16, F16, F32, F64,        // Floats
    INT,                        // Sized integer: i1, i32, ...
    FUN,                        // (inputs) -> results
    VEC,                        // vector<4x8xf32>
    TENSOR,                     // tensor<2x?xf32>
    UTENSOR,                    // tensor<??f32>
    MEMREF,                     // memref<4x?xf32, #map0, 2>
  }

  public final Kind _kind;
  Type( Kind kind ) { _kind = kind; }

  public boolean isFloat() { return _kind==Kind.BF16 || _kind==Kind.F16 || _kind==Kind.F32 || _kind==Kind.F64; }

  // Marker in a tensor or memref shape for an unknown dimension
  public static final int UNKNOWN = -1;

  @Override public String toString() { return AsmPrinter.print(this); }
  public void dump() { System.err.println(this); }
}
