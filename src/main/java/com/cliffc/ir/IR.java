package com.cliffc.ir;

/** Canonical text printer for an affine compiler IR.
 */

public abstract class IR {
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  // Printed in place of a value reference that has no number in the current
  // function.  Partially built IR prints these, instead of failing.
  public static final String INVALID_VALUE = "<<INVALID SSA VALUE>>";
  // Printed in place of a block reference that is not in the current function.
  public static final String INVALID_BLOCK = "<<INVALID BLOCK>>";
  // Printed in place of the terminator of a block that has none yet.
  public static final String MISSING_TERM  = "<<MISSING TERMINATOR>>";

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !IR.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
