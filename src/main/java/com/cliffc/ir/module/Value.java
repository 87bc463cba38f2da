package com.cliffc.ir.module;

import com.cliffc.ir.type.Type;

/** Something an operation can use as an operand. */
public abstract class Value {
  public enum Kind {
    ARG,                        // Block argument
    RESULT,                     // Operation result
    IV,                         // Loop induction variable
  }
  public final Kind _kind;
  final Type _type;
  Value( Kind kind, Type type ) { _kind = kind; _type = type; }
  public Type type() { return _type; }
}
