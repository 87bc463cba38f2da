package com.cliffc.ir.type;

// Function type: ordered inputs, ordered results.  Also the signature of
// every function.
public final class TypeFun extends Type {
  private final Type[] _ins, _outs;
  private TypeFun( Type[] ins, Type[] outs ) { super(Kind.FUN); _ins = ins; _outs = outs; }
  public static TypeFun make( Type[] ins, Type... outs ) { return new TypeFun(ins.clone(),outs.clone()); }
  public static final Type[] NONE = new Type[0];

  // Shared, not copies; do not modify
  public Type[] inputs () { return _ins ; }
  public Type[] results() { return _outs; }
  public int nins () { return _ins .length; }
  public int nouts() { return _outs.length; }
}
