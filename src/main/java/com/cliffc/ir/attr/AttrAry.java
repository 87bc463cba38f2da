package com.cliffc.ir.attr;

// Ordered, possibly nested, list of attributes
public final class AttrAry extends Attr {
  private final Attr[] _elts;
  private AttrAry( Attr[] elts ) { super(Kind.ARY); _elts = elts; }
  public static AttrAry make( Attr... elts ) { return new AttrAry(elts.clone()); }
  // Shared, not a copy; do not modify
  public Attr[] elts() { return _elts; }
}
