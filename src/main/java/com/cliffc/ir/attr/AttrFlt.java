package com.cliffc.ir.attr;

public final class AttrFlt extends Attr {
  public final double _d;
  private AttrFlt( double d ) { super(Kind.FLT); _d = d; }
  public static AttrFlt make( double d ) { return new AttrFlt(d); }
}
