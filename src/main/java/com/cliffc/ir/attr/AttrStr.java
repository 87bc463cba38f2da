package com.cliffc.ir.attr;

public final class AttrStr extends Attr {
  public final String _s;
  private AttrStr( String s ) { super(Kind.STR); _s = s; }
  public static AttrStr make( String s ) { return new AttrStr(s); }
}
