package com.cliffc.ir.attr;

public final class AttrBool extends Attr {
  public final boolean _b;
  private AttrBool( boolean b ) { super(Kind.BOOL); _b = b; }
  public static final AttrBool TRUE  = new AttrBool(true );
  public static final AttrBool FALSE = new AttrBool(false);
  public static AttrBool make( boolean b ) { return b ? TRUE : FALSE; }
}
