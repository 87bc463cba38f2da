package com.cliffc.ir.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing.
 *  Every printer in the project writes into one of these. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( double s ) {
    if( Double.isNaN(s) )
      _sb.append("nan");
    else if( Double.isInfinite(s) ) {
      _sb.append(s > 0 ? "inf" : "-inf");
    } else _sb.append(s);
    return this;
  }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  // Indent by the current nesting depth, two spaces per level
  public SB i( int d ) { for( int i=0; i<d+_indent; i++ ) p("  "); return this; }
  public SB i( ) { return i(0); }
  public SB ip(String s) { return i().p(s); }
  public SB s() { _sb.append(' '); return this; }

  // Increase indentation
  public SB ii( int i) { _indent += i; return this; }
  // Decrease indentation
  public SB di( int i) { _indent -= i; return this; }

  public SB nl( ) { return p('\n'); }

  // Remove trailing characters; used after comma-separated loops
  public SB unchar(int n) { _sb.setLength(_sb.length()-n); return this; }

  @Override public String toString() { return _sb.toString(); }
}
