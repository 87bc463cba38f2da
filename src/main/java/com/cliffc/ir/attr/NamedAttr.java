package com.cliffc.ir.attr;

// An attribute with its name, as attached to an operation
public final class NamedAttr {
  public final String _name;
  public final Attr _attr;
  public NamedAttr( String name, Attr attr ) { _name = name; _attr = attr; }
}
