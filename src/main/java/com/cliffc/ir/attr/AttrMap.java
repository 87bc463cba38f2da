package com.cliffc.ir.attr;

import com.cliffc.ir.affine.AffineMap;

// An affine map used as a constant
public final class AttrMap extends Attr {
  public final AffineMap _map;
  private AttrMap( AffineMap map ) { super(Kind.MAP); _map = map; }
  public static AttrMap make( AffineMap map ) { return new AttrMap(map); }
}
