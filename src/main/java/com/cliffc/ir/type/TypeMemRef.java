package com.cliffc.ir.type;

import com.cliffc.ir.affine.AffineMap;

/** A reference to a region of memory.
 *
 *  Shape (dimensions may be UNKNOWN), element type, the list of affine maps
 *  describing the layout (a composition, possibly empty) and the memory
 *  space the region lives in.
 */
public final class TypeMemRef extends Type {
  private final int[] _shape;
  public final Type _elem;
  private final AffineMap[] _maps;
  public final int _space;
  private TypeMemRef( int[] shape, Type elem, AffineMap[] maps, int space ) {
    super(Kind.MEMREF);
    _shape = shape;
    _elem  = elem;
    _maps  = maps;
    _space = space;
  }
  public static TypeMemRef make( int[] shape, Type elem, AffineMap[] maps, int space ) {
    return new TypeMemRef(shape.clone(),elem,maps==null ? NO_MAPS : maps.clone(),space);
  }
  public static TypeMemRef make( Type elem, int... shape ) { return make(shape,elem,NO_MAPS,0); }
  private static final AffineMap[] NO_MAPS = new AffineMap[0];

  // Shared, not copies; do not modify
  public int[] shape() { return _shape; }
  public AffineMap[] affineMaps() { return _maps; }
}
