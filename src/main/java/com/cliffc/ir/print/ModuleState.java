package com.cliffc.ir.print;

import com.cliffc.ir.IR;
import com.cliffc.ir.affine.AffineMap;
import com.cliffc.ir.attr.*;
import com.cliffc.ir.module.*;
import com.cliffc.ir.type.*;
import com.cliffc.ir.util.Ary;

import java.util.IdentityHashMap;

/** Module-wide printing state.
 *
 *  One depth-first pass over a module finds every affine map reachable from a
 *  memref type or a map attribute, and numbers each distinct map object in
 *  the order first seen.  The module printer hoists these to the top of the
 *  module and prints references to them everywhere else.
 *
 *  Maps are keyed by identity, never by structure: two maps built separately
 *  get two ids even when they print the same.
 *
 *  A state that never sees a module is empty; every lookup misses and maps
 *  print inline.
 */
public class ModuleState {
  // Operation set of the context, if one is known.  Null otherwise.
  public final OpSet _ops;

  private final IdentityHashMap<AffineMap,Integer> _ids = new IdentityHashMap<>();
  private final Ary<AffineMap> _maps = new Ary<>(AffineMap.class); // In id order

  public ModuleState( OpSet ops ) { _ops = ops; }

  // Populate the affine map table from the whole module
  public ModuleState initialize( IRModule module ) {
    for( Func fn : module._funcs )
      visit(fn);
    return this;
  }

  // Id of the map, or -1 if it was never seen
  public int getAffineMapId( AffineMap map ) {
    Integer id = _ids.get(map);
    return id==null ? -1 : id;
  }
  // Number of maps seen
  public int numAffineMaps() { return _maps.len(); }
  // The map with the given id
  public AffineMap affineMap( int id ) { return _maps.at(id); }

  private void recordAffineMapReference( AffineMap map ) {
    if( _ids.containsKey(map) ) return;
    int id = _maps.len();
    _ids.put(map,id);
    _maps.add(map);
    IR.p(map,"#map"+id+" assigned");
  }

  private ModuleState visit( Func fn ) {
    visit(fn._sig);             // Signature before body
    return switch( fn._kind ) {
    case EXT -> this;
    case CFG -> {
      for( Block bb : ((CFGFunc)fn)._blocks )
        for( Op op : bb._ops )
          visit(op);
      yield this;
    }
    // TODO: ML bodies are not walked; maps used only inside statements print inline
    case ML -> this;
    };
  }

  private void visit( Op op ) {
    for( NamedAttr na : op.attrs() )
      visit(na._attr);
  }

  private ModuleState visit( Type t ) {
    return switch( t._kind ) {
    case INDEX, BF16, F16, F32, F64, INT -> this;
    case FUN -> {
      TypeFun fun = (TypeFun)t;
      for( Type in  : fun.inputs () ) visit(in );
      for( Type out : fun.results() ) visit(out);
      yield this;
    }
    case VEC     -> visit(((TypeVec    )t)._elem);
    case TENSOR  -> visit(((TypeTensor )t)._elem);
    case UTENSOR -> visit(((TypeUTensor)t)._elem);
    case MEMREF -> {
      TypeMemRef mem = (TypeMemRef)t;
      visit(mem._elem);
      for( AffineMap map : mem.affineMaps() )
        recordAffineMapReference(map);
      yield this;
    }
    };
  }

  private ModuleState visit( Attr a ) {
    return switch( a._kind ) {
    case BOOL, INT, FLT, STR -> this;
    case ARY -> {
      for( Attr elt : ((AttrAry)a).elts() )
        visit(elt);
      yield this;
    }
    case MAP -> { recordAffineMapReference(((AttrMap)a)._map); yield this; }
    };
  }
}
