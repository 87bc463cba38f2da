package com.cliffc.ir.print;

import com.cliffc.ir.affine.*;
import com.cliffc.ir.attr.*;
import com.cliffc.ir.module.*;
import com.cliffc.ir.type.*;
import com.cliffc.ir.util.SB;
import org.jetbrains.annotations.NotNull;

import static com.cliffc.ir.IR.TODO;

/** Shared printing core: types, attributes, affine expressions and maps, and
 *  function signatures.  Also the module driver, dispatching each function to
 *  the printer for its body shape.
 *
 *  All state lives in the ModuleState; this class only reads it.  Every
 *  printer appends to the given SB and returns it, for flow-coding.
 */
public class ModulePrinter {
  protected final ModuleState _state;

  public ModulePrinter( @NotNull ModuleState state ) { _state = state; }

  // --------------------------------------------------------------------------
  // Module and functions

  // Hoisted map definitions in id order, then every function in order
  public SB print( SB sb, IRModule module ) {
    for( int id=0; id<_state.numAffineMaps(); id++ )
      print(printAffineMapId(sb,id).p(" = "),_state.affineMap(id)).nl();
    for( Func fn : module._funcs )
      print(sb,fn);
    return sb;
  }

  public SB print( SB sb, Func fn ) {
    return switch( fn._kind ) {
    case EXT -> printSignature(sb.p("extfunc "),fn).nl();
    case CFG -> new CFGFuncPrinter((CFGFunc)fn,this).print(sb);
    case ML  -> new  MLFuncPrinter(( MLFunc)fn,this).print(sb);
    };
  }

  // @name(i32, f32) -> (i1, i1)
  public SB printSignature( SB sb, Func fn ) {
    TypeFun sig = fn._sig;
    printTypes(sb.p('@').p(fn._name).p('('),sig.inputs()).p(')');
    return switch( sig.nouts() ) {
    case 0 -> sb;
    case 1 -> print(sb.p(" -> "),sig.results()[0]);
    default -> printTypes(sb.p(" -> ("),sig.results()).p(')');
    };
  }

  // --------------------------------------------------------------------------
  // Attributes

  public SB print( SB sb, Attr attr ) {
    return switch( attr._kind ) {
    case BOOL -> sb.p(((AttrBool)attr)._b ? "true" : "false");
    case INT  -> sb.p(((AttrInt)attr)._i.toString());
    // Not bit-exact; a hex form would round-trip
    case FLT  -> sb.p(((AttrFlt)attr)._d);
    // Not escaped
    case STR  -> sb.p('"').p(((AttrStr)attr)._s).p('"');
    case ARY  -> {
      Attr[] elts = ((AttrAry)attr).elts();
      sb.p('[');
      for( int i=0; i<elts.length; i++ )
        print(i==0 ? sb : sb.p(", "),elts[i]);
      yield sb.p(']');
    }
    case MAP  -> printAffineMapReference(sb,((AttrMap)attr)._map);
    };
  }

  // --------------------------------------------------------------------------
  // Types

  public SB print( SB sb, Type t ) {
    return switch( t._kind ) {
    case INDEX -> sb.p("affineint");
    case BF16  -> sb.p("bf16");
    case F16   -> sb.p("f16");
    case F32   -> sb.p("f32");
    case F64   -> sb.p("f64");
    case INT   -> sb.p('i').p(((TypeInt)t)._width);
    case FUN   -> {
      TypeFun fun = (TypeFun)t;
      printTypes(sb.p('('),fun.inputs()).p(") -> ");
      yield fun.nouts()==1
        ? print(sb,fun.results()[0])
        : printTypes(sb.p('('),fun.results()).p(')');
    }
    case VEC -> {
      TypeVec vec = (TypeVec)t;
      yield print(printShape(sb.p("vector<"),vec.shape()),vec._elem).p('>');
    }
    case TENSOR -> {
      TypeTensor ten = (TypeTensor)t;
      yield print(printShape(sb.p("tensor<"),ten.shape()),ten._elem).p('>');
    }
    case UTENSOR -> print(sb.p("tensor<??"),((TypeUTensor)t)._elem).p('>');
    case MEMREF -> {
      TypeMemRef mem = (TypeMemRef)t;
      print(printShape(sb.p("memref<"),mem.shape()),mem._elem);
      for( AffineMap map : mem.affineMaps() )
        printAffineMapReference(sb.p(", "),map);
      yield sb.p(", ").p(mem._space).p('>');
    }
    };
  }

  // Comma separated types
  public SB printTypes( SB sb, Type[] ts ) {
    for( int i=0; i<ts.length; i++ )
      print(i==0 ? sb : sb.p(", "),ts[i]);
    return sb;
  }

  // Each dimension followed by an 'x'; unknown dimensions print as '?'
  private static SB printShape( SB sb, int[] shape ) {
    for( int d : shape ) {
      if( d < 0 ) sb.p('?');
      else        sb.p(d);
      sb.p('x');
    }
    return sb;
  }

  // --------------------------------------------------------------------------
  // Affine maps

  public static SB printAffineMapId( SB sb, int id ) { return sb.p("#map").p(id); }

  // Reference to a hoisted map if the module has one, else the map inline
  public SB printAffineMapReference( SB sb, AffineMap map ) {
    int id = _state.getAffineMapId(map);
    return id >= 0 ? printAffineMapId(sb,id) : print(sb,map);
  }

  // (d0, d1) [s0] -> (d0 + s0, d1) size (10, 20)
  public SB print( SB sb, AffineMap map ) {
    sb.p('(');
    for( int i=0; i<map._ndims; i++ )
      (i==0 ? sb : sb.p(", ")).p('d').p(i);
    sb.p(')');

    if( map._nsyms >= 1 ) {
      sb.p(" [");
      for( int i=0; i<map._nsyms; i++ )
        (i==0 ? sb : sb.p(", ")).p('s').p(i);
      sb.p(']');
    }

    assert map.numResults() > 0 : "affine map with no results";
    printExprs(sb.p(" -> ("),map.results()).p(')');

    if( !map.isBounded() ) return sb;
    return printExprs(sb.p(" size ("),map.rangeSizes()).p(')');
  }

  private SB printExprs( SB sb, AffineExpr[] es ) {
    for( int i=0; i<es.length; i++ )
      print(i==0 ? sb : sb.p(", "),es[i]);
    return sb;
  }

  // --------------------------------------------------------------------------
  // Affine expressions

  // Binary ops are always fully parenthesized, so no precedence is lost.
  public SB print( SB sb, AffineExpr e ) {
    return switch( e._kind ) {
    case SYM -> sb.p('s').p(((AffineSym)e)._pos);
    case DIM -> sb.p('d').p(((AffineDim)e)._pos);
    case CON -> sb.p(((AffineCon)e)._con);
    case ADD -> printAdd(sb,(AffineBin)e);
    case MUL, FLOORDIV, CEILDIV, MOD -> {
      AffineBin bin = (AffineBin)e;
      print(sb.p('('),bin._lhs).p(binop(bin._kind));
      yield print(sb,bin._rhs).p(')');
    }
    };
  }

  private static String binop( AffineExpr.Kind kind ) {
    return switch( kind ) {
    case MUL      -> " * ";
    case FLOORDIV -> " floordiv ";
    case CEILDIV  -> " ceildiv ";
    case MOD      -> " mod ";
    case ADD      -> " + ";
    case SYM, DIM, CON -> throw TODO("not a binary op: "+kind);
    };
  }

  // Add prints subtraction sugar.  Only the immediate right-hand side is
  // inspected; negative terms deeper down print as additions.
  private SB printAdd( SB sb, AffineBin add ) {
    print(sb.p('('),add._lhs);

    // x + (y * -c)  ==>  x - (y * c)
    if( add._rhs instanceof AffineBin mul && mul._kind==AffineExpr.Kind.MUL &&
        mul._rhs instanceof AffineCon k && k._con < 0 )
      return print(sb.p(" - ("),mul._lhs).p(" * ").p(abs(k._con)).p("))");

    // x + -c  ==>  x - c
    if( add._rhs instanceof AffineCon c && c._con < 0 )
      return sb.p(" - ").p(abs(c._con)).p(')');

    return print(sb.p(" + "),add._rhs).p(')');
  }

  // Magnitude of a negative constant, as text; Long.MIN_VALUE has no positive long
  private static String abs( long c ) { return Long.toString(c).substring(1); }
}
