package com.cliffc.ir.print;

import com.cliffc.ir.affine.AffineExpr;
import com.cliffc.ir.affine.AffineMap;
import com.cliffc.ir.attr.Attr;
import com.cliffc.ir.module.*;
import com.cliffc.ir.type.Type;
import com.cliffc.ir.util.SB;
import org.jetbrains.annotations.NotNull;

/** Entry points for printing IR to text.
 *
 *  Only a whole module gets the affine map pre-pass; everything else prints
 *  with an empty map table, so maps print inline.  Blocks, operations and
 *  statements are printed with the numbering of their whole function, so
 *  the ids match what the full function print shows.
 *
 *  Every call makes its own state; calls may run concurrently on IR that is
 *  not being changed.
 */
public abstract class AsmPrinter {

  public static String print( @NotNull IRModule module ) {
    ModuleState state = new ModuleState(module.opSet()).initialize(module);
    return new ModulePrinter(state).print(new SB(),module).toString();
  }

  public static String print( @NotNull Func fn ) {
    return printer(fn.opSet()).print(new SB(),fn).toString();
  }

  public static String print( @NotNull Type t ) { return printer(null).print(new SB(),t).toString(); }
  public static String print( @NotNull Attr a ) { return printer(null).print(new SB(),a).toString(); }
  public static String print( @NotNull AffineExpr e ) { return printer(null).print(new SB(),e).toString(); }
  public static String print( @NotNull AffineMap map ) { return printer(null).print(new SB(),map).toString(); }

  public static String print( @NotNull Block bb ) {
    CFGFunc fn = bb._fn;
    return new CFGFuncPrinter(fn,printer(fn.opSet())).print(new SB(),bb).toString();
  }

  public static String print( @NotNull Stmt s ) {
    MLFunc fn = s.func();
    return new MLFuncPrinter(fn,printer(fn==null ? null : fn.opSet())).print(new SB(),s).toString();
  }

  // Operations in a block print with their indent, as in the block.
  // Operations in no function print every operand as a sentinel.
  public static String print( @NotNull Op op ) {
    if( op.block() != null )
      return print(op.block()._fn,op);
    MLFunc fn = op.stmt()==null ? null : op.stmt().func();
    MLFuncPrinter mlp = new MLFuncPrinter(fn,printer(fn==null ? null : fn.opSet()));
    return mlp.printOperation(new SB(),op).toString();
  }
  private static String print( CFGFunc fn, Op op ) {
    return new CFGFuncPrinter(fn,printer(fn.opSet())).print(new SB(),op).toString();
  }

  private static ModulePrinter printer( OpSet ops ) { return new ModulePrinter(new ModuleState(ops)); }
}
