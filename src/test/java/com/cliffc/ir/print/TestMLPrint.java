package com.cliffc.ir.print;

import com.cliffc.ir.IR;
import com.cliffc.ir.affine.AffineMap;
import com.cliffc.ir.attr.AttrMap;
import com.cliffc.ir.module.*;
import com.cliffc.ir.type.*;
import org.junit.Before;
import org.junit.Test;

import static com.cliffc.ir.affine.AffineExpr.*;
import static com.cliffc.ir.type.TypeInt.I32;
import static org.junit.Assert.assertEquals;

public class TestMLPrint {
  private MLFunc _fn;
  private ForStmt _inner;
  private Op _use;

  // for x = 0 to 10 {
  //   %1 = const
  //   for x = 1 to 20 step 2 { %3 = use %1, %2 }
  // }
  // if () { a } else { b %0 }
  @Before public void build() {
    _fn = new MLFunc("loops", TypeFun.make(TypeFun.NONE));
    ForStmt outer = _fn._body.add(new ForStmt(con(0),con(10)));
    Op c = new Op("const", null, I32);
    outer._body.add(c);
    _inner = outer._body.add(new ForStmt(con(1),con(20),con(2)));
    _use = new Op("use", new Value[]{c.result(0),_inner._iv}, I32);
    _inner._body.add(_use);
    IfStmt is = _fn._body.add(new IfStmt());
    is._then.add(new Op("a", null));
    is.makeElse().add(new Op("b", new Value[]{outer._iv}));
  }

  @Test public void testNesting() {
    assertEquals("mlfunc @loops() {\n"+
                 "  for x = 0 to 10 {\n"+
                 "    %1 = \"const\"() : () -> i32\n"+
                 "    for x = 1 to 20 step 2 {\n"+
                 "      %3 = \"use\"(%1, %2) : (i32, affineint) -> i32\n"+
                 "    }\n"+
                 "  }\n"+
                 "  if () {\n"+
                 "    \"a\"() : () -> ()\n"+
                 "  } else {\n"+
                 "    \"b\"(%0) : (affineint) -> ()\n"+
                 "  }\n"+
                 "  return\n"+
                 "}\n\n", _fn.toString());
  }

  @Test public void testEmptyBody() {
    MLFunc fn = new MLFunc("empty", TypeFun.make(new Type[]{TypeFlt.F32},TypeFlt.F32));
    assertEquals("mlfunc @empty(f32) -> f32 {\n  return\n}\n\n", fn.toString());
  }

  @Test public void testIfWithoutElse() {
    MLFunc fn = new MLFunc("cond", TypeFun.make(TypeFun.NONE));
    IfStmt is = fn._body.add(new IfStmt());
    is._then.add(new IfStmt());
    assertEquals("mlfunc @cond() {\n"+
                 "  if () {\n"+
                 "    if () {\n"+
                 "    }\n"+
                 "  }\n"+
                 "  return\n"+
                 "}\n\n", fn.toString());
  }

  @Test public void testBoundExprs() {
    MLFunc fn = new MLFunc("bounds", TypeFun.make(TypeFun.NONE));
    fn._body.add(new ForStmt(add(sym(0),con(-1)),mul(sym(1),con(4)),con(-1)));
    assertEquals("mlfunc @bounds() {\n"+
                 "  for x = (s0 - 1) to (s1 * 4) step -1 {\n"+
                 "  }\n"+
                 "  return\n"+
                 "}\n\n", fn.toString());
  }

  @Test public void testStatementsAlone() {
    assertEquals("for x = 1 to 20 step 2 {\n"+
                 "  %3 = \"use\"(%1, %2) : (i32, affineint) -> i32\n"+
                 "}", _inner.toString());
    assertEquals("%3 = \"use\"(%1, %2) : (i32, affineint) -> i32", _use.toString());
  }

  @Test public void testDetached() {
    ForStmt fs = new ForStmt(con(0),con(4));
    fs._body.add(new Op("x", new Value[]{fs._iv}, I32));
    assertEquals("for x = 0 to 4 {\n"+
                 "  "+IR.INVALID_VALUE+" = \"x\"("+IR.INVALID_VALUE+") : (affineint) -> i32\n"+
                 "}", fs.toString());
  }

  @Test public void testMultiResult() {
    MLFunc fn = new MLFunc("pair", TypeFun.make(TypeFun.NONE));
    Op two = new Op("two", null, I32, TypeFlt.F32);
    fn._body.add(two);
    fn._body.add(new Op("use", new Value[]{two.result(0),two.result(1)}));
    assertEquals("mlfunc @pair() {\n"+
                 "  %0 = \"two\"() : () -> (i32, f32)\n"+
                 "  \"use\"(%0#0, %0#1) : (i32, f32) -> ()\n"+
                 "  return\n"+
                 "}\n\n", fn.toString());
  }

  @Test public void testMapsInBodyPrintInline() {
    IRModule m = new IRModule();
    AffineMap sigmap = AffineMap.make(1,0,dim(0));
    AffineMap bodymap = AffineMap.make(1,0,mul(dim(0),con(2)));
    MLFunc fn = m.add(new MLFunc("f", TypeFun.make(new Type[]{TypeMemRef.make(new int[]{4},TypeFlt.F32,new AffineMap[]{sigmap},0)})));
    fn._body.add(new Op("x", null).addAttr("map", AttrMap.make(bodymap)));
    assertEquals("#map0 = (d0) -> (d0)\n"+
                 "mlfunc @f(memref<4xf32, #map0, 0>) {\n"+
                 "  \"x\"(){map: (d0) -> ((d0 * 2))} : () -> ()\n"+
                 "  return\n"+
                 "}\n\n", m.toString());
  }
}
