package com.cliffc.ir.print;

import com.cliffc.ir.affine.AffineMap;
import com.cliffc.ir.attr.*;
import com.cliffc.ir.module.*;
import com.cliffc.ir.type.*;
import org.junit.Test;

import static com.cliffc.ir.affine.AffineExpr.*;
import static org.junit.Assert.*;

public class TestModulePrint {
  private AffineMap _m0, _m1;

  private IRModule build() {
    _m0 = AffineMap.make(1,0,dim(0));
    _m1 = AffineMap.make(2,1,add(dim(0),sym(0)),dim(1));
    IRModule m = new IRModule();
    TypeMemRef mem = TypeMemRef.make(new int[]{4,Type.UNKNOWN},TypeFlt.F32,new AffineMap[]{_m1},0);
    m.add(new ExtFunc("ext", TypeFun.make(new Type[]{mem})));
    CFGFunc main = m.add(new CFGFunc("main", TypeFun.make(TypeFun.NONE)));
    Block bb = main.addBlock();
    Op load = bb.add(new Op("load", null, TypeInt.I32)
                     .addAttr("map", AttrMap.make(_m0))
                     .addAttr("more", AttrAry.make(AttrMap.make(_m1),AttrInt.make(1))));
    bb.setTerm(new Return(load.result(0)));
    return m;
  }

  private static final String EXPECT =
    "#map0 = (d0, d1) [s0] -> ((d0 + s0), d1)\n"+
    "#map1 = (d0) -> (d0)\n"+
    "extfunc @ext(memref<4x?xf32, #map0, 0>)\n"+
    "cfgfunc @main() {\n"+
    "bb0:\n"+
    "  %0 = \"load\"(){map: #map1, more: [#map0, 1]} : () -> i32\n"+
    "  return %0 : i32\n"+
    "}\n\n";

  @Test public void testModule() {
    assertEquals(EXPECT, build().toString());
  }

  @Test public void testIdempotent() {
    IRModule m = build();
    String s0 = m.toString();
    String s1 = m.toString();
    assertEquals(s0, s1);
    assertEquals(s0, AsmPrinter.print(m));
  }

  @Test public void testHoistingComplete() {
    String s = build().toString();
    // One definition per map, and every use names it
    assertEquals(s.indexOf("#map0 = "), s.lastIndexOf("#map0 = "));
    assertEquals(s.indexOf("#map1 = "), s.lastIndexOf("#map1 = "));
    assertFalse(s.contains("#map2"));
    assertEquals(1, s.split("\\(d0\\) -> \\(d0\\)", -1).length-1);
  }

  @Test public void testFunctionAloneInlinesMaps() {
    IRModule m = build();
    assertEquals("extfunc @ext(memref<4x?xf32, (d0, d1) [s0] -> ((d0 + s0), d1), 0>)\n", m._funcs.at(0).toString());
  }

  @Test public void testDeclarations() {
    IRModule m = new IRModule();
    m.add(new ExtFunc("none", TypeFun.make(TypeFun.NONE)));
    m.add(new ExtFunc("one" , TypeFun.make(new Type[]{TypeInt.I32,TypeIndex.INDEX},TypeFlt.F32)));
    m.add(new ExtFunc("two" , TypeFun.make(new Type[]{TypeTensor.make(TypeFlt.F32,2,3)},TypeInt.I1,TypeVec.make(TypeFlt.F16,4))));
    assertEquals("extfunc @none()\n"+
                 "extfunc @one(i32, affineint) -> f32\n"+
                 "extfunc @two(tensor<2x3xf32>) -> (i1, vector<4xf16>)\n", m.toString());
  }

  @Test public void testEmptyModule() {
    assertEquals("", new IRModule().toString());
  }

  @Test public void testHoistOrderById() {
    // Many maps; definitions must come out in id order
    IRModule m = new IRModule();
    AffineMap[] maps = new AffineMap[20];
    for( int i=0; i<maps.length; i++ ) maps[i] = AffineMap.make(1,0,add(dim(0),con(i)));
    m.add(new ExtFunc("f", TypeFun.make(new Type[]{TypeMemRef.make(new int[]{1},TypeFlt.F32,maps,0)})));
    String[] lines = m.toString().split("\n");
    for( int i=0; i<maps.length; i++ )
      assertEquals("#map"+i+" = (d0) -> ((d0 + "+i+"))", lines[i]);
  }
}
