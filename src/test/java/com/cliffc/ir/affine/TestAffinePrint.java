package com.cliffc.ir.affine;

import org.junit.Test;

import static com.cliffc.ir.affine.AffineExpr.*;
import static org.junit.Assert.assertEquals;

public class TestAffinePrint {
  @Test public void testLeaves() {
    assertEquals("d0", dim(0).toString());
    assertEquals("s3", sym(3).toString());
    assertEquals("42", con(42).toString());
    assertEquals("-7", con(-7).toString());
  }

  @Test public void testBinops() {
    assertEquals("(d0 * s1)"       , mul     (dim(0),sym(1)).toString());
    assertEquals("(d0 floordiv 4)" , floorDiv(dim(0),con(4)).toString());
    assertEquals("(d0 ceildiv 4)"  , ceilDiv (dim(0),con(4)).toString());
    assertEquals("(d1 mod 8)"      , mod     (dim(1),con(8)).toString());
    // Negative constants outside an add print as-is
    assertEquals("(d0 * -3)"       , mul     (dim(0),con(-3)).toString());
  }

  @Test public void testAddSugar() {
    assertEquals("(d0 - 5)"       , add(dim(0),con(-5)).toString());
    assertEquals("(d0 - (s0 * 3))", add(dim(0),mul(sym(0),con(-3))).toString());
    assertEquals("(d0 + d1)"      , add(dim(0),dim(1)).toString());
    assertEquals("(d0 + 5)"       , add(dim(0),con(5)).toString());
    assertEquals("(d0 + (s0 * 3))", add(dim(0),mul(sym(0),con(3))).toString());
    // Only the right-hand side is rewritten
    assertEquals("(-5 + d0)"      , add(con(-5),dim(0)).toString());
    // Constant on the left of the product is not looked at
    assertEquals("(d0 + (-3 * s0))", add(dim(0),mul(con(-3),sym(0))).toString());
    // Other ops with a negative constant are not rewritten
    assertEquals("(d0 + (s0 floordiv -3))", add(dim(0),floorDiv(sym(0),con(-3))).toString());
    // Most negative constant has no positive long
    assertEquals("(d0 - 9223372036854775808)", add(dim(0),con(Long.MIN_VALUE)).toString());
    assertEquals("(d0 - (s0 * 9223372036854775808))", add(dim(0),mul(sym(0),con(Long.MIN_VALUE))).toString());
  }

  @Test public void testMapOwnsResults() {
    AffineExpr[] rs = {dim(0),dim(1)};
    AffineExpr[] sizes = {con(4),con(8)};
    AffineMap map = AffineMap.makeBounded(2,0,rs,sizes);
    rs[0] = con(7);
    sizes[1] = sym(0);
    assertEquals("(d0, d1) -> (d0, d1) size (4, 8)", map.toString());
  }

  @Test public void testAddSugarOneLevel() {
    // Inner adds get their own sugar, but the outer add does not look deeper
    assertEquals("(d0 + (d1 - 2))", add(dim(0),add(dim(1),con(-2))).toString());
    assertEquals("(d0 + ((s0 * -3) + 1))", add(dim(0),add(mul(sym(0),con(-3)),con(1))).toString());
    assertEquals("((d0 - 1) - (d1 * 2))", add(add(dim(0),con(-1)),mul(dim(1),con(-2))).toString());
  }

  @Test public void testSharedSubtree() {
    AffineExpr x = add(dim(0),con(-1));
    assertEquals("((d0 - 1) * (d0 - 1))", mul(x,x).toString());
  }

  @Test public void testMaps() {
    assertEquals("(d0, d1) -> (d0, d1)", AffineMap.make(2,0,dim(0),dim(1)).toString());
    assertEquals("() -> (0)", AffineMap.make(0,0,con(0)).toString());
    assertEquals("(d0) [s0, s1] -> ((d0 + s1))", AffineMap.make(1,2,add(dim(0),sym(1))).toString());
    assertEquals("() [s0] -> (s0)", AffineMap.make(0,1,sym(0)).toString());
  }

  @Test public void testBoundedMap() {
    AffineMap map = AffineMap.makeBounded(2,1,
                                          new AffineExpr[]{add(dim(0),mul(dim(1),con(-1))),dim(1)},
                                          new AffineExpr[]{con(10),sym(0)});
    assertEquals("(d0, d1) [s0] -> ((d0 - (d1 * 1)), d1) size (10, s0)", map.toString());
  }

  @Test(expected=AssertionError.class)
  public void testNoResults() {
    AffineMap.make(1,0).toString();
  }
}
