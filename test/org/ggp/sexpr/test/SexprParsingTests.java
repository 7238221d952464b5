package org.ggp.sexpr.test;

import java.util.List;

import org.ggp.sexpr.util.sexpr.exceptions.SexprFormatException;
import org.ggp.sexpr.util.sexpr.factory.SexprFactory;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;
import org.ggp.sexpr.util.sexpr.grammar.SexprAtom;
import org.ggp.sexpr.util.sexpr.grammar.SexprList;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

/**
 * Tests for building trees from text.
 */
public class SexprParsingTests extends Assert
{
  @Test
  public void testEmpty() throws Exception
  {
    assertTrue(SexprFactory.parse("").isEmpty());
    assertTrue(SexprFactory.parse(" \n\t").isEmpty());
    assertTrue(SexprFactory.parse("  \n\n\t\t").isEmpty());
    assertTrue(SexprFactory.parse(" \n\t \n\t").isEmpty());
    assertTrue(SexprFactory.parse("; nothing but a comment").isEmpty());
  }

  @Test
  public void testSingleLiteral() throws Exception
  {
    List<Sexpr> lNodes = SexprFactory.parse("a");
    assertEquals(1, lNodes.size());
    Sexpr lNode = lNodes.get(0);
    assertTrue(lNode.isLeaf());
    assertFalse(lNode.isVariable());
    assertEquals("a", ((SexprAtom)lNode).getValue());
  }

  @Test
  public void testEmptyParen() throws Exception
  {
    List<Sexpr> lNodes = SexprFactory.parse("()");
    assertEquals(1, lNodes.size());
    Sexpr lNode = lNodes.get(0);
    assertFalse(lNode.isLeaf());
    assertTrue(((SexprList)lNode).getChildren().isEmpty());
  }

  @Test
  public void testForestOrder() throws Exception
  {
    List<Sexpr> lNodes = SexprFactory.parse("a (b) (c   d)\n\t(e (f (g () h) i) j)");
    assertEquals(4, lNodes.size());
    assertEquals("a", lNodes.get(0).toSexpr());
    assertEquals("(b)", lNodes.get(1).toSexpr());
    assertEquals("(c d)", lNodes.get(2).toSexpr());
    assertEquals("(e (f (g () h) i) j)", lNodes.get(3).toSexpr());
  }

  @Test
  public void testLowerReservedWords() throws Exception
  {
    String lInput = "(ROLE INIT TRUE DOES LEGAL NEXT TERMINAL GOAL BASE INPUT OR NOT DISTINCT NOT_RESERVED)";
    String lAnswer = "(role init true does legal next terminal goal base input or not distinct NOT_RESERVED)";
    List<Sexpr> lNodes = SexprFactory.parse(lInput);
    assertEquals(1, lNodes.size());
    assertEquals(lAnswer, lNodes.get(0).toSexpr());
  }

  @Test
  public void testMixedCaseKeywordsAndAtoms() throws Exception
  {
    List<Sexpr> lNodes = SexprFactory.parse("(Legal Xplayer (Mark 1 1))");
    assertEquals("(legal Xplayer (Mark 1 1))", lNodes.get(0).toSexpr());
  }

  @Test
  public void testVariablesAndConnective() throws Exception
  {
    SexprList lRule = (SexprList)SexprFactory.parse("(<= (p ?x) (q ?x))").get(0);
    assertTrue(lRule.isRule());
    assertTrue(lRule.get(0).isRuleConnective());
    assertFalse(lRule.get(0).isVariable());
    Sexpr lVariable = ((SexprList)lRule.get(1)).get(1);
    assertTrue(lVariable.isLeaf());
    assertTrue(lVariable.isVariable());
    assertFalse(lVariable.isRuleConnective());
  }

  @Test
  public void testReparse() throws Exception
  {
    List<Sexpr> lNodes = SexprFactory.parse("(a (b (c) d) e)");
    assertEquals(1, lNodes.size());
    List<Sexpr> lAnother = SexprFactory.parse(lNodes.get(0).toSexpr());
    assertEquals(lNodes, lAnother);
  }

  @Test
  public void testFlattenTupleWithOneChild() throws Exception
  {
    List<Sexpr> lNodes = SexprFactory.parse("(((a)) (b (c) d) e)", true);
    List<Sexpr> lFlattened = SexprFactory.parse("(a (b c d) e)", true);
    assertEquals(1, lNodes.size());
    assertEquals(1, lFlattened.size());
    assertEquals(lFlattened, lNodes);
    assertEquals("(a (b c d) e)", lNodes.get(0).toSexpr());
  }

  @Test
  public void testFlattenTopLevel() throws Exception
  {
    assertEquals(ImmutableList.of(new SexprAtom("a")), SexprFactory.parseKif("((a))"));

    // Only single-child lists collapse.
    assertEquals("()", SexprFactory.parseKif("()").get(0).toSexpr());
  }

  @Test
  public void testNoFlattenByDefault() throws Exception
  {
    assertEquals("(((a)) (b (c) d) e)", SexprFactory.parse("(((a)) (b (c) d) e)").get(0).toSexpr());
  }

  @Test
  public void testStructuralEquality() throws Exception
  {
    Sexpr lLeaf = new SexprAtom("a");
    Sexpr lList = new SexprList(ImmutableList.of(new SexprAtom("a")));
    assertFalse(lLeaf.equals(lList));
    assertFalse(lList.equals(lLeaf));
    assertEquals(lList, SexprFactory.parse("(a)").get(0));
    assertEquals(lList.hashCode(), SexprFactory.parse("(a)").get(0).hashCode());
    assertFalse(SexprFactory.parse("(a b)").get(0).equals(SexprFactory.parse("(b a)").get(0)));
    assertEquals(new SexprAtom("DOES"), new SexprAtom("does"));
  }

  @Test
  public void testToString() throws Exception
  {
    assertEquals("leaf:a", SexprFactory.parse("a").get(0).toString());
    assertEquals("non-leaf[2]( leaf:a non-leaf[1]( leaf:b ) )", SexprFactory.parse("(a (b))").get(0).toString());
    assertEquals("non-leaf[0]( )", SexprFactory.parse("()").get(0).toString());
  }

  @Test
  public void testForestToSexpr() throws Exception
  {
    List<Sexpr> lNodes = SexprFactory.parse("a\n(b   c) ; comment\n()");
    assertEquals("a\n(b c)\n()\n", Sexpr.toSexpr(lNodes));
  }

  @Test
  public void testUnmatchedOpen()
  {
    try
    {
      SexprFactory.parse("(a (b)");
      fail("Expected unmatched '(' to be rejected");
    }
    catch (SexprFormatException lEx)
    {
      assertTrue(lEx.getMessage().contains("unmatched '('"));
      assertEquals(5, lEx.getTokenIndex());
    }
  }

  @Test
  public void testUnmatchedClose()
  {
    try
    {
      SexprFactory.parse("(a) b)");
      fail("Expected stray ')' to be rejected");
    }
    catch (SexprFormatException lEx)
    {
      assertTrue(lEx.getMessage().contains("Unmatched ')'"));
      assertEquals(4, lEx.getTokenIndex());
      assertEquals("(a) b)", lEx.getSource());
    }
  }

  @Test
  public void testDepthLimit() throws Exception
  {
    SexprFactory lFactory = new SexprFactory(false, 3);
    assertEquals("(((a)))", lFactory.create("(((a)))").get(0).toSexpr());

    try
    {
      lFactory.create("((((a))))");
      fail("Expected deep nesting to be rejected");
    }
    catch (SexprFormatException lEx)
    {
      assertEquals(3, lEx.getTokenIndex());
    }
  }

  @Test
  public void testDeepNestingWithinDefaultLimit() throws Exception
  {
    StringBuilder lBuilder = new StringBuilder();
    for (int lii = 0; lii < 500; lii++)
    {
      lBuilder.append("(f ");
    }
    lBuilder.append("x");
    for (int lii = 0; lii < 500; lii++)
    {
      lBuilder.append(')');
    }
    List<Sexpr> lNodes = SexprFactory.parse(lBuilder.toString());
    assertEquals(lBuilder.toString(), lNodes.get(0).toSexpr());
  }
}
