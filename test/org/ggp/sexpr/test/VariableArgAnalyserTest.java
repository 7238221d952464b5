package org.ggp.sexpr.test;

import java.util.SortedSet;

import org.ggp.sexpr.util.sexpr.analysis.ArgPos;
import org.ggp.sexpr.util.sexpr.analysis.ArgPosPair;
import org.ggp.sexpr.util.sexpr.analysis.VariableArgAnalyser;
import org.ggp.sexpr.util.sexpr.exceptions.TermShapeException;
import org.ggp.sexpr.util.sexpr.factory.SexprFactory;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SetMultimap;

public class VariableArgAnalyserTest extends Assert
{
  private static Sexpr parseOne(String xiText) throws Exception
  {
    return SexprFactory.parse(xiText).get(0);
  }

  private static ArgPosPair pair(String xiFunctor1, int xiIndex1, String xiFunctor2, int xiIndex2)
  {
    return new ArgPosPair(new ArgPos(xiFunctor1, xiIndex1), new ArgPos(xiFunctor2, xiIndex2));
  }

  @Test
  public void testCollectVariableArgs() throws Exception
  {
    SetMultimap<String, ArgPos> lArgs = VariableArgAnalyser.collectVariableArgs(parseOne("(does ?r (mark ?x ?r) ?x)"));
    assertEquals(ImmutableSet.of("?r", "?x"), lArgs.keySet());
    assertEquals(ImmutableSet.of(new ArgPos("does", 1), new ArgPos("mark", 2)), lArgs.get("?r"));
    assertEquals(ImmutableSet.of(new ArgPos("does", 3), new ArgPos("mark", 1)), lArgs.get("?x"));
  }

  @Test
  public void testGroundTermHasNoVariableArgs() throws Exception
  {
    assertTrue(VariableArgAnalyser.collectVariableArgs(parseOne("(cell 1 1 b)")).isEmpty());
  }

  @Test
  public void testSameDomainArgsInBody() throws Exception
  {
    Sexpr lRule = parseOne("(<= (next (cell ?x ?y)) (true (cell ?x ?z)) (succ ?z ?y))");
    assertEquals(ImmutableSet.of(pair("cell", 2, "succ", 1)), VariableArgAnalyser.collectSameDomainArgsInBody(lRule));
  }

  @Test
  public void testSameDomainArgsBetweenHeadAndBody() throws Exception
  {
    Sexpr lRule = parseOne("(<= (next (cell ?x ?y)) (true (cell ?x ?z)) (succ ?z ?y))");
    SortedSet<ArgPosPair> lPairs = VariableArgAnalyser.collectSameDomainArgsBetweenHeadAndBody(lRule);
    assertEquals(ImmutableList.of(pair("cell", 1, "cell", 1), pair("cell", 2, "succ", 2)),
                 ImmutableList.copyOf(lPairs));
  }

  @Test
  public void testPairsAreSortedWithinEachPair() throws Exception
  {
    // ?v is met in zeta before alpha, but each pair is ordered by functor name then index.
    Sexpr lRule = parseOne("(<= h (zeta ?v) (alpha ?v ?v) (mid ?v))");
    assertEquals(ImmutableList.of(pair("alpha", 1, "alpha", 2),
                                  pair("alpha", 1, "mid", 1),
                                  pair("alpha", 1, "zeta", 1),
                                  pair("alpha", 2, "mid", 1),
                                  pair("alpha", 2, "zeta", 1),
                                  pair("mid", 1, "zeta", 1)),
                 ImmutableList.copyOf(VariableArgAnalyser.collectSameDomainArgsInBody(lRule)));
  }

  @Test
  public void testRepeatedSlotGivesNoPair() throws Exception
  {
    Sexpr lRule = parseOne("(<= h (p ?x) (p ?x))");
    assertTrue(VariableArgAnalyser.collectSameDomainArgsInBody(lRule).isEmpty());
  }

  @Test
  public void testNoPairsWithoutHeadArgumentsOrBody() throws Exception
  {
    assertTrue(VariableArgAnalyser.collectSameDomainArgsBetweenHeadAndBody(parseOne("(<= (p ?x))")).isEmpty());
    assertTrue(VariableArgAnalyser.collectSameDomainArgsBetweenHeadAndBody(parseOne("(<= p (q ?x))")).isEmpty());
    assertTrue(VariableArgAnalyser.collectSameDomainArgsBetweenHeadAndBody(parseOne("(<=)")).isEmpty());
    assertTrue(VariableArgAnalyser.collectSameDomainArgsInBody(parseOne("(<=)")).isEmpty());
  }

  @Test
  public void testBareTokensInBodyAreIgnored() throws Exception
  {
    Sexpr lRule = parseOne("(<= (p ?x) open (q ?x))");
    assertEquals(ImmutableSet.of(pair("p", 1, "q", 1)),
                 VariableArgAnalyser.collectSameDomainArgsBetweenHeadAndBody(lRule));
  }

  @Test
  public void testNegatedLiterals() throws Exception
  {
    Sexpr lRule = parseOne("(<= (p ?x) (q ?x) (not (r ?x)))");
    assertEquals(ImmutableSet.of(pair("q", 1, "r", 1)), VariableArgAnalyser.collectSameDomainArgsInBody(lRule));
  }

  @Test(expected = TermShapeException.class)
  public void testNotARule() throws Exception
  {
    VariableArgAnalyser.collectSameDomainArgsInBody(parseOne("(p ?x)"));
  }

  @Test(expected = TermShapeException.class)
  public void testMalformedBodyLiteral() throws Exception
  {
    VariableArgAnalyser.collectSameDomainArgsInBody(parseOne("(<= (p ?x) (q ?x) ())"));
  }
}
