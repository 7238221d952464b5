package org.ggp.sexpr.test;

import java.util.LinkedList;
import java.util.List;

import org.ggp.sexpr.util.sexpr.factory.SexprFactory;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Check that writing a forest out as canonical text and reading it back in gives the same forest.
 */
@RunWith(Parameterized.class)
public class RoundTripTest extends Assert
{
  @Parameters(name="{0}")
  public static Iterable<? extends Object> data()
  {
    LinkedList<Object[]> lTests = new LinkedList<>();

    lTests.add(new Object[] {"atom",       "a"});
    lTests.add(new Object[] {"empty",      "()"});
    lTests.add(new Object[] {"nested",     "(a (b (c) d) e)"});
    lTests.add(new Object[] {"forest",     "a (b) (c   d)\n\t(e (f (g () h) i) j)"});
    lTests.add(new Object[] {"keywords",   "(ROLE xplayer) (INIT (Cell 1 1 B))"});
    lTests.add(new Object[] {"comments",   "; tic-tac-toe\n(role x) ; first\n(role o)"});
    lTests.add(new Object[] {"rule",       "(<= (legal ?r (mark ?x ?y)) (true (cell ?x ?y b)) (true (control ?r)))"});
    lTests.add(new Object[] {"negation",   "(<= terminal (not open) (distinct ?a ?b))"});
    lTests.add(new Object[] {"whitespace", "\r\n  (a\tb)\r\n"});

    return lTests;
  }

  @Parameter(value = 0) public String mName;
  @Parameter(value = 1) public String mText;

  @Test
  public void testRoundTrip() throws Exception
  {
    List<Sexpr> lParsed = SexprFactory.parse(mText);
    List<Sexpr> lReparsed = SexprFactory.parse(Sexpr.toSexpr(lParsed));
    assertEquals(lParsed, lReparsed);

    // Canonical text is a fixed point.
    assertEquals(Sexpr.toSexpr(lParsed), Sexpr.toSexpr(lReparsed));
  }

  @Test
  public void testRoundTripFlattened() throws Exception
  {
    List<Sexpr> lParsed = SexprFactory.parseKif(mText);
    assertEquals(lParsed, SexprFactory.parseKif(Sexpr.toSexpr(lParsed)));
  }
}
