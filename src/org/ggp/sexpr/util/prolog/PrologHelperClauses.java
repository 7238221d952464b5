package org.ggp.sexpr.util.prolog;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedSet;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.sexpr.util.sexpr.analysis.ArgPos;
import org.ggp.sexpr.util.sexpr.analysis.ArgPosPair;
import org.ggp.sexpr.util.sexpr.analysis.AtomCollector;
import org.ggp.sexpr.util.sexpr.analysis.VariableArgAnalyser;
import org.ggp.sexpr.util.sexpr.exceptions.TermShapeException;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;

/**
 * Generates the clauses that describe a rulesheet's structure for Prolog-side analysis.
 *
 * <ul>
 *   <li><code>user_defined_functor(F, Arity).</code> for every functor that isn't a GDL keyword.
 *   <li><code>equivalent_args(F1, P1, F2, P2).</code> when a variable fills slot P1 of F1 in the head of a rule and
 *       slot P2 of F2 in its body.
 *   <li><code>connected_args(F1, P1, F2, P2).</code> when a variable fills both slots within the body of a rule, and
 *       the pair isn't already an <code>equivalent_args</code>.
 * </ul>
 */
public class PrologHelperClauses
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final PrologTranslator mTranslator;

  /**
   * @param xiTranslator - the translator whose functor naming the helper clauses should match.
   */
  public PrologHelperClauses(PrologTranslator xiTranslator)
  {
    mTranslator = xiTranslator;
  }

  /**
   * @return the helper clauses for a forest, one per line.
   *
   * @param xiForest - the top-level nodes.
   *
   * @throws TermShapeException if any list in the forest isn't a compound term.
   */
  public String generate(List<? extends Sexpr> xiForest) throws TermShapeException
  {
    StringBuilder lBuilder = new StringBuilder();

    Map<String, Integer> lFunctors = AtomCollector.collectUserDefinedFunctors(xiForest);
    for (Entry<String, Integer> lFunctor : lFunctors.entrySet())
    {
      lBuilder.append("user_defined_functor(")
              .append(mTranslator.convertToPrologFunctor(lFunctor.getKey()))
              .append(", ")
              .append(lFunctor.getValue())
              .append(").\n");
    }

    SortedSet<ArgPosPair> lInBody = new TreeSet<>();
    SortedSet<ArgPosPair> lHeadAndBody = new TreeSet<>();
    for (Sexpr lNode : xiForest)
    {
      if (lNode.isRule())
      {
        lInBody.addAll(VariableArgAnalyser.collectSameDomainArgsInBody(lNode));
        lHeadAndBody.addAll(VariableArgAnalyser.collectSameDomainArgsBetweenHeadAndBody(lNode));
      }
    }

    // Equivalence is the stronger relationship, so don't also report it as a connection.
    int lConnected = 0;
    for (ArgPosPair lPair : lInBody)
    {
      if (!lHeadAndBody.contains(lPair))
      {
        appendPair("connected_args", lPair, lBuilder);
        lConnected++;
      }
    }

    for (ArgPosPair lPair : lHeadAndBody)
    {
      appendPair("equivalent_args", lPair, lBuilder);
    }

    LOGGER.debug("Generated " + lFunctors.size() + " functor, " + lConnected + " connected and " +
                 lHeadAndBody.size() + " equivalent helper clauses");
    return lBuilder.toString();
  }

  private void appendPair(String xiPredicate, ArgPosPair xiPair, StringBuilder xbBuilder)
  {
    ArgPos lFirst = xiPair.getFirst();
    ArgPos lSecond = xiPair.getSecond();
    xbBuilder.append(xiPredicate)
             .append('(')
             .append(mTranslator.convertToPrologFunctor(lFirst.getFunctor()))
             .append(", ")
             .append(lFirst.getIndex())
             .append(", ")
             .append(mTranslator.convertToPrologFunctor(lSecond.getFunctor()))
             .append(", ")
             .append(lSecond.getIndex())
             .append(").\n");
  }
}
