package org.ggp.sexpr.util.sexpr.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.ggp.sexpr.util.sexpr.exceptions.TermShapeException;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;
import org.ggp.sexpr.util.sexpr.grammar.SexprAtom;
import org.ggp.sexpr.util.sexpr.grammar.SexprList;

import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.SetMultimap;

/**
 * Works out which argument slots are filled by which variables, and from that which slots must range over the same
 * values.
 *
 * In GDL, the only way that the domain of one argument becomes tied to the domain of another is through a variable
 * that fills both.  So, in <code>(&lt;= (next (cell ?x ?y)) (true (cell ?x ?z)) (succ ?z ?y))</code>, the variable
 * <code>?y</code> ties <code>cell/2</code> in the head to <code>succ/2</code> in the body, and <code>?z</code> ties
 * <code>cell/2</code> and <code>succ/1</code> within the body.
 */
public final class VariableArgAnalyser
{
  private VariableArgAnalyser()
  {
  }

  /**
   * @return variable name to the argument slots it fills, for a compound term and every compound term nested within
   *         it.
   *
   * @param xiTerm - the compound term.
   *
   * @throws TermShapeException if the term, or any list nested within it, isn't a compound term.
   */
  public static SetMultimap<String, ArgPos> collectVariableArgs(Sexpr xiTerm) throws TermShapeException
  {
    SetMultimap<String, ArgPos> lVariableArgs = newVariableArgMap();
    collectVariableArgs(xiTerm, lVariableArgs);
    return lVariableArgs;
  }

  private static void collectVariableArgs(Sexpr xiTerm,
                                          SetMultimap<String, ArgPos> xbVariableArgs) throws TermShapeException
  {
    if (xiTerm.isLeaf())
    {
      throw new TermShapeException("Expected a compound term", xiTerm);
    }

    SexprList lTerm = (SexprList)xiTerm;
    String lFunctor = lTerm.getFunctor().getValue();

    for (int lii = 1; lii < lTerm.size(); lii++)
    {
      Sexpr lArg = lTerm.get(lii);
      if (lArg.isLeaf())
      {
        if (lArg.isVariable())
        {
          xbVariableArgs.put(((SexprAtom)lArg).getValue(), new ArgPos(lFunctor, lii));
        }
      }
      else
      {
        collectVariableArgs(lArg, xbVariableArgs);
      }
    }
  }

  /**
   * @return every pair of argument slots that share a variable within the body of a rule.  Each pair is ordered
   *         so that the first slot sorts before the second (by functor name and then index).
   *
   * @param xiRule - the rule.
   *
   * @throws TermShapeException if xiRule isn't a rule, or a body literal isn't a compound term.
   */
  public static SortedSet<ArgPosPair> collectSameDomainArgsInBody(Sexpr xiRule) throws TermShapeException
  {
    SexprList lRule = checkRule(xiRule);
    SetMultimap<String, ArgPos> lBodyArgs = collectBodyVariableArgs(lRule);

    SortedSet<ArgPosPair> lPairs = new TreeSet<>();
    for (String lVariable : lBodyArgs.keySet())
    {
      // Values are held in sorted order.
      List<ArgPos> lPositions = new ArrayList<>(lBodyArgs.get(lVariable));
      for (int lii = 0; lii < lPositions.size() - 1; lii++)
      {
        for (int ljj = lii + 1; ljj < lPositions.size(); ljj++)
        {
          lPairs.add(new ArgPosPair(lPositions.get(lii), lPositions.get(ljj)));
        }
      }
    }
    return lPairs;
  }

  /**
   * @return every (head slot, body slot) pair that share a variable in a rule.  The set is empty if the rule has no
   *         head, no body, or its head is a bare token.
   *
   * @param xiRule - the rule.
   *
   * @throws TermShapeException if xiRule isn't a rule, or the head or a body literal isn't a compound term.
   */
  public static SortedSet<ArgPosPair> collectSameDomainArgsBetweenHeadAndBody(Sexpr xiRule)
    throws TermShapeException
  {
    SexprList lRule = checkRule(xiRule);
    SortedSet<ArgPosPair> lPairs = new TreeSet<>();

    // No head, no body, or a head with no arguments.
    if ((lRule.size() < 3) || lRule.get(1).isLeaf())
    {
      return lPairs;
    }
    Sexpr lHead = lRule.get(1);

    SetMultimap<String, ArgPos> lHeadArgs = collectVariableArgs(lHead);
    SetMultimap<String, ArgPos> lBodyArgs = collectBodyVariableArgs(lRule);

    for (String lVariable : lHeadArgs.keySet())
    {
      Collection<ArgPos> lBodyPositions = lBodyArgs.get(lVariable);
      for (ArgPos lHeadPos : lHeadArgs.get(lVariable))
      {
        for (ArgPos lBodyPos : lBodyPositions)
        {
          // Head first, body second.
          lPairs.add(new ArgPosPair(lHeadPos, lBodyPos));
        }
      }
    }
    return lPairs;
  }

  /**
   * @return the variable slots of all the compound literals in the body of a rule, merged.  Bare tokens in the body
   *         have no arguments and so contribute nothing.
   */
  private static SetMultimap<String, ArgPos> collectBodyVariableArgs(SexprList xiRule) throws TermShapeException
  {
    SetMultimap<String, ArgPos> lBodyArgs = newVariableArgMap();
    for (Sexpr lLiteral : xiRule.getBody())
    {
      if (!lLiteral.isLeaf())
      {
        collectVariableArgs(lLiteral, lBodyArgs);
      }
    }
    return lBodyArgs;
  }

  private static SexprList checkRule(Sexpr xiRule) throws TermShapeException
  {
    if (!xiRule.isRule())
    {
      throw new TermShapeException("Expected a rule", xiRule);
    }
    return (SexprList)xiRule;
  }

  private static SetMultimap<String, ArgPos> newVariableArgMap()
  {
    return MultimapBuilder.linkedHashKeys().treeSetValues().build();
  }
}
