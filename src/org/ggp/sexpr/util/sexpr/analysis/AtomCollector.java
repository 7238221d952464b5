package org.ggp.sexpr.util.sexpr.analysis;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.ggp.sexpr.util.sexpr.exceptions.TermShapeException;
import org.ggp.sexpr.util.sexpr.grammar.ReservedWords;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;

/**
 * Collects atoms and functors across a whole forest.  Results keep the order in which entries were first seen.
 */
public final class AtomCollector
{
  private AtomCollector()
  {
  }

  /**
   * @return every atom in the forest.  Variables and the rule connective are not atoms.
   *
   * @param xiForest - the top-level nodes.
   */
  public static Set<String> collectAtoms(List<? extends Sexpr> xiForest)
  {
    Set<String> lAtoms = new LinkedHashSet<>();
    for (Sexpr lNode : xiForest)
    {
      lNode.collectAtoms(lAtoms);
    }
    return lAtoms;
  }

  /**
   * @return every atom in the forest that appears somewhere other than functor position.
   *
   * @param xiForest - the top-level nodes.
   *
   * @throws TermShapeException if any list in the forest isn't a compound term.
   */
  public static Set<String> collectNonFunctorAtoms(List<? extends Sexpr> xiForest) throws TermShapeException
  {
    Set<String> lAtoms = new LinkedHashSet<>();
    for (Sexpr lNode : xiForest)
    {
      lNode.collectNonFunctorAtoms(lAtoms);
    }
    return lAtoms;
  }

  /**
   * @return functor name to arity for every functor in the forest.  Where a functor is used with more than one
   *         arity, the last one seen wins (and a warning is logged).
   *
   * @param xiForest - the top-level nodes.
   *
   * @throws TermShapeException if any list in the forest isn't a compound term.
   */
  public static Map<String, Integer> collectFunctorAtoms(List<? extends Sexpr> xiForest) throws TermShapeException
  {
    Map<String, Integer> lFunctors = new LinkedHashMap<>();
    for (Sexpr lNode : xiForest)
    {
      lNode.collectFunctorAtoms(lFunctors);
    }
    return lFunctors;
  }

  /**
   * @return the functors in the forest that aren't GDL keywords, with their arities.
   *
   * @param xiForest - the top-level nodes.
   *
   * @throws TermShapeException if any list in the forest isn't a compound term.
   */
  public static Map<String, Integer> collectUserDefinedFunctors(List<? extends Sexpr> xiForest)
    throws TermShapeException
  {
    Map<String, Integer> lFunctors = collectFunctorAtoms(xiForest);
    lFunctors.keySet().removeAll(ReservedWords.KEYWORDS);
    return lFunctors;
  }
}
