package org.ggp.sexpr.util.sexpr.grammar;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.ggp.sexpr.util.sexpr.exceptions.TermShapeException;

/**
 * Class at the root of the S-expression hierarchy.  Every node of a parsed rulesheet is either an {@link SexprAtom}
 * (a single token) or an {@link SexprList} (a parenthesised group of nodes).  Nodes are immutable.
 *
 * <h1>Terminology</h1>
 *
 * <ul>
 *   <li><b>Atom</b>: a token that is neither a variable nor the rule connective <code>&lt;=</code>.  Numbers are atoms.
 *   <li><b>Variable</b>: a token starting with <code>?</code>.
 *   <li><b>Compound term</b>: a list whose first child is a token (the <i>functor</i>) and which has at least one
 *       further child (the <i>arguments</i>).  The <i>arity</i> is the number of arguments.
 *   <li><b>Rule</b>: a compound term whose functor is <code>&lt;=</code>.  Child 1 is the head and the remaining
 *       children are the body.
 *   <li><b>Forest</b>: the ordered list of top-level nodes read from one piece of text.
 * </ul>
 *
 * <p>So, in <code>(&lt;= (legal ?r (mark ?x)) (true (cell ?x b)))</code>, the whole thing is a rule with head
 * <code>(legal ?r (mark ?x))</code>.  <code>legal</code>, <code>mark</code>, <code>true</code> and
 * <code>cell</code> are functors, <code>b</code> is the only non-functor atom and <code>?r</code> and
 * <code>?x</code> are variables.
 */
@SuppressWarnings("serial")
public abstract class Sexpr implements Serializable
{
  /**
   * The rule connective.
   */
  public static final String RULE_CONNECTIVE = "<=";

  /**
   * Prefix that marks a token as a variable.
   */
  public static final char VARIABLE_PREFIX = '?';

  /**
   * @return whether this node is a single token.
   */
  public abstract boolean isLeaf();

  /**
   * @return whether this node is a variable token.
   */
  public abstract boolean isVariable();

  /**
   * @return whether this node is the token <code>&lt;=</code>.
   */
  public abstract boolean isRuleConnective();

  /**
   * @return the canonical S-expression text for this node.  Parsing the result produces an equal node.
   */
  public abstract String toSexpr();

  /**
   * @return a debug rendering that shows the shape of the tree.
   */
  @Override
  public abstract String toString();

  /**
   * @return a copy of this tree with every token equal to xiBefore replaced by xiAfter.
   *
   * @param xiBefore - the token to replace.
   * @param xiAfter  - the replacement.
   */
  public abstract Sexpr replaceAtoms(String xiBefore, String xiAfter);

  /**
   * @return a copy of this tree with every token that is a key of the mapping replaced by its value.
   *
   * @param xiMapping - the replacements to make.
   */
  public abstract Sexpr replaceAtoms(Map<String, String> xiMapping);

  /**
   * Add every atom in this tree to the specified set.
   *
   * @param xbAtoms - the set to add to.
   */
  public abstract void collectAtoms(Set<String> xbAtoms);

  /**
   * Add every atom that isn't in functor position to the specified set.
   *
   * @param xbAtoms - the set to add to.
   *
   * @throws TermShapeException if a list in this tree isn't a compound term.
   */
  public abstract void collectNonFunctorAtoms(Set<String> xbAtoms) throws TermShapeException;

  /**
   * Add the name and arity of every functor in this tree (other than the rule connective) to the specified map.  If
   * the map already has an entry for a functor, the arity seen here replaces it.
   *
   * @param xbFunctors - functor name to arity.
   *
   * @throws TermShapeException if a list in this tree isn't a compound term.
   */
  public abstract void collectFunctorAtoms(Map<String, Integer> xbFunctors) throws TermShapeException;

  /**
   * @return every atom in this tree.
   */
  public Set<String> collectAtoms()
  {
    Set<String> lAtoms = new LinkedHashSet<>();
    collectAtoms(lAtoms);
    return lAtoms;
  }

  /**
   * @return every atom in this tree that isn't in functor position.
   *
   * @throws TermShapeException if a list in this tree isn't a compound term.
   */
  public Set<String> collectNonFunctorAtoms() throws TermShapeException
  {
    Set<String> lAtoms = new LinkedHashSet<>();
    collectNonFunctorAtoms(lAtoms);
    return lAtoms;
  }

  /**
   * @return functor name to arity for every functor in this tree, in the order first seen.
   *
   * @throws TermShapeException if a list in this tree isn't a compound term.
   */
  public Map<String, Integer> collectFunctorAtoms() throws TermShapeException
  {
    Map<String, Integer> lFunctors = new LinkedHashMap<>();
    collectFunctorAtoms(lFunctors);
    return lFunctors;
  }

  /**
   * @return whether this node is a rule, i.e. a list that starts with <code>&lt;=</code>.
   */
  public boolean isRule()
  {
    return false;
  }

  /**
   * @return the canonical text of a whole forest, one top-level node per line.
   *
   * @param xiForest - the nodes.
   */
  public static String toSexpr(List<? extends Sexpr> xiForest)
  {
    StringBuilder lBuilder = new StringBuilder();
    for (Sexpr lNode : xiForest)
    {
      lBuilder.append(lNode.toSexpr());
      lBuilder.append('\n');
    }
    return lBuilder.toString();
  }
}
