package org.ggp.sexpr.util.sexpr.grammar;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.sexpr.util.sexpr.exceptions.TermShapeException;

import com.google.common.collect.ImmutableList;

/**
 * A parenthesised group of nodes.  The group may be empty.
 *
 * See {@link Sexpr} for the terminology.
 */
@SuppressWarnings("serial")
public final class SexprList extends Sexpr
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final ImmutableList<Sexpr> mChildren;

  /**
   * Create a list.
   *
   * @param xiChildren - the children, in order.  The list is copied.
   */
  public SexprList(List<? extends Sexpr> xiChildren)
  {
    mChildren = ImmutableList.copyOf(xiChildren);
  }

  public List<Sexpr> getChildren()
  {
    return mChildren;
  }

  public int size()
  {
    return mChildren.size();
  }

  public Sexpr get(int xiIndex)
  {
    return mChildren.get(xiIndex);
  }

  @Override
  public boolean isLeaf()
  {
    return false;
  }

  @Override
  public boolean isVariable()
  {
    return false;
  }

  @Override
  public boolean isRuleConnective()
  {
    return false;
  }

  @Override
  public boolean isRule()
  {
    return (!mChildren.isEmpty()) && mChildren.get(0).isRuleConnective();
  }

  /**
   * @return whether this list has the shape of a compound term - a leading token and at least one argument.
   */
  public boolean isCompound()
  {
    return (mChildren.size() >= 2) && mChildren.get(0).isLeaf();
  }

  /**
   * Check that this list has the shape of a compound term.
   *
   * @throws TermShapeException if it doesn't.
   */
  public void checkCompound() throws TermShapeException
  {
    if (mChildren.size() < 2)
    {
      throw new TermShapeException("Compound term must have a functor and one or more arguments", this);
    }
    if (!mChildren.get(0).isLeaf())
    {
      throw new TermShapeException("Compound term must start with functor", this);
    }
  }

  /**
   * @return the functor of this compound term.
   *
   * @throws TermShapeException if this list isn't a compound term.
   */
  public SexprAtom getFunctor() throws TermShapeException
  {
    checkCompound();
    return (SexprAtom)mChildren.get(0);
  }

  /**
   * @return the arguments of this compound term.
   *
   * @throws TermShapeException if this list isn't a compound term.
   */
  public List<Sexpr> getArguments() throws TermShapeException
  {
    checkCompound();
    return mChildren.subList(1, mChildren.size());
  }

  /**
   * @return the number of arguments of this compound term.
   *
   * @throws TermShapeException if this list isn't a compound term.
   */
  public int arity() throws TermShapeException
  {
    checkCompound();
    return mChildren.size() - 1;
  }

  /**
   * @return the head of this rule.
   *
   * @throws TermShapeException if this isn't a rule or it has no head.
   */
  public Sexpr getHead() throws TermShapeException
  {
    checkRule();
    if (mChildren.size() < 2)
    {
      throw new TermShapeException("Rule clause must have head", this);
    }
    return mChildren.get(1);
  }

  /**
   * @return the body literals of this rule (possibly none).
   *
   * @throws TermShapeException if this isn't a rule.
   */
  public List<Sexpr> getBody() throws TermShapeException
  {
    checkRule();
    if (mChildren.size() < 3)
    {
      return ImmutableList.of();
    }
    return mChildren.subList(2, mChildren.size());
  }

  private void checkRule() throws TermShapeException
  {
    if (!isRule())
    {
      throw new TermShapeException("Not a rule", this);
    }
  }

  @Override
  public String toSexpr()
  {
    return "(" + childrenToSexpr() + ")";
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append("non-leaf[" + mChildren.size() + "](");
    for (Sexpr lChild : mChildren)
    {
      lBuilder.append(' ');
      lBuilder.append(lChild.toString());
    }
    lBuilder.append(" )");
    return lBuilder.toString();
  }

  @Override
  public Sexpr replaceAtoms(String xiBefore, String xiAfter)
  {
    ImmutableList.Builder<Sexpr> lChildren = ImmutableList.builder();
    for (Sexpr lChild : mChildren)
    {
      lChildren.add(lChild.replaceAtoms(xiBefore, xiAfter));
    }
    return new SexprList(lChildren.build());
  }

  @Override
  public Sexpr replaceAtoms(Map<String, String> xiMapping)
  {
    ImmutableList.Builder<Sexpr> lChildren = ImmutableList.builder();
    for (Sexpr lChild : mChildren)
    {
      lChildren.add(lChild.replaceAtoms(xiMapping));
    }
    return new SexprList(lChildren.build());
  }

  @Override
  public void collectAtoms(Set<String> xbAtoms)
  {
    for (Sexpr lChild : mChildren)
    {
      lChild.collectAtoms(xbAtoms);
    }
  }

  @Override
  public void collectNonFunctorAtoms(Set<String> xbAtoms) throws TermShapeException
  {
    checkCompound();

    // Skip the functor.
    for (int lii = 1; lii < mChildren.size(); lii++)
    {
      mChildren.get(lii).collectNonFunctorAtoms(xbAtoms);
    }
  }

  @Override
  public void collectFunctorAtoms(Map<String, Integer> xbFunctors) throws TermShapeException
  {
    SexprAtom lFunctor = getFunctor();
    if (!lFunctor.isRuleConnective())
    {
      int lArity = mChildren.size() - 1;
      Integer lPrevious = xbFunctors.put(lFunctor.getValue(), lArity);
      if ((lPrevious != null) && (lPrevious != lArity))
      {
        LOGGER.warn("Functor " + lFunctor.getValue() + " used with arity " + lPrevious + " and " + lArity +
                    " - keeping " + lArity);
      }
    }

    // Only lists in argument position can contribute further functors.
    for (int lii = 1; lii < mChildren.size(); lii++)
    {
      Sexpr lChild = mChildren.get(lii);
      if (!lChild.isLeaf())
      {
        lChild.collectFunctorAtoms(xbFunctors);
      }
    }
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof SexprList))
    {
      return false;
    }
    return mChildren.equals(((SexprList)xiOther).mChildren);
  }

  @Override
  public int hashCode()
  {
    return 31 + mChildren.hashCode();
  }

  /**
   * @return the canonical text of the children, without the enclosing parentheses.
   */
  public String childrenToSexpr()
  {
    String[] lRendered = new String[mChildren.size()];
    for (int lii = 0; lii < lRendered.length; lii++)
    {
      lRendered[lii] = mChildren.get(lii).toSexpr();
    }
    return StringUtils.join(lRendered, ' ');
  }
}
