package org.ggp.sexpr.util.sexpr.grammar;

import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * A single token - an atom, a variable, a number or the rule connective.  Keywords are stored in lower case.
 *
 * See {@link Sexpr} for the terminology.
 */
@SuppressWarnings("serial")
public final class SexprAtom extends Sexpr
{
  private final String mValue;

  /**
   * Create a token.
   *
   * @param xiValue - the token text.  If it's a keyword (in any case) it is stored in lower case.
   */
  public SexprAtom(String xiValue)
  {
    Preconditions.checkNotNull(xiValue);
    Preconditions.checkArgument(!xiValue.isEmpty(), "Empty token");
    mValue = ReservedWords.normalise(xiValue);
  }

  public String getValue()
  {
    return mValue;
  }

  @Override
  public boolean isLeaf()
  {
    return true;
  }

  @Override
  public boolean isVariable()
  {
    return mValue.charAt(0) == VARIABLE_PREFIX;
  }

  @Override
  public boolean isRuleConnective()
  {
    return RULE_CONNECTIVE.equals(mValue);
  }

  /**
   * @return whether this token is an atom, i.e. neither a variable nor the rule connective.
   */
  public boolean isAtom()
  {
    return !isVariable() && !isRuleConnective();
  }

  @Override
  public String toSexpr()
  {
    return mValue;
  }

  @Override
  public String toString()
  {
    return "leaf:" + mValue;
  }

  @Override
  public Sexpr replaceAtoms(String xiBefore, String xiAfter)
  {
    if (mValue.equals(xiBefore))
    {
      return new SexprAtom(xiAfter);
    }
    return this;
  }

  @Override
  public Sexpr replaceAtoms(Map<String, String> xiMapping)
  {
    String lReplacement = xiMapping.get(mValue);
    if (lReplacement != null)
    {
      return new SexprAtom(lReplacement);
    }
    return this;
  }

  @Override
  public void collectAtoms(Set<String> xbAtoms)
  {
    if (isAtom())
    {
      xbAtoms.add(mValue);
    }
  }

  @Override
  public void collectNonFunctorAtoms(Set<String> xbAtoms)
  {
    // A bare token is never in functor position.
    collectAtoms(xbAtoms);
  }

  @Override
  public void collectFunctorAtoms(Map<String, Integer> xbFunctors)
  {
    // Not a compound term.
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof SexprAtom))
    {
      return false;
    }
    return mValue.equals(((SexprAtom)xiOther).mValue);
  }

  @Override
  public int hashCode()
  {
    return mValue.hashCode();
  }
}
