package org.ggp.sexpr.util.sexpr.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;

/**
 * Two argument slots that take values from the same domain, because one variable fills both of them in a rule.
 * The pair is ordered.
 */
public final class ArgPosPair implements Comparable<ArgPosPair>
{
  private final ArgPos mFirst;
  private final ArgPos mSecond;

  public ArgPosPair(ArgPos xiFirst, ArgPos xiSecond)
  {
    mFirst = Preconditions.checkNotNull(xiFirst);
    mSecond = Preconditions.checkNotNull(xiSecond);
  }

  public ArgPos getFirst()
  {
    return mFirst;
  }

  public ArgPos getSecond()
  {
    return mSecond;
  }

  @Override
  public int compareTo(ArgPosPair xiOther)
  {
    return ComparisonChain.start()
                          .compare(mFirst, xiOther.mFirst)
                          .compare(mSecond, xiOther.mSecond)
                          .result();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof ArgPosPair))
    {
      return false;
    }
    ArgPosPair lOther = (ArgPosPair)xiOther;
    return mFirst.equals(lOther.mFirst) && mSecond.equals(lOther.mSecond);
  }

  @Override
  public int hashCode()
  {
    return mFirst.hashCode() * 31 + mSecond.hashCode();
  }

  @Override
  public String toString()
  {
    return "(" + mFirst + ", " + mSecond + ")";
  }
}
