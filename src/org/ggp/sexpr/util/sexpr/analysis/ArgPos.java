package org.ggp.sexpr.util.sexpr.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;

/**
 * An argument slot: a functor name and the index of the argument within the compound term.  The index counts the
 * functor as position 0, so the first argument is at index 1.
 */
public final class ArgPos implements Comparable<ArgPos>
{
  private final String mFunctor;
  private final int mIndex;

  public ArgPos(String xiFunctor, int xiIndex)
  {
    mFunctor = Preconditions.checkNotNull(xiFunctor);
    mIndex = xiIndex;
  }

  public String getFunctor()
  {
    return mFunctor;
  }

  public int getIndex()
  {
    return mIndex;
  }

  @Override
  public int compareTo(ArgPos xiOther)
  {
    return ComparisonChain.start()
                          .compare(mFunctor, xiOther.mFunctor)
                          .compare(mIndex, xiOther.mIndex)
                          .result();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof ArgPos))
    {
      return false;
    }
    ArgPos lOther = (ArgPos)xiOther;
    return (mIndex == lOther.mIndex) && mFunctor.equals(lOther.mFunctor);
  }

  @Override
  public int hashCode()
  {
    return mFunctor.hashCode() * 31 + mIndex;
  }

  @Override
  public String toString()
  {
    return mFunctor + "/" + mIndex;
  }
}
