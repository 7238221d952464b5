package org.ggp.sexpr.util.prolog;

import org.ggp.sexpr.util.config.TranslatorConfiguration;
import org.ggp.sexpr.util.config.TranslatorConfiguration.CfgItem;

import com.google.common.base.Preconditions;

/**
 * How atoms and functors are written when translating to Prolog, and whether helper clauses are added.  Immutable.
 */
public final class PrologOptions
{
  /**
   * No quoting, no prefixes, no helper clauses.
   */
  public static final PrologOptions DEFAULT = new PrologOptions(false, "", "", false);

  private final boolean mQuoteAtoms;
  private final String mFunctorPrefix;
  private final String mAtomPrefix;
  private final boolean mAddHelperClauses;

  /**
   * @param xiQuoteAtoms       - whether atoms and functors are single-quoted.
   * @param xiFunctorPrefix    - prefix for every functor.
   * @param xiAtomPrefix       - prefix for every non-variable atom.
   * @param xiAddHelperClauses - whether to append helper clauses to a translated forest.
   */
  public PrologOptions(boolean xiQuoteAtoms,
                       String xiFunctorPrefix,
                       String xiAtomPrefix,
                       boolean xiAddHelperClauses)
  {
    mQuoteAtoms = xiQuoteAtoms;
    mFunctorPrefix = Preconditions.checkNotNull(xiFunctorPrefix);
    mAtomPrefix = Preconditions.checkNotNull(xiAtomPrefix);
    mAddHelperClauses = xiAddHelperClauses;
  }

  /**
   * @return options built from the translator configuration.
   */
  public static PrologOptions fromConfiguration()
  {
    return new PrologOptions(TranslatorConfiguration.getCfgBool(CfgItem.QUOTE_ATOMS),
                             TranslatorConfiguration.getCfgStr(CfgItem.FUNCTOR_PREFIX),
                             TranslatorConfiguration.getCfgStr(CfgItem.ATOM_PREFIX),
                             TranslatorConfiguration.getCfgBool(CfgItem.ADD_HELPER_CLAUSES));
  }

  public boolean isQuoteAtoms()
  {
    return mQuoteAtoms;
  }

  public String getFunctorPrefix()
  {
    return mFunctorPrefix;
  }

  public String getAtomPrefix()
  {
    return mAtomPrefix;
  }

  public boolean isAddHelperClauses()
  {
    return mAddHelperClauses;
  }

  public PrologOptions withQuoteAtoms(boolean xiQuoteAtoms)
  {
    return new PrologOptions(xiQuoteAtoms, mFunctorPrefix, mAtomPrefix, mAddHelperClauses);
  }

  public PrologOptions withFunctorPrefix(String xiFunctorPrefix)
  {
    return new PrologOptions(mQuoteAtoms, xiFunctorPrefix, mAtomPrefix, mAddHelperClauses);
  }

  public PrologOptions withAtomPrefix(String xiAtomPrefix)
  {
    return new PrologOptions(mQuoteAtoms, mFunctorPrefix, xiAtomPrefix, mAddHelperClauses);
  }

  public PrologOptions withHelperClauses(boolean xiAddHelperClauses)
  {
    return new PrologOptions(mQuoteAtoms, mFunctorPrefix, mAtomPrefix, xiAddHelperClauses);
  }

  @Override
  public String toString()
  {
    return "quote=" + mQuoteAtoms + ", functor prefix='" + mFunctorPrefix + "', atom prefix='" + mAtomPrefix +
           "', helpers=" + mAddHelperClauses;
  }
}
