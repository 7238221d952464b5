package org.ggp.sexpr.util.sexpr.grammar;

import java.util.Locale;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * The GDL keywords.  These are case-insensitive in rulesheets, so tokens matching one of them are lower-cased when
 * they are read.  Every other token is case-sensitive and kept as written.
 */
public final class ReservedWords
{
  /**
   * The keywords, in lower case.
   */
  public static final Set<String> KEYWORDS = ImmutableSet.of("role",
                                                             "init",
                                                             "true",
                                                             "does",
                                                             "legal",
                                                             "next",
                                                             "goal",
                                                             "terminal",
                                                             "input",
                                                             "base",
                                                             "or",
                                                             "not",
                                                             "distinct");

  private ReservedWords()
  {
  }

  /**
   * @return whether the specified token is a keyword (case-insensitive).
   *
   * @param xiToken - the token.
   */
  public static boolean isReserved(String xiToken)
  {
    return KEYWORDS.contains(xiToken.toLowerCase(Locale.ROOT));
  }

  /**
   * @return the token in lower case if it's a keyword, otherwise the token unchanged.
   *
   * @param xiToken - the token.
   */
  public static String normalise(String xiToken)
  {
    String lLowered = xiToken.toLowerCase(Locale.ROOT);
    if (KEYWORDS.contains(lLowered))
    {
      return lLowered;
    }
    return xiToken;
  }
}
