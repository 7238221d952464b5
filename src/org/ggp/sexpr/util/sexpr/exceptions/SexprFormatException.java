package org.ggp.sexpr.util.sexpr.exceptions;

/**
 * Thrown when text can't be turned into a forest of S-expressions - unbalanced parentheses or excessive nesting.
 */
public final class SexprFormatException extends SexprException
{
  private static final long serialVersionUID = 1L;

  private final String mSource;
  private final int mTokenIndex;

  /**
   * @param xiReason     - what went wrong.
   * @param xiSource     - the text being parsed (after comment removal).
   * @param xiTokenIndex - zero-based index of the token at which the problem was detected.
   */
  public SexprFormatException(String xiReason, String xiSource, int xiTokenIndex)
  {
    super(xiReason + " (at token " + xiTokenIndex + ")");
    mSource = xiSource;
    mTokenIndex = xiTokenIndex;
  }

  public String getSource()
  {
    return mSource;
  }

  public int getTokenIndex()
  {
    return mTokenIndex;
  }
}
