package org.ggp.sexpr.util.sexpr.factory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/**
 * Splits S-expression text into tokens.  Comments (from ';' to the next carriage return or newline) are removed first.  Tokens are
 * separated by spaces, tabs, carriage returns and newlines, and each parenthesis is always a token on its own.
 *
 * The tokenizer is {@link Iterable}: tokens are produced lazily, and every call to {@link #iterator()} starts again
 * from the beginning of the text.
 */
public final class SexprTokenizer implements Iterable<String>
{
  public static final String OPEN = "(";
  public static final String CLOSE = ")";

  private static final Pattern COMMENT = Pattern.compile(";[^\\r\\n]*");

  private final String mText;

  /**
   * Create a tokenizer for the specified text.
   *
   * @param xiText - the raw text, possibly with comments.
   */
  public SexprTokenizer(String xiText)
  {
    Preconditions.checkNotNull(xiText);
    mText = removeComments(xiText);
  }

  /**
   * @return the text being tokenized, with comments removed.
   */
  public String getText()
  {
    return mText;
  }

  @Override
  public Iterator<String> iterator()
  {
    return new TokenIterator(mText);
  }

  /**
   * @return the specified text with all comments removed.  Line breaks are kept.
   *
   * @param xiText - the text.
   */
  public static String removeComments(String xiText)
  {
    return COMMENT.matcher(xiText).replaceAll("");
  }

  private static boolean isSeparator(char xiChar)
  {
    return (xiChar == ' ') || (xiChar == '\t') || (xiChar == '\n') || (xiChar == '\r');
  }

  private static boolean isParen(char xiChar)
  {
    return (xiChar == '(') || (xiChar == ')');
  }

  /**
   * Iterator over the tokens of a piece of comment-free text.
   */
  private static final class TokenIterator implements Iterator<String>
  {
    private final String mText;
    private int mPos;

    TokenIterator(String xiText)
    {
      mText = xiText;
      mPos = 0;
      skipSeparators();
    }

    private void skipSeparators()
    {
      while ((mPos < mText.length()) && isSeparator(mText.charAt(mPos)))
      {
        mPos++;
      }
    }

    @Override
    public boolean hasNext()
    {
      return mPos < mText.length();
    }

    @Override
    public String next()
    {
      if (!hasNext())
      {
        throw new NoSuchElementException();
      }

      int lStart = mPos;
      if (isParen(mText.charAt(mPos)))
      {
        mPos++;
      }
      else
      {
        while ((mPos < mText.length()) &&
               !isSeparator(mText.charAt(mPos)) &&
               !isParen(mText.charAt(mPos)))
        {
          mPos++;
        }
      }

      String lToken = mText.substring(lStart, mPos);
      skipSeparators();
      return lToken;
    }

    @Override
    public void remove()
    {
      throw new UnsupportedOperationException();
    }
  }
}
