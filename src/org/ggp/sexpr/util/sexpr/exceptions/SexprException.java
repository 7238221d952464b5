package org.ggp.sexpr.util.sexpr.exceptions;

/**
 * Abstract class for exceptions that are a result of bad S-expression input.
 */
public abstract class SexprException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected SexprException(String xiMessage)
  {
    super(xiMessage);
  }
}
