package org.ggp.sexpr.util.sexpr.exceptions;

import org.ggp.sexpr.util.sexpr.grammar.Sexpr;

/**
 * Thrown when a syntactically valid S-expression is used somewhere that needs a compound term (or a rule) and it
 * doesn't have that shape.  For example, a list with no arguments, or a list in the functor slot.
 */
public final class TermShapeException extends SexprException
{
  private static final long serialVersionUID = 1L;

  private final Sexpr mNode;

  /**
   * @param xiReason - what the node should have looked like.
   * @param xiNode   - the offending node.
   */
  public TermShapeException(String xiReason, Sexpr xiNode)
  {
    super(xiReason + ": " + xiNode.toSexpr());
    mNode = xiNode;
  }

  public Sexpr getNode()
  {
    return mNode;
  }
}
