package org.ggp.sexpr.util.prolog;

import java.util.List;

import org.apache.commons.lang.CharUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.sexpr.util.sexpr.exceptions.TermShapeException;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;
import org.ggp.sexpr.util.sexpr.grammar.SexprAtom;
import org.ggp.sexpr.util.sexpr.grammar.SexprList;

import com.google.common.base.Preconditions;

/**
 * Translates S-expression rulesheets into Prolog.
 *
 * <ul>
 *   <li>A variable <code>?name</code> becomes <code>_name</code>, with every character that isn't an ASCII letter,
 *       digit or underscore replaced by <code>_c&lt;code&gt;_</code>.
 *   <li>Any other token becomes the atom prefix followed by the token, quoted if required.
 *   <li>A compound term <code>(f a b)</code> becomes <code>f(a, b)</code>, with the functor prefix on the functor.
 *   <li>A rule <code>(&lt;= head b1 b2)</code> becomes <code>head :- b1, b2.</code> and anything else becomes a fact.
 * </ul>
 */
public class PrologTranslator
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final PrologOptions mOptions;

  /**
   * Create a translator.
   *
   * @param xiOptions - how to write atoms and functors.
   */
  public PrologTranslator(PrologOptions xiOptions)
  {
    mOptions = Preconditions.checkNotNull(xiOptions);
  }

  /**
   * Create a translator with the default options.
   */
  public PrologTranslator()
  {
    this(PrologOptions.DEFAULT);
  }

  public PrologOptions getOptions()
  {
    return mOptions;
  }

  /**
   * @return the Prolog program for a forest - one clause per line, in input order, followed by the helper clauses
   *         if they're enabled.
   *
   * @param xiForest - the top-level nodes.
   *
   * @throws TermShapeException if any top-level node can't be written as a clause.
   */
  public String toProlog(List<? extends Sexpr> xiForest) throws TermShapeException
  {
    StringBuilder lBuilder = new StringBuilder();
    for (Sexpr lNode : xiForest)
    {
      lBuilder.append(toPrologClause(lNode));
      lBuilder.append('\n');
    }

    if (mOptions.isAddHelperClauses())
    {
      lBuilder.append(new PrologHelperClauses(this).generate(xiForest));
      lBuilder.append('\n');
    }

    LOGGER.debug("Translated " + xiForest.size() + " clauses (" + mOptions + ")");
    return lBuilder.toString();
  }

  /**
   * @return a top-level node as a Prolog clause, including the terminating full stop.
   *
   * @param xiNode - the node.
   *
   * @throws TermShapeException if the node is an empty list, doesn't start with a functor, is a rule with no head,
   *                            or contains anything that isn't a valid term.
   */
  public String toPrologClause(Sexpr xiNode) throws TermShapeException
  {
    if (xiNode.isLeaf())
    {
      // Fact with no arguments.
      return toPrologTerm(xiNode) + ".";
    }

    SexprList lList = (SexprList)xiNode;
    if (lList.size() == 0)
    {
      throw new TermShapeException("Empty clause is not allowed", xiNode);
    }
    if (!lList.get(0).isLeaf())
    {
      throw new TermShapeException("Compound term must start with functor", xiNode);
    }

    if (!lList.isRule())
    {
      return toPrologTerm(xiNode) + ".";
    }

    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append(toPrologTerm(lList.getHead()));

    List<Sexpr> lBody = lList.getBody();
    if (!lBody.isEmpty())
    {
      lBuilder.append(" :- ");
      appendTerms(lBody, lBuilder);
    }
    lBuilder.append('.');
    return lBuilder.toString();
  }

  /**
   * @return a node as a Prolog term.
   *
   * @param xiNode - a token or a compound term.
   *
   * @throws TermShapeException if a list in the node isn't a compound term.
   */
  public String toPrologTerm(Sexpr xiNode) throws TermShapeException
  {
    if (xiNode.isLeaf())
    {
      return toPrologAtom((SexprAtom)xiNode);
    }

    SexprList lTerm = (SexprList)xiNode;
    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append(toPrologFunctor(lTerm.getFunctor()));
    lBuilder.append('(');
    appendTerms(lTerm.getArguments(), lBuilder);
    lBuilder.append(')');
    return lBuilder.toString();
  }

  private void appendTerms(List<Sexpr> xiTerms, StringBuilder xbBuilder) throws TermShapeException
  {
    for (int lii = 0; lii < xiTerms.size(); lii++)
    {
      if (lii != 0)
      {
        xbBuilder.append(", ");
      }
      xbBuilder.append(toPrologTerm(xiTerms.get(lii)));
    }
  }

  /**
   * @return a token as a Prolog atom or variable.
   *
   * @param xiAtom - the token.
   */
  public String toPrologAtom(SexprAtom xiAtom)
  {
    return convertToPrologAtom(xiAtom.getValue());
  }

  /**
   * @return a token in functor position as a Prolog functor.
   *
   * @param xiFunctor - the token.
   *
   * @throws TermShapeException if the token is a variable.
   */
  public String toPrologFunctor(SexprAtom xiFunctor) throws TermShapeException
  {
    if (xiFunctor.isVariable())
    {
      throw new TermShapeException("Functor must not be a variable", xiFunctor);
    }
    return convertToPrologFunctor(xiFunctor.getValue());
  }

  /**
   * @return the Prolog form of a token's text.
   *
   * @param xiValue - the token text.
   */
  public String convertToPrologAtom(String xiValue)
  {
    if (xiValue.charAt(0) == Sexpr.VARIABLE_PREFIX)
    {
      return "_" + filterVariableName(xiValue.substring(1));
    }
    return quote(mOptions.getAtomPrefix() + xiValue);
  }

  /**
   * @return the Prolog form of a functor name.
   *
   * @param xiValue - the functor name.
   */
  public String convertToPrologFunctor(String xiValue)
  {
    return quote(mOptions.getFunctorPrefix() + xiValue);
  }

  private String quote(String xiName)
  {
    if (!mOptions.isQuoteAtoms())
    {
      return xiName;
    }
    String lEscaped = StringUtils.replace(StringUtils.replace(xiName, "\\", "\\\\"), "'", "''");
    return "'" + lEscaped + "'";
  }

  /**
   * @return the variable name with every character other than an ASCII letter, digit or underscore replaced by
   *         <code>_c&lt;code&gt;_</code>.
   *
   * @param xiName - the name without its leading '?'.
   */
  public static String filterVariableName(String xiName)
  {
    StringBuilder lBuilder = new StringBuilder(xiName.length());
    for (int lii = 0; lii < xiName.length(); lii++)
    {
      char lChar = xiName.charAt(lii);
      if (CharUtils.isAsciiAlphanumeric(lChar) || (lChar == '_'))
      {
        lBuilder.append(lChar);
      }
      else
      {
        lBuilder.append("_c").append((int)lChar).append('_');
      }
    }
    return lBuilder.toString();
  }
}
