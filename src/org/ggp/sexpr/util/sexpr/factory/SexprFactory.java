package org.ggp.sexpr.util.sexpr.factory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.sexpr.util.config.TranslatorConfiguration;
import org.ggp.sexpr.util.config.TranslatorConfiguration.CfgItem;
import org.ggp.sexpr.util.sexpr.exceptions.SexprFormatException;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;
import org.ggp.sexpr.util.sexpr.grammar.SexprAtom;
import org.ggp.sexpr.util.sexpr.grammar.SexprList;

import com.google.common.base.Preconditions;

/**
 * Builds a forest of {@link Sexpr} trees from text.
 *
 * The builder keeps its own stack of open lists rather than recursing, so the only limit on nesting is the
 * configured maximum depth.  Text that is nested more deeply than that is rejected, which also bounds the recursion
 * of the rendering and analysis code that later walks the trees.
 */
public final class SexprFactory
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final boolean mFlattenSingletons;
  private final int mMaxDepth;

  /**
   * Create a factory.
   *
   * @param xiFlattenSingletons - whether a list with exactly one child is replaced by that child.  Used for
   *                              permissive KIF, where extra parentheses are common.
   * @param xiMaxDepth          - the deepest nesting of parentheses to accept.
   */
  public SexprFactory(boolean xiFlattenSingletons, int xiMaxDepth)
  {
    Preconditions.checkArgument(xiMaxDepth > 0, "Maximum depth must be positive");
    mFlattenSingletons = xiFlattenSingletons;
    mMaxDepth = xiMaxDepth;
  }

  /**
   * Create a factory with the configured maximum depth.
   *
   * @param xiFlattenSingletons - whether a list with exactly one child is replaced by that child.
   */
  public SexprFactory(boolean xiFlattenSingletons)
  {
    this(xiFlattenSingletons, TranslatorConfiguration.getCfgInt(CfgItem.MAX_NESTING_DEPTH));
  }

  /**
   * @return a factory using the configured flatten mode and maximum depth.
   */
  public static SexprFactory fromConfiguration()
  {
    return new SexprFactory(TranslatorConfiguration.getCfgBool(CfgItem.FLATTEN_SINGLETON_GROUPS));
  }

  public boolean isFlatteningSingletons()
  {
    return mFlattenSingletons;
  }

  public int getMaxDepth()
  {
    return mMaxDepth;
  }

  /**
   * @return the forest read from the specified text.
   *
   * @param xiText - zero or more S-expressions, possibly with comments.
   */
  public static List<Sexpr> parse(String xiText) throws SexprFormatException
  {
    return new SexprFactory(false).create(xiText);
  }

  /**
   * @return the forest read from the specified text.
   *
   * @param xiText              - zero or more S-expressions, possibly with comments.
   * @param xiFlattenSingletons - whether a list with exactly one child is replaced by that child.
   */
  public static List<Sexpr> parse(String xiText, boolean xiFlattenSingletons) throws SexprFormatException
  {
    return new SexprFactory(xiFlattenSingletons).create(xiText);
  }

  /**
   * @return the forest read from the specified KIF text, with singleton lists flattened.
   *
   * @param xiKIF - the KIF.
   */
  public static List<Sexpr> parseKif(String xiKIF) throws SexprFormatException
  {
    return parse(xiKIF, true);
  }

  /**
   * @return the forest read from the specified text.
   *
   * @param xiText - zero or more S-expressions, possibly with comments.
   *
   * @throws SexprFormatException if the parentheses don't balance or are nested too deeply.
   */
  public List<Sexpr> create(String xiText) throws SexprFormatException
  {
    SexprTokenizer lTokenizer = new SexprTokenizer(xiText);
    List<Sexpr> lForest = new ArrayList<>();

    // Children collected so far for each list that is still open.  The innermost list is at the top.
    Deque<List<Sexpr>> lOpen = new ArrayDeque<>();

    int lTokenIndex = 0;
    for (String lToken : lTokenizer)
    {
      LOGGER.trace("Token " + lTokenIndex + ": " + lToken);

      if (SexprTokenizer.OPEN.equals(lToken))
      {
        if (lOpen.size() >= mMaxDepth)
        {
          throw new SexprFormatException("Nesting deeper than " + mMaxDepth,
                                         lTokenizer.getText(),
                                         lTokenIndex);
        }
        lOpen.push(new ArrayList<Sexpr>());
      }
      else if (SexprTokenizer.CLOSE.equals(lToken))
      {
        if (lOpen.isEmpty())
        {
          throw new SexprFormatException("Unmatched ')'", lTokenizer.getText(), lTokenIndex);
        }
        addNode(close(lOpen.pop()), lOpen, lForest);
      }
      else
      {
        addNode(new SexprAtom(lToken), lOpen, lForest);
      }

      lTokenIndex++;
    }

    if (!lOpen.isEmpty())
    {
      throw new SexprFormatException(lOpen.size() + " unmatched '('", lTokenizer.getText(), lTokenIndex);
    }

    LOGGER.debug("Parsed " + lForest.size() + " top-level expressions from " + lTokenIndex + " tokens");
    return lForest;
  }

  /**
   * @return the node for a list whose closing parenthesis has just been read.
   *
   * @param xiChildren - the children of the list.
   */
  private Sexpr close(List<Sexpr> xiChildren)
  {
    // The children have already been flattened, so one pass here flattens the whole tree.
    if (mFlattenSingletons && (xiChildren.size() == 1))
    {
      return xiChildren.get(0);
    }
    return new SexprList(xiChildren);
  }

  /**
   * Add a completed node to the innermost open list, or to the forest if no list is open.
   */
  private static void addNode(Sexpr xiNode, Deque<List<Sexpr>> xiOpen, List<Sexpr> xbForest)
  {
    if (xiOpen.isEmpty())
    {
      xbForest.add(xiNode);
    }
    else
    {
      xiOpen.peek().add(xiNode);
    }
  }
}
