package org.ggp.sexpr.util.sexpr.transforms;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.sexpr.util.sexpr.grammar.ReservedWords;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Renames tokens throughout a forest.  Used to scramble and unscramble rulesheets - a game server may replace every
 * user-defined name with an arbitrary one, and the mapping can be applied (or its inverse applied) in one pass.
 */
public class AtomRenamer
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Map<String, String> mForward;
  private final Map<String, String> mReverse;

  /**
   * Create a renamer.
   *
   * @param xiMapping - original name to new name.  Names are compared the way the parser stores them, so keywords
   *                    are case-insensitive.  No two names may map to the same new name.
   */
  public AtomRenamer(Map<String, String> xiMapping)
  {
    Map<String, String> lForward = new LinkedHashMap<>();
    for (Entry<String, String> lEntry : xiMapping.entrySet())
    {
      String lKey = ReservedWords.normalise(lEntry.getKey());
      String lClash = lForward.put(lKey, ReservedWords.normalise(lEntry.getValue()));
      Preconditions.checkArgument(lClash == null, "%s is renamed more than once", lKey);
    }
    mForward = ImmutableMap.copyOf(lForward);

    // Produce the reverse mapping.
    Map<String, String> lReverse = new HashMap<>();
    for (Entry<String, String> lEntry : mForward.entrySet())
    {
      String lClash = lReverse.put(lEntry.getValue(), lEntry.getKey());
      Preconditions.checkArgument(lClash == null,
                                  "Both %s and %s are renamed to %s",
                                  lClash,
                                  lEntry.getKey(),
                                  lEntry.getValue());
    }
    mReverse = ImmutableMap.copyOf(lReverse);
  }

  /**
   * @return a copy of the forest with the mapping applied.
   *
   * @param xiForest - the forest.
   */
  public List<Sexpr> rename(List<? extends Sexpr> xiForest)
  {
    LOGGER.debug("Renaming " + mForward.size() + " atoms in " + xiForest.size() + " expressions");
    return apply(xiForest, mForward);
  }

  /**
   * @return a copy of the forest with the inverse of the mapping applied.
   *
   * @param xiForest - a forest produced by {@link #rename}.
   */
  public List<Sexpr> restore(List<? extends Sexpr> xiForest)
  {
    LOGGER.debug("Restoring " + mReverse.size() + " atoms in " + xiForest.size() + " expressions");
    return apply(xiForest, mReverse);
  }

  /**
   * @return a copy of the forest with every token equal to xiBefore replaced by xiAfter.
   *
   * @param xiForest - the forest.
   * @param xiBefore - the token to replace.
   * @param xiAfter  - the replacement.
   */
  public static List<Sexpr> replaceAtoms(List<? extends Sexpr> xiForest, String xiBefore, String xiAfter)
  {
    List<Sexpr> lResult = new ArrayList<>(xiForest.size());
    for (Sexpr lNode : xiForest)
    {
      lResult.add(lNode.replaceAtoms(xiBefore, xiAfter));
    }
    return lResult;
  }

  private static List<Sexpr> apply(List<? extends Sexpr> xiForest, Map<String, String> xiMapping)
  {
    List<Sexpr> lResult = new ArrayList<>(xiForest.size());
    for (Sexpr lNode : xiForest)
    {
      lResult.add(lNode.replaceAtoms(xiMapping));
    }
    return lResult;
  }
}
