package org.ggp.sexpr.apps.translator;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.sexpr.util.config.TranslatorConfiguration;
import org.ggp.sexpr.util.config.TranslatorConfiguration.CfgItem;
import org.ggp.sexpr.util.prolog.PrologOptions;
import org.ggp.sexpr.util.prolog.PrologTranslator;
import org.ggp.sexpr.util.sexpr.exceptions.SexprException;
import org.ggp.sexpr.util.sexpr.factory.SexprFactory;
import org.ggp.sexpr.util.sexpr.grammar.Sexpr;

import com.google.common.io.Files;

/**
 * This is a simple command line app for parsing a rulesheet and printing it back out.
 */
public final class TranslatorRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String SAMPLE = "a (b) (c   d)\n\t(e (f (g () h) i) j)";

  private TranslatorRunner()
  {
  }

  public static void main(String[] args) throws IOException
  {
    String lFileName = null;
    boolean lProlog = false;
    boolean lKIF = false;

    for (String lArg : args)
    {
      if (lArg.equals("--prolog"))
      {
        lProlog = true;
      }
      else if (lArg.equals("--kif"))
      {
        lKIF = true;
      }
      else if (lArg.startsWith("--"))
      {
        System.out.println("TranslatorRunner [file] [--prolog] [--kif]");
        return;
      }
      else
      {
        lFileName = lArg;
      }
    }

    TranslatorConfiguration.logConfig();

    String lText = SAMPLE;
    if (lFileName != null)
    {
      lText = Files.asCharSource(new File(lFileName), StandardCharsets.UTF_8).read();
    }

    try
    {
      System.out.print(run(lText, lKIF || TranslatorConfiguration.getCfgBool(CfgItem.FLATTEN_SINGLETON_GROUPS), lProlog));
    }
    catch (SexprException lEx)
    {
      LOGGER.error("Failed to translate " + (lFileName == null ? "sample" : lFileName), lEx);
      System.exit(1);
    }
  }

  /**
   * @return the report printed for the specified text.
   *
   * @param xiText    - the S-expressions.
   * @param xiFlatten - whether to flatten singleton lists.
   * @param xiProlog  - whether to include the Prolog translation.
   *
   * @throws SexprException if the text can't be parsed or translated.
   */
  public static String run(String xiText, boolean xiFlatten, boolean xiProlog) throws SexprException
  {
    List<Sexpr> lForest = SexprFactory.parse(xiText, xiFlatten);
    LOGGER.info("Read " + lForest.size() + " expressions");

    StringBuilder lBuilder = new StringBuilder();
    lBuilder.append("Input S-expressions:\n").append(xiText).append('\n');

    lBuilder.append("Output tree structures:\n");
    for (Sexpr lNode : lForest)
    {
      lBuilder.append(lNode).append('\n');
    }

    lBuilder.append("Output S-expressions:\n");
    lBuilder.append(Sexpr.toSexpr(lForest));

    if (xiProlog)
    {
      lBuilder.append("Output Prolog:\n");
      lBuilder.append(new PrologTranslator(PrologOptions.fromConfiguration()).toProlog(lForest));
    }
    return lBuilder.toString();
  }
}
