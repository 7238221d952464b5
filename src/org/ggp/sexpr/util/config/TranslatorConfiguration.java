package org.ggp.sexpr.util.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to the parser and translator configuration.
 *
 * Values are read once from the properties file named by the system property {@value #CONFIG_PROPERTY} or, if that
 * isn't set, from {@value #DEFAULT_CONFIG_FILE}.  Anything not configured takes its default.
 */
public class TranslatorConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * System property naming an alternative configuration file.
   */
  public static final String CONFIG_PROPERTY = "sexpr.config";

  /**
   * Configuration file used when {@value #CONFIG_PROPERTY} isn't set.
   */
  public static final String DEFAULT_CONFIG_FILE = "data/cfg/sexpr.properties";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Whether atoms and functors are single-quoted in Prolog output.
     */
    QUOTE_ATOMS(false),

    /**
     * Prefix added to every (non-variable) atom in Prolog output.
     */
    ATOM_PREFIX(""),

    /**
     * Prefix added to every functor in Prolog output.
     */
    FUNCTOR_PREFIX(""),

    /**
     * Whether to append user_defined_functor / connected_args / equivalent_args clauses to Prolog output.
     */
    ADD_HELPER_CLAUSES(false),

    /**
     * Whether lists with a single child are replaced by that child when parsing (permissive KIF).
     */
    FLATTEN_SINGLETON_GROUPS(false),

    /**
     * Maximum parenthesis nesting accepted by the parser.
     */
    MAX_NESTING_DEPTH(1000);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties PROPERTIES = new Properties();
  static
  {
    String lFileName = System.getProperty(CONFIG_PROPERTY, DEFAULT_CONFIG_FILE);
    try (InputStream lPropStream = new FileInputStream(lFileName))
    {
      PROPERTIES.load(lPropStream);
    }
    catch (IOException lEx)
    {
      if (System.getProperty(CONFIG_PROPERTY) != null)
      {
        LOGGER.warn("Missing/invalid translator configuration " + lFileName + " - using defaults", lEx);
      }
      else
      {
        LOGGER.debug("No translator configuration in " + lFileName + " - using defaults");
      }
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault);
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey).trim();
    try
    {
      return Integer.parseInt(lValue);
    }
    catch (NumberFormatException lEx)
    {
      LOGGER.warn("Invalid integer '" + lValue + "' for " + xiKey + " - using default " + xiKey.mDefault);
      return Integer.parseInt(xiKey.mDefault);
    }
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
  }

  /**
   * Log all configured values.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with translator properties:");
    for (Entry<Object, Object> e : PROPERTIES.entrySet())
    {
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for restoring the default of an overridden item.
   *
   * @param xiKey - the property to reset.
   */
  public static void utResetCfgVal(CfgItem xiKey)
  {
    PROPERTIES.remove(xiKey.toString());
  }
}
