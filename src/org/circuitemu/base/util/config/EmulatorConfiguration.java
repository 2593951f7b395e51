package org.circuitemu.base.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to machine-specific configuration.
 */
public class EmulatorConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Input count at or above which exhaustive enumeration logs a warning about
     * the size of the table it is about to build.
     */
    LARGE_TABLE_WARNING_INPUTS(20),

    /**
     * Whether the emulator runner writes the circuit out as a .dot file.
     */
    WRITE_CIRCUIT_AS_DOT(false),

    /**
     * File the emulator runner writes the .dot rendering to.
     */
    DOT_FILE_NAME("circuit.dot");

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

  private static final Properties MACHINE_PROPERTIES = new Properties();
  static
  {
    // Computer is identified by the COMPUTERNAME environment variable (Windows) or HOSTNAME (Linux).
    String lComputerName = System.getenv("COMPUTERNAME");
    if (lComputerName == null)
    {
      lComputerName = System.getenv("HOSTNAME");
    }

    if (lComputerName != null)
    {
      File lPropFile = new File("data/cfg/" + lComputerName + ".properties");
      if (lPropFile.exists())
      {
        try (InputStream lPropStream = new FileInputStream(lPropFile))
        {
          MACHINE_PROPERTIES.load(lPropStream);
        }
        catch (IOException lEx)
        {
          LOGGER.warn("Invalid machine-specific configuration in " + lPropFile, lEx);
        }
      }
      else
      {
        LOGGER.debug("No machine-specific configuration for " + lComputerName + " - using defaults");
      }
    }
    else
    {
      LOGGER.debug("Failed to identify computer name - no environment variable COMPUTERNAME or HOSTNAME");
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (MACHINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey));
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey));
  }

  /**
   * Log all machine-specific configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with machine-specific properties:");
    for (Entry<Object, Object> e : MACHINE_PROPERTIES.entrySet())
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
    MACHINE_PROPERTIES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for restoring the default for an item.
   *
   * @param xiKey - the property to reset.
   */
  public static void utResetCfgVal(CfgItem xiKey)
  {
    MACHINE_PROPERTIES.remove(xiKey.toString());
  }
}
