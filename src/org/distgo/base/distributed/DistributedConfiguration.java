package org.distgo.base.distributed;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.util.exceptions.ConfigurationException;

/**
 * Configuration of the coordinator.
 *
 * Values come from (in increasing order of precedence) built-in defaults, the machine-specific properties file
 * data/cfg/&lt;hostname&gt;.properties and the engine argument string "name=value,name=value,...".
 */
public class DistributedConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Port that workers connect to.  Mandatory.
     */
    SLAVE_PORT("slave_port", null),

    /**
     * Maximum number of workers.
     */
    MAX_SLAVES("max_slaves", 100),

    /**
     * Whether "quit" is passed on to the workers.
     */
    SLAVES_QUIT("slaves_quit", false),

    /**
     * Port that workers may send their logs to.  No log proxy if unset.
     */
    PROXY_PORT("proxy_port", null),

    /**
     * Games per move, over all workers, when there's no time control.
     */
    DEFAULT_GAMES("default_games", 80000),

    /**
     * How long, in milliseconds, to keep waiting for a first reply to genmoves before giving up and committing.
     */
    SILENCE_LIMIT("silence_limit", 30000),

    /**
     * Maximum number of nodes in the coordinator's tree.
     */
    NODE_POOL_SIZE("node_pool_size", 1000000),

    /**
     * Directory holding opening books.
     */
    BOOK_DIRECTORY("book_directory", "."),

    /**
     * Only save the children of book nodes with at least this many playouts.
     */
    BOOK_SAVE_THRESHOLD("book_save_threshold", 100);

    /**
     * Name as used in the engine arguments and properties file.
     */
    public final String mKey;

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiKey, String xiDefault)
    {
      mKey = xiKey;
      mDefault = xiDefault;
    }

    private CfgItem(String xiKey, int xiDefault)
    {
      this(xiKey, "" + xiDefault);
    }

    private CfgItem(String xiKey, boolean xiDefault)
    {
      this(xiKey, xiDefault ? "1" : "0");
    }

    /**
     * @return the item with the specified key, or null if there isn't one.
     *
     * @param xiKey - the key (case-insensitive).
     */
    public static CfgItem forKey(String xiKey)
    {
      for (CfgItem lItem : values())
      {
        if (lItem.mKey.equalsIgnoreCase(xiKey))
        {
          return lItem;
        }
      }
      return null;
    }
  }

  private final Properties mProperties;

  /**
   * Create a configuration.
   *
   * @param xiProperties - initial values, keyed by {@link CfgItem#mKey}.
   */
  public DistributedConfiguration(Properties xiProperties)
  {
    mProperties = new Properties();
    for (String lKey : xiProperties.stringPropertyNames())
    {
      CfgItem lItem = CfgItem.forKey(lKey);
      if (lItem == null)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
        continue;
      }
      mProperties.setProperty(lItem.mKey, xiProperties.getProperty(lKey));
    }
  }

  /**
   * Load the configuration for this machine and apply engine arguments on top.
   *
   * @param xiEngineArgs - the engine arguments (may be null).
   *
   * @return the configuration.
   *
   * @throws ConfigurationException if the result is unusable.
   */
  public static DistributedConfiguration load(String xiEngineArgs) throws ConfigurationException
  {
    DistributedConfiguration lConfig = new DistributedConfiguration(loadMachineProperties());
    lConfig.applyEngineArgs(xiEngineArgs);
    lConfig.validate();
    return lConfig;
  }

  private static Properties loadMachineProperties()
  {
    Properties lProperties = new Properties();

    // Computer is identified by the COMPUTERNAME environment variable (Windows) or HOSTNAME (Linux).
    String lComputerName = System.getenv("COMPUTERNAME");
    if (lComputerName == null)
    {
      lComputerName = System.getenv("HOSTNAME");
    }

    if (lComputerName != null)
    {
      try (InputStream lPropStream = new FileInputStream("data/cfg/" + lComputerName + ".properties"))
      {
        lProperties.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.debug("No machine-specific configuration for " + lComputerName);
      }
    }

    return lProperties;
  }

  /**
   * Apply engine arguments of the form "slave_port=1234,max_slaves=8,slaves_quit,proxy_port=1235".  A flag with no
   * value is set.  Unknown arguments, and arguments missing a required value, are logged and ignored.
   *
   * @param xiEngineArgs - the arguments (may be null or empty).
   */
  public void applyEngineArgs(String xiEngineArgs)
  {
    if (StringUtils.isBlank(xiEngineArgs))
    {
      return;
    }

    for (String lSpec : StringUtils.split(xiEngineArgs, ','))
    {
      String lName = StringUtils.substringBefore(lSpec, "=").trim();
      String lValue = lSpec.contains("=") ? StringUtils.substringAfter(lSpec, "=").trim() : null;

      CfgItem lItem = CfgItem.forKey(lName);
      if (lItem == CfgItem.SLAVES_QUIT && lValue == null)
      {
        lValue = "1";
      }

      if (lItem == null || lValue == null)
      {
        LOGGER.warn("Invalid engine argument " + lName + " or missing value");
        continue;
      }
      mProperties.setProperty(lItem.mKey, lValue);
    }
  }

  /**
   * Check that mandatory items are present and numeric items are numbers.
   *
   * @throws ConfigurationException if not.
   */
  public void validate() throws ConfigurationException
  {
    if (getString(CfgItem.SLAVE_PORT) == null)
    {
      throw new ConfigurationException("missing slave_port");
    }

    for (CfgItem lItem : new CfgItem[] {CfgItem.SLAVE_PORT,
                                        CfgItem.MAX_SLAVES,
                                        CfgItem.DEFAULT_GAMES,
                                        CfgItem.SILENCE_LIMIT,
                                        CfgItem.NODE_POOL_SIZE,
                                        CfgItem.BOOK_SAVE_THRESHOLD})
    {
      try
      {
        getLong(lItem);
      }
      catch (NumberFormatException lEx)
      {
        throw new ConfigurationException("Bad value for " + lItem.mKey + ": " + getString(lItem), lEx);
      }
    }

    if (getString(CfgItem.PROXY_PORT) != null && !StringUtils.isNumeric(getString(CfgItem.PROXY_PORT)))
    {
      throw new ConfigurationException("Bad value for proxy_port: " + getString(CfgItem.PROXY_PORT));
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   */
  public String getString(CfgItem xiItem)
  {
    return mProperties.getProperty(xiItem.mKey, xiItem.mDefault);
  }

  public int getInt(CfgItem xiItem)
  {
    return Integer.parseInt(getString(xiItem));
  }

  public long getLong(CfgItem xiItem)
  {
    return Long.parseLong(getString(xiItem));
  }

  /**
   * @return the specified boolean configuration value.  "1" and "true" are true, anything else false.
   */
  public boolean getBoolean(CfgItem xiItem)
  {
    String lValue = getString(xiItem);
    return "1".equals(lValue) || "true".equalsIgnoreCase(lValue);
  }

  /**
   * @return whether a value (other than the default) has been set for an item.
   */
  public boolean isSet(CfgItem xiItem)
  {
    return mProperties.containsKey(xiItem.mKey);
  }

  /**
   * Override a value.
   *
   * @param xiItem  - the item.
   * @param xiValue - the new value.
   */
  public void set(CfgItem xiItem, String xiValue)
  {
    mProperties.setProperty(xiItem.mKey, xiValue);
  }

  /**
   * Log all configuration.
   */
  public void logConfig()
  {
    LOGGER.info("Running with configuration:");
    for (Entry<Object, Object> lEntry : mProperties.entrySet())
    {
      CfgItem lItem = CfgItem.forKey((String)lEntry.getKey());
      LOGGER.info("\t" + lEntry.getKey() + " = " + lEntry.getValue() + " (default: " + lItem.mDefault + ")");
    }
  }
}
