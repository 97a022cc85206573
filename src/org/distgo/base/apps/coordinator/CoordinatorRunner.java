package org.distgo.base.apps.coordinator;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.distributed.ConsensusBook;
import org.distgo.base.distributed.Coordinator;
import org.distgo.base.distributed.DistributedConfiguration;
import org.distgo.base.distributed.DistributedConfiguration.CfgItem;
import org.distgo.base.distributed.LogProxy;
import org.distgo.base.distributed.Protocol;
import org.distgo.base.distributed.WorkerListener;
import org.distgo.base.time.DefaultTimeStopCalculator;
import org.distgo.base.util.exceptions.ConfigurationException;

/**
 * Runs a coordinator, reading commands from stdin and answering on stdout.
 *
 * Usage: CoordinatorRunner slave_port=1234[,max_slaves=N][,slaves_quit=0|1][,proxy_port=1235]
 */
public final class CoordinatorRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private CoordinatorRunner()
  {
  }

  public static void main(String[] args) throws IOException
  {
    DistributedConfiguration lConfig;
    try
    {
      lConfig = DistributedConfiguration.load((args.length > 0) ? args[0] : null);
    }
    catch (ConfigurationException lEx)
    {
      LOGGER.fatal("distributed: " + lEx.getMessage());
      System.exit(1);
      return;
    }
    lConfig.logConfig();

    Protocol lProtocol = new Protocol(lConfig.getInt(CfgItem.MAX_SLAVES));
    WorkerListener lListener = new WorkerListener(lConfig.getInt(CfgItem.SLAVE_PORT), lProtocol);
    lListener.start();

    LogProxy lLogProxy = null;
    if (lConfig.isSet(CfgItem.PROXY_PORT))
    {
      lLogProxy = new LogProxy(lConfig.getInt(CfgItem.PROXY_PORT));
      lLogProxy.start();
    }

    ConsensusBook lBook = new ConsensusBook(lConfig.getInt(CfgItem.NODE_POOL_SIZE),
                                            new File(lConfig.getString(CfgItem.BOOK_DIRECTORY)),
                                            lConfig.getLong(CfgItem.BOOK_SAVE_THRESHOLD));
    Coordinator lCoordinator = new Coordinator(lProtocol, lConfig, new DefaultTimeStopCalculator(), lBook);

    BufferedReader lIn = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    Writer lOut = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
    try
    {
      new CommandLoop(lCoordinator, lIn, lOut).run();
    }
    finally
    {
      lProtocol.close();
      lListener.shutdown();
      if (lLogProxy != null)
      {
        lLogProxy.shutdown();
      }
      lBook.dispose();
    }
  }
}
