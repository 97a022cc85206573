package org.distgo.base.distributed;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the logs of workers which choose to send them, and re-logs each line tagged with the sender.
 */
public class LogProxy extends Thread
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final ServerSocket mListener;

  /**
   * @param xiPort - the port to listen on (0 for any free port).
   *
   * @throws IOException if the port can't be opened.
   */
  public LogProxy(int xiPort) throws IOException
  {
    mListener = new ServerSocket(xiPort);
    setName("LogProxy (" + mListener.getLocalPort() + ")");
    setDaemon(true);
  }

  public int getPort()
  {
    return mListener.getLocalPort();
  }

  @Override
  public void run()
  {
    while (!isInterrupted() && !mListener.isClosed())
    {
      try
      {
        Socket lConnection = mListener.accept();
        Thread lReader = new Thread(() -> relay(lConnection),
                                    "LogProxy reader " + lConnection.getRemoteSocketAddress());
        lReader.setDaemon(true);
        lReader.start();
      }
      catch (IOException lEx)
      {
        if (!mListener.isClosed())
        {
          LOGGER.error("Failed to accept log connection", lEx);
        }
      }
    }
  }

  private static void relay(Socket xiConnection)
  {
    String lSource = xiConnection.getInetAddress().getHostAddress();
    try (BufferedReader lIn = new BufferedReader(new InputStreamReader(xiConnection.getInputStream(),
                                                                       StandardCharsets.UTF_8)))
    {
      String lLine;
      while ((lLine = lIn.readLine()) != null)
      {
        LOGGER.info("< " + lSource + ": " + lLine);
      }
    }
    catch (IOException lEx)
    {
      LOGGER.debug("Log connection from " + lSource + " dropped: " + lEx.getMessage());
    }
    finally
    {
      try
      {
        xiConnection.close();
      }
      catch (IOException lEx)
      {
        LOGGER.debug("Failed to close log connection", lEx);
      }
    }
  }

  public void shutdown()
  {
    interrupt();
    try
    {
      mListener.close();
    }
    catch (IOException lEx)
    {
      LOGGER.warn("Failed to close log proxy", lEx);
    }
  }
}
