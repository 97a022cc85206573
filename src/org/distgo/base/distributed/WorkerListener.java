package org.distgo.base.distributed;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Thread which accepts connections from workers.
 */
public class WorkerListener extends Thread
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final ServerSocket mListener;
  private final Protocol     mProtocol;

  /**
   * Create a listener.  The caller must start it.
   *
   * @param xiPort     - the port to listen on (0 for any free port).
   * @param xiProtocol - the shared protocol state.
   *
   * @throws IOException if the port can't be opened.
   */
  public WorkerListener(int xiPort, Protocol xiProtocol) throws IOException
  {
    mListener = new ServerSocket(xiPort);
    mProtocol = xiProtocol;
    setName("WorkerListener (" + mListener.getLocalPort() + ")");
    setDaemon(true);
  }

  /**
   * @return the port actually being listened on.
   */
  public int getPort()
  {
    return mListener.getLocalPort();
  }

  @Override
  public void run()
  {
    LOGGER.info("Waiting for workers on port " + getPort());

    while (!isInterrupted() && !mListener.isClosed())
    {
      Socket lConnection;
      try
      {
        lConnection = mListener.accept();
      }
      catch (IOException lEx)
      {
        if (!mListener.isClosed())
        {
          LOGGER.error("Failed to accept worker connection", lEx);
        }
        continue;
      }

      String lName = lConnection.getInetAddress().getHostAddress() + ":" + lConnection.getPort();
      WorkerSession lSession = mProtocol.register(lName);
      if (lSession == null)
      {
        LOGGER.warn("Rejecting worker " + lName + " - already have " + mProtocol.getMaxWorkers());
        closeQuietly(lConnection);
        continue;
      }

      new WorkerConnection(lConnection, mProtocol, lSession).start();
    }
  }

  /**
   * Stop accepting connections.
   */
  public void shutdown()
  {
    interrupt();
    try
    {
      mListener.close();
    }
    catch (IOException lEx)
    {
      LOGGER.warn("Failed to close worker listener", lEx);
    }
  }

  private static void closeQuietly(Socket xiSocket)
  {
    try
    {
      xiSocket.close();
    }
    catch (IOException lEx)
    {
      LOGGER.debug("Failed to close rejected connection", lEx);
    }
  }
}
