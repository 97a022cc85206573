package org.distgo.base.distributed;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

/**
 * Thread which talks to one worker: sends it whatever it's missing from the command journal and feeds its replies
 * back to the protocol.
 */
public class WorkerConnection extends Thread
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Socket        mSocket;
  private final Protocol      mProtocol;
  private final WorkerSession mSession;

  /**
   * Create a connection thread.  The caller must start it.
   *
   * @param xiSocket   - the connected socket.
   * @param xiProtocol - the shared protocol state.
   * @param xiSession  - the worker's (registered) session.
   */
  public WorkerConnection(Socket xiSocket, Protocol xiProtocol, WorkerSession xiSession)
  {
    mSocket = xiSocket;
    mProtocol = xiProtocol;
    mSession = xiSession;
    setName("Worker " + xiSession.getName());
    setDaemon(true);
  }

  @Override
  public void run()
  {
    ThreadContext.put("worker", mSession.getName());

    try (BufferedReader lIn = new BufferedReader(new InputStreamReader(mSocket.getInputStream(),
                                                                       StandardCharsets.UTF_8));
         Writer lOut = new OutputStreamWriter(mSocket.getOutputStream(), StandardCharsets.UTF_8))
    {
      while (true)
      {
        List<JournalEntry> lEntries = mProtocol.awaitWork(mSession);
        if (lEntries.isEmpty())
        {
          break;
        }

        for (JournalEntry lEntry : lEntries)
        {
          lOut.write(lEntry.toWireFormat());
          lOut.flush();

          String lReply = readReply(lIn);
          LOGGER.trace("Reply to " + lEntry + ": " + lReply);
          if (!mProtocol.handleReply(mSession, lEntry, lReply))
          {
            break;
          }
        }
      }
    }
    catch (IOException lEx)
    {
      LOGGER.info("Lost connection to worker " + mSession.getName() + ": " + lEx.getMessage());
    }
    catch (InterruptedException lEx)
    {
      LOGGER.debug("Worker connection interrupted");
    }
    finally
    {
      mProtocol.unregister(mSession);
      try
      {
        mSocket.close();
      }
      catch (IOException lEx)
      {
        LOGGER.warn("Failed to close connection to " + mSession.getName(), lEx);
      }
      ThreadContext.remove("worker");
    }
  }

  /**
   * Read one reply: lines up to (not including) a blank line.
   *
   * @return the reply, with each line newline-terminated.
   *
   * @throws IOException if the connection drops.
   */
  static String readReply(BufferedReader xiIn) throws IOException
  {
    StringBuilder lReply = new StringBuilder();
    String lLine;
    while ((lLine = xiIn.readLine()) != null)
    {
      if (lLine.isEmpty())
      {
        if (lReply.length() == 0)
        {
          // Stray blank line between replies.
          continue;
        }
        return lReply.toString();
      }
      lReply.append(lLine).append('\n');
    }

    throw new IOException("Connection closed");
  }
}
