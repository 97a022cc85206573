package org.distgo.base.apps.coordinator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.board.Coord;
import org.distgo.base.board.SimpleBoard;
import org.distgo.base.board.Stone;
import org.distgo.base.distributed.Coordinator;
import org.distgo.base.time.TimeInfo;

/**
 * A line-oriented command front end for the coordinator.  Each line is an optional numeric id, a verb and arguments;
 * each response is "=[id] text" or "?[id] error" followed by a blank line.
 */
public class CommandLoop
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String[] COMMANDS = {"protocol_version", "name", "version", "list_commands", "boardsize",
                                            "clear_board", "komi", "play", "genmove", "kgs-genmove_cleanup",
                                            "time_settings", "time_left", "final_status_list", "kgs-chat",
                                            "uct_genbook", "uct_dumpbook", "quit"};

  /**
   * Thrown to reject a command.
   */
  private static class CommandException extends Exception
  {
    private static final long serialVersionUID = 1L;

    CommandException(String xiMessage)
    {
      super(xiMessage);
    }
  }

  private final Coordinator    mCoordinator;
  private final BufferedReader mIn;
  private final Writer         mOut;

  private final SimpleBoard    mBoard    = new SimpleBoard(19);
  private TimeInfo             mTimeInfo = TimeInfo.none();
  private Stone                mToPlay   = Stone.BLACK;

  public CommandLoop(Coordinator xiCoordinator, BufferedReader xiIn, Writer xiOut)
  {
    mCoordinator = xiCoordinator;
    mIn = xiIn;
    mOut = xiOut;
  }

  public SimpleBoard getBoard()
  {
    return mBoard;
  }

  /**
   * Process commands until "quit" or end of input.
   *
   * @throws IOException if the input or output fails.
   */
  public void run() throws IOException
  {
    mCoordinator.newGame(mBoard);

    String lLine;
    while ((lLine = mIn.readLine()) != null)
    {
      lLine = lLine.trim();
      if (lLine.isEmpty() || lLine.startsWith("#"))
      {
        continue;
      }

      String lId = "";
      String lFirst = StringUtils.substringBefore(lLine, " ");
      if (StringUtils.isNumeric(lFirst))
      {
        lId = lFirst;
        lLine = StringUtils.substringAfter(lLine, " ").trim();
      }

      String lVerb = StringUtils.lowerCase(StringUtils.substringBefore(lLine, " "));
      String lArgs = StringUtils.substringAfter(lLine, " ").trim();

      try
      {
        String lResponse = process(lVerb, lArgs);
        respond("=" + lId, lResponse);
      }
      catch (CommandException lEx)
      {
        respond("?" + lId, lEx.getMessage());
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.debug("Rejected command " + lLine, lEx);
        respond("?" + lId, lEx.getMessage());
      }

      if (lVerb.equals("quit"))
      {
        break;
      }
    }
  }

  private void respond(String xiPrefix, String xiText) throws IOException
  {
    mOut.write(xiText.isEmpty() ? xiPrefix : xiPrefix + " " + xiText);
    mOut.write("\n\n");
    mOut.flush();
  }

  /**
   * @return the response text.
   */
  String process(String xiVerb, String xiArgs) throws CommandException
  {
    String[] lArgs = StringUtils.split(xiArgs);

    switch (xiVerb)
    {
      case "protocol_version":
        return "2";

      case "name":
        return "distgo";

      case "version":
        return "1.0";

      case "list_commands":
        return StringUtils.join(COMMANDS, '\n');

      case "boardsize":
        mBoard.setSize(Integer.parseInt(arg(lArgs, 0)));
        mToPlay = Stone.BLACK;
        forward(xiVerb, xiArgs);
        mCoordinator.newGame(mBoard);
        return "";

      case "clear_board":
        mBoard.clear();
        mToPlay = Stone.BLACK;
        forward(xiVerb, xiArgs);
        mCoordinator.newGame(mBoard);
        return "";

      case "komi":
        mBoard.setKomi(Double.parseDouble(arg(lArgs, 0)));
        forward(xiVerb, xiArgs);
        return "";

      case "play":
      {
        Stone lColor = Stone.parse(arg(lArgs, 0));
        int lCoord = Coord.parse(arg(lArgs, 1), mBoard.getSize());
        mBoard.play(lColor, lCoord);
        mToPlay = lColor.other();
        forward(xiVerb, xiArgs);
        mCoordinator.played(lColor, lCoord);
        return "";
      }

      case "genmove":
      case "kgs-genmove_cleanup":
      {
        Stone lColor = Stone.parse(arg(lArgs, 0));
        int lMove = mCoordinator.genmove(mBoard, mTimeInfo, lColor, xiVerb.equals("kgs-genmove_cleanup"));
        if (lMove != Coord.RESIGN)
        {
          mBoard.play(lColor, lMove);
        }
        mToPlay = lColor.other();
        return Coord.toString(lMove, mBoard.getSize());
      }

      case "time_settings":
      {
        double lMain = Double.parseDouble(arg(lArgs, 0));
        double lByoyomi = Double.parseDouble(arg(lArgs, 1));
        int lStones = Integer.parseInt(arg(lArgs, 2));
        if (lByoyomi > 0 && lStones == 0)
        {
          // No time limit.
          mTimeInfo = TimeInfo.none();
        }
        else
        {
          mTimeInfo = TimeInfo.forGameTime(lMain, lByoyomi, (lStones > 0) ? 1 : 0, lStones);
        }
        forward(xiVerb, xiArgs);
        return "";
      }

      case "time_left":
        // Folded into the next genmoves request.
        mTimeInfo.setTimeLeft(Double.parseDouble(arg(lArgs, 1)), Integer.parseInt(arg(lArgs, 2)));
        return "";

      case "final_status_list":
      {
        if (!"dead".equalsIgnoreCase(arg(lArgs, 0)))
        {
          throw new CommandException("only dead stones are supported");
        }
        List<Integer> lDead = mCoordinator.deadGroupList(mBoard);
        StringBuilder lResponse = new StringBuilder();
        for (int lCoord : lDead)
        {
          if (lResponse.length() > 0)
          {
            lResponse.append('\n');
          }
          lResponse.append(Coord.toString(lCoord, mBoard.getSize()));
        }
        return lResponse.toString();
      }

      case "final_score":
        throw new CommandException("scoring not supported");

      case "kgs-chat":
      {
        // kgs-chat (game|private) <name> <message>
        String lMessage = (lArgs.length > 2) ? StringUtils.join(lArgs, ' ', 2, lArgs.length) : "";
        String lAnswer = mCoordinator.chat(lMessage);
        if (lAnswer == null)
        {
          throw new CommandException("unknown chat command");
        }
        return lAnswer;
      }

      case "uct_genbook":
      {
        Stone lColor = (lArgs.length > 0) ? Stone.parse(lArgs[0]) : mToPlay;
        mCoordinator.genbook(mBoard, mTimeInfo, lColor);
        return "";
      }

      case "uct_dumpbook":
        mCoordinator.getBook().dump((lArgs.length > 0) ? Long.parseLong(lArgs[0]) : 0);
        return "";

      case "quit":
        forward(xiVerb, xiArgs);
        return "";

      default:
        if (!forward(xiVerb, xiArgs))
        {
          throw new CommandException("unknown command");
        }
        return "";
    }
  }

  /**
   * Pass a command on to the workers.  Arguments go over the wire newline-terminated.
   */
  private boolean forward(String xiVerb, String xiArgs)
  {
    return mCoordinator.notify(xiVerb, xiArgs.isEmpty() ? "" : xiArgs + "\n");
  }

  private static String arg(String[] xiArgs, int xiIndex) throws CommandException
  {
    if (xiArgs.length <= xiIndex)
    {
      throw new CommandException("missing argument");
    }
    return xiArgs[xiIndex];
  }
}
