package org.distgo.base.apps.coordinator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Properties;

import org.distgo.base.board.Coord;
import org.distgo.base.board.Stone;
import org.distgo.base.distributed.ConsensusBook;
import org.distgo.base.distributed.Coordinator;
import org.distgo.base.distributed.DistributedConfiguration;
import org.distgo.base.distributed.JournalEntry;
import org.distgo.base.distributed.Protocol;
import org.distgo.base.time.DefaultTimeStopCalculator;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CommandLoopTest
{
  @Rule
  public TemporaryFolder mFolder = new TemporaryFolder();

  private Protocol       mProtocol;
  private Coordinator    mCoordinator;

  @Before
  public void setUp()
  {
    Properties lProperties = new Properties();
    lProperties.setProperty("slave_port", "0");
    lProperties.setProperty("silence_limit", "200");

    mProtocol = new Protocol(4);
    mCoordinator = new Coordinator(mProtocol,
                                   new DistributedConfiguration(lProperties),
                                   new DefaultTimeStopCalculator(),
                                   new ConsensusBook(1000, mFolder.getRoot(), 100));
  }

  @Test
  public void testLocalCommands() throws IOException
  {
    StringWriter lOut = new StringWriter();
    CommandLoop lLoop = new CommandLoop(mCoordinator,
                                        new BufferedReader(new StringReader("1 name\n" +
                                                                            "# comment\n" +
                                                                            "\n" +
                                                                            "2 protocol_version\n" +
                                                                            "3 final_score\n" +
                                                                            "4 kgs-chat private bob winrate\n" +
                                                                            "5 time_left b 30 0\n" +
                                                                            "6 uct_genbook\n" +
                                                                            "7 play black\n" +
                                                                            "8 genmove purple\n" +
                                                                            "9 final_status_list alive\n")),
                                        lOut);
    lLoop.run();

    assertEquals("=1 distgo\n\n" +
                 "=2 2\n\n" +
                 "?3 scoring not supported\n\n" +
                 "?4 unknown chat command\n\n" +
                 "=5\n\n" +
                 "=6\n\n" +
                 "?7 missing argument\n\n" +
                 "?8 Not a colour: 'purple'\n\n" +
                 "?9 only dead stones are supported\n\n",
                 lOut.toString());

    // The book search was withdrawn once done.
    assertTrue(mProtocol.getHistory().isEmpty());
  }

  @Test
  public void testGame() throws IOException
  {
    StringWriter lOut = new StringWriter();
    CommandLoop lLoop = new CommandLoop(mCoordinator,
                                        new BufferedReader(new StringReader("boardsize 9\n" +
                                                                            "komi 6.5\n" +
                                                                            "play b E5\n" +
                                                                            "12 genmove white\n" +
                                                                            "quit\n" +
                                                                            "name\n")),
                                        lOut);
    lLoop.run();

    // Nothing after quit is processed.
    assertEquals("=\n\n=\n\n=\n\n=12 pass\n\n=\n\n", lOut.toString());

    assertEquals(9, lLoop.getBoard().getSize());
    assertEquals(6.5, lLoop.getBoard().getKomi(), 0);
    assertEquals(Stone.BLACK, lLoop.getBoard().getStoneAt(Coord.parse("E5", 9)));
    assertEquals(2, lLoop.getBoard().getMoveCount());

    List<JournalEntry> lHistory = mProtocol.getHistory();
    assertEquals(4, lHistory.size());
    assertEquals("1 boardsize 9\n", lHistory.get(0).toWireFormat());
    assertEquals("2 komi 6.5\n", lHistory.get(1).toWireFormat());
    assertEquals("3 play b E5\n", lHistory.get(2).toWireFormat());
    assertEquals("5 play white pass\n", lHistory.get(3).toWireFormat());
  }
}
