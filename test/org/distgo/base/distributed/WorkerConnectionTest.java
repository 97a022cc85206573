package org.distgo.base.distributed;

import static org.junit.Assert.assertEquals;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

import org.junit.Test;

public class WorkerConnectionTest
{
  @Test
  public void testReadReply() throws IOException
  {
    BufferedReader lIn = new BufferedReader(new StringReader("=1\n\n\n=2 10 20 1 1\nD4 5 0.5 0 0\n\n"));
    assertEquals("=1\n", WorkerConnection.readReply(lIn));
    assertEquals("=2 10 20 1 1\nD4 5 0.5 0 0\n", WorkerConnection.readReply(lIn));
  }

  @Test(expected = IOException.class)
  public void testConnectionDropped() throws IOException
  {
    BufferedReader lIn = new BufferedReader(new StringReader("=1 half a reply\n"));
    WorkerConnection.readReply(lIn);
  }
}
