package org.distgo.base.distributed;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class ReplyAggregatorTest
{
  @Test
  public void testOneReplyPerWorker()
  {
    ReplyAggregator lAggregator = new ReplyAggregator(3);
    lAggregator.record("a", "=1 first\n");
    lAggregator.record("b", "=1 second\n");
    lAggregator.record("a", "=1 third\n");

    assertEquals(2, lAggregator.size());
    assertEquals(Arrays.asList("=1 third\n", "=1 second\n"), lAggregator.getReplies());

    lAggregator.remove("a");
    assertEquals(Arrays.asList("=1 second\n"), lAggregator.getReplies());

    lAggregator.clear();
    assertEquals(0, lAggregator.size());
    assertEquals(3, lAggregator.getCapacity());
  }
}
