package org.distgo.base.distributed;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The replies received from workers to the current command: at most one per worker, in order of first arrival.
 *
 * Not thread-safe.  All access is under the {@link Protocol} lock.
 */
public class ReplyAggregator
{
  private final Map<String, String> mReplies = new LinkedHashMap<>();
  private final int                 mCapacity;

  /**
   * @param xiCapacity - the maximum number of workers.
   */
  public ReplyAggregator(int xiCapacity)
  {
    mCapacity = xiCapacity;
  }

  /**
   * Record a worker's reply, replacing any previous one from the same worker.
   *
   * @param xiWorker - the worker.
   * @param xiReply  - the reply.
   */
  public void record(String xiWorker, String xiReply)
  {
    assert(mReplies.containsKey(xiWorker) || mReplies.size() < mCapacity) : "More replies than workers";
    mReplies.put(xiWorker, xiReply);
  }

  /**
   * Drop a worker's reply (e.g. because it has disconnected).
   *
   * @param xiWorker - the worker.
   */
  public void remove(String xiWorker)
  {
    mReplies.remove(xiWorker);
  }

  public void clear()
  {
    mReplies.clear();
  }

  public int size()
  {
    return mReplies.size();
  }

  public int getCapacity()
  {
    return mCapacity;
  }

  /**
   * @return the replies, in order of first arrival.
   */
  public List<String> getReplies()
  {
    return new ArrayList<>(mReplies.values());
  }
}
