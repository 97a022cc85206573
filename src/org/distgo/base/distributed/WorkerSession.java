package org.distgo.base.distributed;

/**
 * Synchronisation state of one connected worker.
 *
 * Only accessed under the {@link Protocol} lock.
 */
public class WorkerSession
{
  private final String mName;

  int                  mLastAckedId = 0;
  long                 mSentVersion = -1;

  /**
   * @param xiName - a name for the worker, unique among connected workers.
   */
  public WorkerSession(String xiName)
  {
    mName = xiName;
  }

  public String getName()
  {
    return mName;
  }

  /**
   * @return the id of the last command the worker acknowledged, or 0 if it has to be sent the whole history.
   */
  public int getLastAckedId()
  {
    return mLastAckedId;
  }

  @Override
  public String toString()
  {
    return mName;
  }
}
