package org.distgo.base.distributed;

/**
 * A command in the journal.  Immutable: rewriting a command replaces its entry.
 */
public class JournalEntry
{
  /**
   * Id of the command.  Unique and increasing within a journal.
   */
  public final int    mId;

  /**
   * The command verb, e.g. "play".
   */
  public final String mVerb;

  /**
   * Everything after the verb.  Either empty or terminated by a newline.
   */
  public final String mArgs;

  /**
   * Id of the command this one overwrote when it was given a new id, or 0.
   */
  public final int    mReplacesId;

  /**
   * Journal version at which this entry was written.
   */
  public final long   mRevision;

  JournalEntry(int xiId, String xiVerb, String xiArgs, int xiReplacesId, long xiRevision)
  {
    mId = xiId;
    mVerb = xiVerb;
    mArgs = (xiArgs.isEmpty() || xiArgs.endsWith("\n")) ? xiArgs : xiArgs + "\n";
    mReplacesId = xiReplacesId;
    mRevision = xiRevision;
  }

  /**
   * @return the command as sent to a worker.
   */
  public String toWireFormat()
  {
    if (mArgs.isEmpty())
    {
      return mId + " " + mVerb + "\n";
    }
    return mId + " " + mVerb + " " + mArgs;
  }

  @Override
  public String toString()
  {
    return mId + " " + mVerb;
  }
}
