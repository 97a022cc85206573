package org.distgo.base.board;

/**
 * Colour of a point on the board, or of the player to move.
 */
public enum Stone
{
  /**
   * Empty point.
   */
  NONE("none"),

  /**
   * Black stone / black to play.
   */
  BLACK("black"),

  /**
   * White stone / white to play.
   */
  WHITE("white");

  private final String mName;

  private Stone(String xiName)
  {
    mName = xiName;
  }

  /**
   * @return the opposing colour.  The opponent of NONE is NONE.
   */
  public Stone other()
  {
    switch (this)
    {
      case BLACK:
        return WHITE;
      case WHITE:
        return BLACK;
      default:
        return NONE;
    }
  }

  /**
   * Parse a colour as sent on the command channel ("b", "black", "w", "white").
   *
   * @param xiText - the text.
   *
   * @return the colour.
   */
  public static Stone parse(String xiText)
  {
    String lText = xiText.trim().toLowerCase();
    if (lText.equals("b") || lText.equals("black"))
    {
      return BLACK;
    }
    if (lText.equals("w") || lText.equals("white"))
    {
      return WHITE;
    }
    throw new IllegalArgumentException("Not a colour: '" + xiText + "'");
  }

  @Override
  public String toString()
  {
    return mName;
  }
}
