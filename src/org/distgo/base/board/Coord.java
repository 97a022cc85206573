package org.distgo.base.board;

/**
 * Coordinate algebra and the coordinate <-> text codec.
 *
 * A coordinate is an int.  Points are numbered row-major from the bottom left corner (y * size + x), so the natural
 * int ordering is raster order.  The two special moves sort before every point.
 */
public final class Coord
{
  /**
   * The pass move.
   */
  public static final int PASS = -1;

  /**
   * The resign move.
   */
  public static final int RESIGN = -2;

  // Column letters.  'I' is skipped by convention.
  private static final String COLUMNS = "ABCDEFGHJKLMNOPQRSTUVWXYZ";

  /**
   * Largest board the text codec supports.
   */
  public static final int MAX_BOARD_SIZE = COLUMNS.length();

  private Coord()
  {
    // Static helpers only.
  }

  public static int fromXY(int xiX, int xiY, int xiSize)
  {
    return xiY * xiSize + xiX;
  }

  public static int getX(int xiCoord, int xiSize)
  {
    return xiCoord % xiSize;
  }

  public static int getY(int xiCoord, int xiSize)
  {
    return xiCoord / xiSize;
  }

  /**
   * @return whether the coordinate is the pass move.
   *
   * @param xiCoord - the coordinate.
   */
  public static boolean isPass(int xiCoord)
  {
    return xiCoord == PASS;
  }

  /**
   * @return whether the coordinate names a point on a board of the given size (i.e. is neither a special move nor
   *         out of range).
   *
   * @param xiCoord - the coordinate.
   * @param xiSize  - board size.
   */
  public static boolean isOnBoard(int xiCoord, int xiSize)
  {
    return xiCoord >= 0 && xiCoord < xiSize * xiSize;
  }

  /**
   * Convert a coordinate to its textual form, e.g. "D4", "pass".
   *
   * @param xiCoord - the coordinate.
   * @param xiSize  - board size.
   *
   * @return the text.
   */
  public static String toString(int xiCoord, int xiSize)
  {
    if (xiCoord == PASS)
    {
      return "pass";
    }
    if (xiCoord == RESIGN)
    {
      return "resign";
    }

    return "" + COLUMNS.charAt(getX(xiCoord, xiSize)) + (getY(xiCoord, xiSize) + 1);
  }

  /**
   * Parse the textual form of a coordinate.  Case-insensitive.
   *
   * @param xiText - the text.
   * @param xiSize - board size.
   *
   * @return the coordinate.
   *
   * @throws IllegalArgumentException if the text isn't a coordinate on a board of this size.
   */
  public static int parse(String xiText, int xiSize)
  {
    String lText = xiText.trim().toUpperCase();
    if (lText.equals("PASS"))
    {
      return PASS;
    }
    if (lText.equals("RESIGN"))
    {
      return RESIGN;
    }
    if (lText.length() < 2)
    {
      throw new IllegalArgumentException("Bad coordinate: '" + xiText + "'");
    }

    int lX = COLUMNS.indexOf(lText.charAt(0));
    int lY;
    try
    {
      lY = Integer.parseInt(lText.substring(1)) - 1;
    }
    catch (NumberFormatException lEx)
    {
      throw new IllegalArgumentException("Bad coordinate: '" + xiText + "'", lEx);
    }

    if (lX < 0 || lX >= xiSize || lY < 0 || lY >= xiSize)
    {
      throw new IllegalArgumentException("Coordinate off board: '" + xiText + "'");
    }

    return fromXY(lX, lY, xiSize);
  }
}
