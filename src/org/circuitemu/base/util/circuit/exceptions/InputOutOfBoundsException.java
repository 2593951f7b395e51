package org.circuitemu.base.util.circuit.exceptions;

/**
 * Thrown when a circuit contains an input reference at or beyond its declared
 * input count.
 */
@SuppressWarnings("serial")
public final class InputOutOfBoundsException extends CircuitException
{
  private final int mIndex;
  private final int mInputCount;

  public InputOutOfBoundsException(int xiIndex, int xiInputCount)
  {
    super("Input index " + xiIndex + " is out of bounds for a circuit with " + xiInputCount + " inputs");
    mIndex = xiIndex;
    mInputCount = xiInputCount;
  }

  /**
   * @return the index of the offending input reference.
   */
  public int getIndex()
  {
    return mIndex;
  }

  /**
   * @return the declared number of inputs.
   */
  public int getInputCount()
  {
    return mInputCount;
  }
}
