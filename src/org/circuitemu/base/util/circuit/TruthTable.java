package org.circuitemu.base.util.circuit;

import java.io.IOException;
import java.io.Writer;

import org.apache.commons.lang.StringUtils;
import org.apache.lucene.util.OpenBitSet;

/**
 * The outputs of a circuit for every possible assignment, in counting order.
 * <p>
 * Row {@code i} holds the output for the assignment obtained by reading
 * {@code i} as a binary number: bit {@code b} (0 being least significant)
 * supplies input {@code inputCount - 1 - b}, so the most significant bit of
 * the counter drives input 0.
 * <p>
 * Instances are created by {@link Circuit#evaluateAll()} and are immutable.
 */
public final class TruthTable
{
  private final int        mInputCount;
  private final int        mRowCount;
  private final OpenBitSet mOutputs;

  TruthTable(int xiInputCount, OpenBitSet xiOutputs)
  {
    mInputCount = xiInputCount;
    mRowCount = 1 << xiInputCount;
    mOutputs = xiOutputs;
  }

  /**
   * Populate an assignment from a row counter.
   *
   * @param xiRow - the row counter.
   * @param xoAssignment - the assignment to populate.  Its length is the input count.
   */
  static void fillAssignment(int xiRow, boolean[] xoAssignment)
  {
    int lInputCount = xoAssignment.length;
    for (int lBit = 0; lBit < lInputCount; lBit++)
    {
      xoAssignment[lInputCount - lBit - 1] = ((xiRow >> lBit) & 1) != 0;
    }
  }

  public int getInputCount()
  {
    return mInputCount;
  }

  /**
   * @return the number of rows - always 2^inputCount.
   */
  public int getRowCount()
  {
    return mRowCount;
  }

  /**
   * @return the circuit output for the specified row.
   *
   * @param xiRow - the row.
   */
  public boolean getOutput(int xiRow)
  {
    checkRow(xiRow);
    return mOutputs.fastGet(xiRow);
  }

  /**
   * @return a fresh copy of the assignment that produced the specified row.
   *
   * @param xiRow - the row.
   */
  public boolean[] getAssignment(int xiRow)
  {
    checkRow(xiRow);
    boolean[] lAssignment = new boolean[mInputCount];
    fillAssignment(xiRow, lAssignment);
    return lAssignment;
  }

  /**
   * @return the number of rows for which the circuit output is true.
   */
  public int getTrueRowCount()
  {
    return (int)mOutputs.cardinality();
  }

  private void checkRow(int xiRow)
  {
    if (xiRow < 0 || xiRow >= mRowCount)
    {
      throw new IndexOutOfBoundsException("Row " + xiRow + " of " + mRowCount);
    }
  }

  /**
   * Write the table as text: a header of input labels and the output label,
   * then one line per row in counting order.  Header cells are four characters
   * wide, as are the data cells, so each label sits above its column.
   *
   * @param xiOutput - the output stream to write to.
   *
   * @throws IOException if there was a problem writing the table.
   */
  public void renderAsText(Writer xiOutput) throws IOException
  {
    StringBuilder lLine = new StringBuilder();
    appendHeader(lLine);
    xiOutput.write(lLine.toString());

    for (int lRow = 0; lRow < mRowCount; lRow++)
    {
      lLine.setLength(0);
      appendRow(lLine, lRow);
      xiOutput.write(lLine.toString());
    }
  }

  private void appendHeader(StringBuilder xiBuilder)
  {
    for (int lii = 0; lii < mInputCount; lii++)
    {
      xiBuilder.append('I').append(StringUtils.rightPad(String.valueOf(lii), 2)).append(' ');
    }
    xiBuilder.append("O1\n");
  }

  private void appendRow(StringBuilder xiBuilder, int xiRow)
  {
    for (int lBit = mInputCount - 1; lBit >= 0; lBit--)
    {
      xiBuilder.append((xiRow >> lBit) & 1).append("   ");
    }
    xiBuilder.append(mOutputs.fastGet(xiRow) ? '1' : '0').append('\n');
  }

  @Override
  public String toString()
  {
    StringBuilder lBuilder = new StringBuilder();
    appendHeader(lBuilder);
    for (int lRow = 0; lRow < mRowCount; lRow++)
    {
      appendRow(lBuilder, lRow);
    }
    return lBuilder.toString();
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof TruthTable))
    {
      return false;
    }
    TruthTable lOther = (TruthTable)xiOther;
    return (mInputCount == lOther.mInputCount) && mOutputs.equals(lOther.mOutputs);
  }

  @Override
  public int hashCode()
  {
    return 31 * mInputCount + mOutputs.hashCode();
  }
}
