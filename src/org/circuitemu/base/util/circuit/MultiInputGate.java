package org.circuitemu.base.util.circuit;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang.StringUtils;

/**
 * Base class for gates over an ordered sequence of at least two inputs.
 */
public abstract class MultiInputGate extends CircuitNode
{
  /**
   * The inputs, in order.  Never modified after construction.
   */
  protected final CircuitNode[] mInputsArray;
  private final List<CircuitNode> mInputsList;
  private final String mName;

  MultiInputGate(String xiName, Collection<? extends CircuitNode> xiInputs)
  {
    mName = xiName;
    if (xiInputs == null || xiInputs.size() < 2)
    {
      throw new IllegalArgumentException(xiName + " gate requires at least two inputs");
    }

    mInputsArray = xiInputs.toArray(new CircuitNode[xiInputs.size()]);
    for (CircuitNode lInput : mInputsArray)
    {
      if (lInput == null)
      {
        throw new IllegalArgumentException(xiName + " gate inputs must not be null");
      }
    }
    mInputsList = Collections.unmodifiableList(Arrays.asList(mInputsArray));
  }

  @Override
  public List<CircuitNode> getInputs()
  {
    return mInputsList;
  }

  /**
   * @return the label used for this kind of gate.
   */
  public String getName()
  {
    return mName;
  }

  @Override
  public String toString()
  {
    return getName() + "(" + StringUtils.join(mInputsArray, ", ") + ")";
  }
}
