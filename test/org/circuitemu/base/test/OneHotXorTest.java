package org.circuitemu.base.test;

import static org.circuitemu.base.util.circuit.Gates.input;
import static org.circuitemu.base.util.circuit.Gates.xor;

import java.util.LinkedList;

import org.circuitemu.base.util.circuit.Circuit;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * XOR over three inputs is true only when exactly one input is true - two or
 * three true inputs give false.
 */
@RunWith(Parameterized.class)
public class OneHotXorTest extends Assert
{
  @Parameters(name="{0}{1}{2}")
  public static Iterable<? extends Object> data()
  {
    LinkedList<Object[]> lTests = new LinkedList<>();

    lTests.add(new Object[] {0, 0, 0, false});
    lTests.add(new Object[] {0, 0, 1, true});
    lTests.add(new Object[] {0, 1, 0, true});
    lTests.add(new Object[] {0, 1, 1, false});
    lTests.add(new Object[] {1, 0, 0, true});
    lTests.add(new Object[] {1, 0, 1, false});
    lTests.add(new Object[] {1, 1, 0, false});
    lTests.add(new Object[] {1, 1, 1, false});

    return lTests;
  }

  @Parameter(value = 0) public int mA;
  @Parameter(value = 1) public int mB;
  @Parameter(value = 2) public int mC;
  @Parameter(value = 3) public boolean mExpected;

  @Test
  public void testThreeInputXor() throws Exception
  {
    Circuit lCircuit = new Circuit(3, xor(input(0), input(1), input(2)));
    assertEquals(mExpected, lCircuit.evaluate(new boolean[] {mA == 1, mB == 1, mC == 1}));
  }
}
