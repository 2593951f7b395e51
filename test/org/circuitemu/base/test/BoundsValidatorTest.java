package org.circuitemu.base.test;

import static org.circuitemu.base.util.circuit.Gates.and;
import static org.circuitemu.base.util.circuit.Gates.input;
import static org.circuitemu.base.util.circuit.Gates.not;
import static org.circuitemu.base.util.circuit.Gates.or;
import static org.circuitemu.base.util.circuit.Gates.xor;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.circuitemu.base.util.circuit.BoundsValidator;
import org.circuitemu.base.util.circuit.Circuit;
import org.circuitemu.base.util.circuit.CircuitNode;
import org.circuitemu.base.util.circuit.exceptions.InputOutOfBoundsException;
import org.junit.Test;

public class BoundsValidatorTest
{
  @Test
  public void testOutOfBoundsInputRejected()
  {
    try
    {
      new Circuit(2, or(input(0), input(5)));
      fail("Expected InputOutOfBoundsException");
    }
    catch (InputOutOfBoundsException lEx)
    {
      assertEquals(5, lEx.getIndex());
      assertEquals(2, lEx.getInputCount());
    }
  }

  @Test
  public void testIndexEqualToInputCountRejected()
  {
    try
    {
      BoundsValidator.validate(not(input(3)), 3);
      fail("Expected InputOutOfBoundsException");
    }
    catch (InputOutOfBoundsException lEx)
    {
      assertEquals(3, lEx.getIndex());
      assertEquals(3, lEx.getInputCount());
    }
  }

  @Test
  public void testFirstOffenderReported() throws Exception
  {
    CircuitNode lTree = and(input(0), xor(input(7), not(input(9))), input(8));
    try
    {
      BoundsValidator.validate(lTree, 4);
      fail("Expected InputOutOfBoundsException");
    }
    catch (InputOutOfBoundsException lEx)
    {
      assertEquals(7, lEx.getIndex());
    }
  }

  @Test
  public void testDeeplyNestedOffenderFound()
  {
    CircuitNode lTree = input(0);
    for (int lii = 0; lii < 50; lii++)
    {
      lTree = (lii % 2 == 0) ? not(lTree) : or(input(1), lTree);
    }
    lTree = and(lTree, not(not(input(2))));

    try
    {
      BoundsValidator.validate(lTree, 2);
      fail("Expected InputOutOfBoundsException");
    }
    catch (InputOutOfBoundsException lEx)
    {
      assertEquals(2, lEx.getIndex());
    }
  }

  @Test
  public void testAllIndicesInBoundsAccepted() throws Exception
  {
    CircuitNode lTree = and(input(0), or(input(1), input(2)), not(input(3)));
    BoundsValidator.validate(lTree, 4);
    BoundsValidator.validate(lTree, 10);

    Circuit lCircuit = new Circuit(4, lTree);
    assertEquals(4, lCircuit.getInputCount());
  }

  @Test
  public void testUnusedInputsAllowed() throws Exception
  {
    Circuit lCircuit = new Circuit(8, xor(input(0), input(7)));
    assertEquals(8, lCircuit.getInputCount());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeInputCountRejected() throws Exception
  {
    new Circuit(-1, not(input(0)));
  }
}
