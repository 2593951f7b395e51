package org.circuitemu.base.apps.emulator;

import static org.circuitemu.base.util.circuit.Gates.and;
import static org.circuitemu.base.util.circuit.Gates.input;
import static org.circuitemu.base.util.circuit.Gates.not;
import static org.circuitemu.base.util.circuit.Gates.or;

import java.io.File;
import java.io.IOException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.circuitemu.base.util.circuit.Circuit;
import org.circuitemu.base.util.circuit.CircuitDotRenderer;
import org.circuitemu.base.util.circuit.TruthTable;
import org.circuitemu.base.util.circuit.exceptions.CircuitException;
import org.circuitemu.base.util.config.EmulatorConfiguration;
import org.circuitemu.base.util.config.EmulatorConfiguration.CfgItem;

/**
 * EmulatorRunner is a utility program that emulates the reference circuit
 * directly from the command line.
 *
 * See {@link #main} for the command-line arguments.
 */
public final class EmulatorRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String sHelp =
    "Args: [<assignment>]\n" +
    "      assignment - one 0/1 character per input, e.g. 1010.\n" +
    "      With no assignment, prints the full truth table.\n";

  private EmulatorRunner()
  {
  }

  /**
   * Build the reference circuit: I0 AND (I1 OR I2) AND NOT I3.
   *
   * @return the circuit.
   *
   * @throws CircuitException if the circuit is invalid (it isn't).
   */
  public static Circuit referenceCircuit() throws CircuitException
  {
    return new Circuit(4, and(input(0), or(input(1), input(2)), not(input(3))));
  }

  /**
   * Parse a string of 0/1 characters as an assignment.
   *
   * @param xiText - the text.
   *
   * @return the assignment, or null if the text contains anything other than 0 and 1.
   */
  public static boolean[] parseAssignment(String xiText)
  {
    boolean[] lAssignment = new boolean[xiText.length()];
    for (int lii = 0; lii < xiText.length(); lii++)
    {
      char lChar = xiText.charAt(lii);
      if (lChar == '1')
      {
        lAssignment[lii] = true;
      }
      else if (lChar != '0')
      {
        return null;
      }
    }
    return lAssignment;
  }

  /**
   * Run the emulator.
   *
   * @param args
   * - args[0] (optional) = assignment to evaluate, as 0/1 characters.
   */
  public static void main(String[] args)
  {
    System.exit(run(args));
  }

  /**
   * Run the emulator without exiting the VM.
   *
   * @param args - as for {@link #main}.
   *
   * @return the process exit status: 0 on success, 1 for bad arguments, 2 for
   *         a circuit error, 3 for an I/O failure.
   */
  public static int run(String[] args)
  {
    if (args.length > 1)
    {
      System.err.println(sHelp);
      return 1;
    }

    boolean[] lAssignment = null;
    if (args.length == 1)
    {
      lAssignment = parseAssignment(args[0]);
      if (lAssignment == null)
      {
        System.err.println(sHelp);
        return 1;
      }
    }

    ThreadContext.put("circuit", "reference");
    try
    {
      EmulatorConfiguration.logConfig();
      Circuit lCircuit = referenceCircuit();
      LOGGER.info("Emulating " + lCircuit);

      if (EmulatorConfiguration.getCfgBool(CfgItem.WRITE_CIRCUIT_AS_DOT))
      {
        File lDotFile = new File(EmulatorConfiguration.getCfgStr(CfgItem.DOT_FILE_NAME));
        CircuitDotRenderer.renderToFile(lCircuit, lDotFile);
        LOGGER.info("Wrote circuit to " + lDotFile.getAbsolutePath());
      }

      if (lAssignment == null)
      {
        TruthTable lTable = lCircuit.evaluateAll();
        LOGGER.info("Circuit is true in " + lTable.getTrueRowCount() + " of " + lTable.getRowCount() + " rows");
        System.out.print(lTable);
      }
      else
      {
        System.out.println(lCircuit.evaluate(lAssignment) ? "1" : "0");
      }
      return 0;
    }
    catch (CircuitException lEx)
    {
      LOGGER.error("Emulation failed: " + lEx.getMessage());
      return 2;
    }
    catch (IOException lEx)
    {
      LOGGER.error("Failed to write circuit", lEx);
      return 3;
    }
    finally
    {
      ThreadContext.remove("circuit");
    }
  }
}
