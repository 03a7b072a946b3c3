/*
** This file is part of OSPREY 3.0
** 
** OSPREY Protein Redesign Software Version 3.0
** Copyright (C) 2001-2018 Bruce Donald Lab, Duke University
** 
** OSPREY is free software: you can redistribute it and/or modify
** it under the terms of the GNU General Public License version 2
** as published by the Free Software Foundation.
** 
** You should have received a copy of the GNU General Public License
** along with OSPREY.  If not, see <http://www.gnu.org/licenses/>.
** 
** OSPREY relies on grants for its development, and since visibility
** in the scientific literature is essential for our success, we
** ask that users of OSPREY cite our papers. See the CITING_OSPREY
** document in this distribution for more information.
** 
** Contact Info:
**    Bruce Donald
**    Duke University
**    Department of Computer Science
**    Levine Science Research Center (LSRC)
**    Durham
**    NC 27708-0129
**    USA
**    e-mail: www.cs.duke.edu/brd/
** 
** <signature of Bruce Donald>, Mar 1, 2018
** Bruce Donald, Professor of Computer Science
*/

package edu.duke.cs.wigner.io;

import edu.duke.cs.wigner.symbols.QuantumNumbers;
import edu.duke.cs.wigner.symbols.SixJRequest;
import edu.duke.cs.wigner.symbols.SymbolRequest;
import edu.duke.cs.wigner.symbols.SymbolValue;
import edu.duke.cs.wigner.symbols.ThreeJRequest;
import edu.duke.cs.wigner.symbols.WignerCalculator;
import org.apache.commons.math3.fraction.BigFraction;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.function.Predicate;


/**
 * Prompts for one symbol, evaluates it, and prints the result.
 * Bad input is answered with a message and the same prompt again.
 */
public class InteractiveSession {

	public static final String BadSelectionMessage = "Invalid selection. Please enter '3' for 3-j symbol or '6' for 6-j symbol.";
	public static final String BadNumberMessage = "Invalid input. Please enter a valid fraction (e.g., 1/2) or integer.";
	public static final String BadAngularMomentumMessage = "Invalid input. Angular momentum must be a non-negative integer or half-integer.";
	public static final String BadMagneticMessage = "Invalid input. Magnetic quantum number must be an integer or half-integer.";

	private final BufferedReader in;
	private final PrintStream out;
	private final WignerCalculator calculator;
	private final ResultFormatter formatter;

	public InteractiveSession(BufferedReader in, PrintStream out, WignerCalculator calculator, ResultFormatter formatter) {
		this.in = in;
		this.out = out;
		this.calculator = calculator;
		this.formatter = formatter;
	}

	/**
	 * Runs one computation.
	 * @throws EOFException if the input ends before a symbol was fully entered
	 */
	public SymbolValue run()
	throws IOException {

		out.println("=".repeat(60));
		out.println("WIGNER SYMBOLS CALCULATOR");
		out.println("=".repeat(60));
		out.println("Calculate quantum angular momentum coupling coefficients");
		out.println();

		String selection;
		while (true) {
			selection = prompt("Select symbol type (3-j or 6-j). Enter 3 or 6: ").trim();
			if (selection.equals("3") || selection.equals("6")) {
				break;
			}
			out.println(BadSelectionMessage);
		}

		SymbolRequest request = selection.equals("3") ? readThreeJ() : readSixJ();
		SymbolValue value = calculator.evaluate(request);

		out.println();
		out.print(formatter.formatResult(value));
		out.flush();
		return value;
	}

	private ThreeJRequest readThreeJ()
	throws IOException {

		printSectionHeader("WIGNER 3-j SYMBOL CALCULATION", "Enter angular momentum (j) and magnetic (m) quantum numbers");

		BigFraction j1 = readAngularMomentum("j1");
		BigFraction j2 = readAngularMomentum("j2");
		BigFraction j3 = readAngularMomentum("j3");
		BigFraction m1 = readMagnetic("m1");
		BigFraction m2 = readMagnetic("m2");
		BigFraction m3 = readMagnetic("m3");
		return new ThreeJRequest(j1, j2, j3, m1, m2, m3);
	}

	private SixJRequest readSixJ()
	throws IOException {

		printSectionHeader("WIGNER 6-j SYMBOL CALCULATION", "Enter angular momentum quantum numbers");

		BigFraction j1 = readAngularMomentum("j1");
		BigFraction j2 = readAngularMomentum("j2");
		BigFraction j3 = readAngularMomentum("j3");
		BigFraction j4 = readAngularMomentum("j4");
		BigFraction j5 = readAngularMomentum("j5");
		BigFraction j6 = readAngularMomentum("j6");
		return new SixJRequest(j1, j2, j3, j4, j5, j6);
	}

	private void printSectionHeader(String title, String instructions) {
		out.println();
		out.println("-".repeat(40));
		out.println(title);
		out.println("-".repeat(40));
		out.println(instructions);
		out.println();
	}

	private BigFraction readAngularMomentum(String name)
	throws IOException {
		return readQuantumNumber(name, QuantumNumbers::isAngularMomentum, BadAngularMomentumMessage);
	}

	private BigFraction readMagnetic(String name)
	throws IOException {
		return readQuantumNumber(name, QuantumNumbers::isMagnetic, BadMagneticMessage);
	}

	private BigFraction readQuantumNumber(String name, Predicate<BigFraction> isInDomain, String domainMessage)
	throws IOException {
		while (true) {
			String text = prompt(String.format("Enter %s: ", name));
			BigFraction value;
			try {
				value = QuantumNumberParser.parse(text);
			} catch (QuantumNumberFormatException ex) {
				out.println(BadNumberMessage);
				continue;
			}
			if (isInDomain.test(value)) {
				return value;
			}
			out.println(domainMessage);
		}
	}

	private String prompt(String msg)
	throws IOException {
		out.print(msg);
		out.flush();
		String line = in.readLine();
		if (line == null) {
			throw new EOFException("input ended at prompt: " + msg.trim());
		}
		return line;
	}
}
