package greenscripter.wordbalance.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import greenscripter.wordbalance.simulator.Simulator;
import greenscripter.wordbalance.simulator.StepsTable;
import greenscripter.wordbalance.simulator.TraceResult;
import greenscripter.wordbalance.simulator.Verdict;

/**
 * Console menu around the simulator. Reads choices and sentences line by line
 * and stops on choice 3 or at the end of the input.
 */
public class Menu {

	private static final Logger logger = LoggerFactory.getLogger(Menu.class);

	static final String RULE = "========================================================================================";
	static final String CLEAR = "\033[H\033[2J";

	public static void main(String[] args) throws IOException {
		Menu menu = new Menu(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out, new Simulator());
		for (String arg : args) {
			switch (arg) {
				case "--steps" -> menu.showSteps = true;
				case "--no-clear" -> menu.clearScreen = false;
				default -> {
					System.err.println("Unknown option: " + arg);
					System.err.println("Usage: Menu [--steps] [--no-clear]");
					System.exit(2);
				}
			}
		}
		menu.loop();
	}

	public boolean showSteps = false;
	public boolean clearScreen = true;

	final BufferedReader in;
	final PrintStream out;
	final Simulator simulator;

	public Menu(Reader in, PrintStream out, Simulator simulator) {
		this.in = new BufferedReader(in);
		this.out = out;
		this.simulator = simulator;
	}

	public void loop() throws IOException {
		while (true) {
			clear();
			banner();
			out.println("CHOICES:");
			out.println();
			out.println("[1] Input a String");
			out.println("[2] Show Step-By-Step [" + (showSteps ? "ON" : "OFF") + "]");
			out.println("[3] Exit Program");
			out.println();
			out.println(RULE);
			out.println();
			String choice = prompt("Choice: ", InputValidator.MENU);
			if (choice == null) {
				logger.debug("Input closed, leaving menu");
				return;
			}
			switch (Integer.parseInt(choice)) {
				case 1 -> {
					if (!inputString()) {
						return;
					}
				}
				case 2 -> showSteps = !showSteps;
				case 3 -> {
					clear();
					return;
				}
				default -> throw new IllegalStateException("Unvalidated menu choice: " + choice);
			}
		}
	}

	/**
	 * @return false if the input ended while waiting for the user
	 */
	boolean inputString() throws IOException {
		clear();
		banner();
		out.println("Valid input is [a-z ] -- that means alphabet and space.");
		out.println();
		out.println(RULE);
		out.println();
		String sentence = prompt("Input words here: ", InputValidator.SENTENCE);
		if (sentence == null) {
			return false;
		}
		out.println();
		out.println(RULE);
		Verdict verdict = check(sentence.toLowerCase(Locale.ROOT));
		out.println();
		out.println(verdict.isAccepted() ? "INPUT IS ACCEPTED" : "INPUT IS REJECTED");
		out.println();
		out.println(RULE);
		out.println();
		out.print("Press Enter to continue.");
		out.flush();
		return in.readLine() != null;
	}

	/**
	 * Decides an already validated, lowercase sentence, printing the steps first if enabled.
	 */
	public Verdict check(String sentence) {
		String input = Simulator.terminate(sentence);
		if (showSteps) {
			TraceResult trace = simulator.trace(input);
			out.println();
			out.println(StepsTable.render(trace));
			out.println();
		}
		Verdict verdict = simulator.run(input);
		logger.info("'{}' is {}", sentence, verdict);
		return verdict;
	}

	String prompt(String text, InputValidator validator) throws IOException {
		while (true) {
			out.print(text);
			out.flush();
			String line = in.readLine();
			if (line == null) {
				return null;
			}
			String message = validator.validate(line);
			if (message == null) {
				return line;
			}
			if (!message.isEmpty()) {
				out.println(message);
			}
		}
	}

	void banner() {
		out.println(RULE);
		out.println();
		out.println("Verifies if the string's first letter per word has the same number of consonants/vowels.");
		out.println();
		out.println("For example: captivating melodies echo across the ocean enchanting all who listen");
		out.println("1st letters: c           m        e    a      t   o     e          a   w   l");
		out.println();
		out.println("c, m, e, a, t, o, e, a, w, l");
		out.println("This string's words has 5 consonants and 5 vowels as their first letter.");
		out.println("Because they are balanced, the string will be accepted.");
		out.println();
		out.println(RULE);
		out.println();
	}

	void clear() {
		if (clearScreen) {
			out.print(CLEAR);
			out.flush();
		}
	}
}
