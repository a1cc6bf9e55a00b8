package greenscripter.wordbalance.testing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import greenscripter.wordbalance.simulator.Simulator;

/**
 * Sentences with their expected verdicts, stored one per line: {@code +} for
 * accepted and {@code -} for rejected, followed by the sentence. Blank lines
 * and lines starting with {@code #} are skipped.
 */
public class SentenceSet {

	private static final Logger logger = LoggerFactory.getLogger(SentenceSet.class);

	List<SentenceCase> cases = new ArrayList<>();

	public boolean logging;

	public SentenceSet() {

	}

	public SentenceSet(List<SentenceCase> cases) {
		this.cases.addAll(cases);
	}

	public SentenceSet(File tests) throws IOException {
		this(new FileReader(tests));
	}

	public SentenceSet(Reader tests) throws IOException {
		try (BufferedReader input = new BufferedReader(tests)) {
			String line;
			int lineNumber = 0;
			while ((line = input.readLine()) != null) {
				lineNumber++;
				if (line.isBlank() || line.startsWith("#")) {
					continue;
				}
				if (line.startsWith("+")) {
					cases.add(new SentenceCase(line.substring(1), true));
				} else if (line.startsWith("-")) {
					cases.add(new SentenceCase(line.substring(1), false));
				} else {
					throw new RuntimeException("Invalid test case on line " + lineNumber + ": " + line);
				}
			}
		}
	}

	public List<SentenceCase> getCases() {
		return Collections.unmodifiableList(cases);
	}

	public void add(SentenceCase c) {
		c.logging = logging;
		cases.add(c);
	}

	public void write(File file) throws IOException {
		try (BufferedWriter output = new BufferedWriter(new FileWriter(file))) {
			for (SentenceCase c : cases) {
				output.write(c.toString());
				output.write("\n");
			}
		}
	}

	public boolean test(Simulator simulator) {
		for (SentenceCase c : cases) {
			if (!c.test(simulator)) {
				if (logging) logger.warn("Failed case {}", c);
				return false;
			}
		}
		if (logging) logger.info("Passed {} tests.", cases.size());
		return true;
	}

	public void setLogging(boolean logging) {
		this.logging = logging;
		for (SentenceCase c : cases) {
			c.logging = logging;
		}
	}
}
