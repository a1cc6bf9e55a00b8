package greenscripter.wordbalance.jflap;

import java.util.LinkedHashMap;
import java.util.Map;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import greenscripter.wordbalance.automaton.BalanceAutomaton;
import greenscripter.wordbalance.automaton.PushdownAutomaton;
import greenscripter.wordbalance.automaton.State;
import greenscripter.wordbalance.automaton.Transition;

/**
 * Writes a pushdown automaton as a JFLAP 7 {@code pda} structure.
 */
public class AutomatonToJFlap {

	private static final Logger logger = LoggerFactory.getLogger(AutomatonToJFlap.class);

	public static void main(String[] args) throws IOException {
		File file = new File(args.length > 0 ? args[0] : "wordbalance.jff");
		write(BalanceAutomaton.INSTANCE, file);
		logger.info("Wrote {}", file.getAbsolutePath());
	}

	public static void write(PushdownAutomaton automaton, File file) throws IOException {
		try (BufferedWriter output = new BufferedWriter(new FileWriter(file))) {
			write(automaton, output);
		}
	}

	public static void write(PushdownAutomaton automaton, Writer output) throws IOException {
		//headers
		output.write("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?><!--Created with JFLAP 7.1.--><structure>");
		output.write("<type>pda</type>");
		output.write("<automaton>");

		//body
		Map<State, Integer> ids = new LinkedHashMap<>();
		int id = 0;
		for (State s : State.values()) {
			ids.put(s, id);
			output.write("<state id=\"" + id + "\" name=\"" + xmlEscape(s.id) + "\">");
			output.write("<x>" + (100.0 + 150.0 * id) + "</x>");
			output.write("<y>100.0</y>");
			if (automaton.initialState() == s) {
				output.write("<initial/>");
			}
			if (automaton.isFinal(s)) {
				output.write("<final/>");
			}
			output.write("</state>");
			id++;
		}

		int count = 0;
		for (Transition t : automaton.transitions()) {
			output.write("<transition>");
			output.write("<from>" + ids.get(t.source) + "</from>");
			output.write("<to>" + ids.get(t.target) + "</to>");
			output.write(element("read", t.read.toString()));
			output.write(element("pop", t.top.id));
			output.write(element("push", t.replacement()));
			output.write("</transition>");
			count++;
		}
		logger.debug("Exported {} states and {} transitions", ids.size(), count);

		//tails
		output.write("</automaton>");
		output.write("</structure>");
		output.flush();
	}

	static String element(String name, String value) {
		if (value.isEmpty()) {
			return "<" + name + "/>";
		}
		return "<" + name + ">" + xmlEscape(value) + "</" + name + ">";
	}

	public static String xmlEscape(String s) {
		return s.replace("&", "&amp;").replace("\"", "&quot;").replace("'", "&apos;").replace("<", "&lt;").replace(">", "&gt;");
	}

}
