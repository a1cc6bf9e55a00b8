package greenscripter.wordbalance.automaton;

import static greenscripter.wordbalance.utils.Utils.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * The full move table of an automaton, as written to {@code .dpda} listings.
 * <p>
 * The listing starts with the input symbols, the stack symbols, the states
 * marked {@code I} (initial) or {@code A} (accepting) and the initial stack
 * symbol, one comma separated line each. Every following line is one move:
 * {@code source,read,pop,push,target}, with push written top first and empty
 * for a pop.
 * <p>
 * Listings can be read back. The stack action of a loaded move follows from
 * its push string: empty pops (a cancellation unless the top is the bottom
 * marker), the top alone keeps, and a new symbol over the top pushes.
 */
public class TransitionTable {

	public final List<String> inputSymbols = new ArrayList<>();
	public final List<String> stackSymbols = new ArrayList<>();
	public final List<String> acceptingStates = new ArrayList<>();
	public final String initialState;
	public final String initialStackSymbol;
	public final Map<State, List<Transition>> transitions = new LinkedHashMap<>();

	public TransitionTable(PushdownAutomaton automaton) {
		for (Symbol s : Symbol.alphabet()) {
			inputSymbols.add(s.toString());
		}
		for (StackSymbol s : StackSymbol.values()) {
			stackSymbols.add(s.id);
		}
		for (State s : State.values()) {
			if (automaton.isFinal(s)) {
				acceptingStates.add(s.id);
			}
		}
		initialState = automaton.initialState().id;
		initialStackSymbol = automaton.initialStackSymbol().id;
		for (Transition t : enumerate(automaton)) {
			transitions.computeIfAbsent(t.source, k -> new ArrayList<>()).add(t);
		}
	}

	public TransitionTable(File file) throws IOException {
		this(new FileReader(file));
	}

	public TransitionTable(Reader reader) throws IOException {
		try (BufferedReader input = new BufferedReader(reader)) {
			inputSymbols.addAll(splitCommas(header(input, "input symbols")));
			stackSymbols.addAll(splitCommas(header(input, "stack symbols")));

			List<String> stateData = splitCommas(header(input, "states"));
			if (stateData.size() % 2 != 0) {
				throw new RuntimeException("Invalid state configuration, " + stateData.size() + " is not even.");
			}
			String initial = null;
			for (int i = 0; i < stateData.size(); i += 2) {
				String name = stateData.get(i);
				state(name, 3);
				switch (stateData.get(i + 1)) {
					case "I" -> {
						if (initial != null) {
							throw new RuntimeException("Duplicate initial states: " + initial + ", " + name);
						}
						initial = name;
					}
					case "A" -> {
						if (acceptingStates.contains(name)) {
							throw new RuntimeException("Duplicate accept marks for state " + name);
						}
						acceptingStates.add(name);
					}
					default -> throw new RuntimeException("Unexpected state mark: " + stateData.get(i + 1));
				}
			}
			if (initial == null) {
				throw new RuntimeException("No initial state.");
			}
			initialState = initial;
			initialStackSymbol = stackSymbol(header(input, "initial stack symbol"), 4).id;

			String line;
			int lineNumber = 4;
			while ((line = input.readLine()) != null) {
				lineNumber++;
				if (line.isEmpty()) {
					continue;
				}
				Transition trans = parseTransition(splitCommas(line), lineNumber);
				List<Transition> others = transitions.computeIfAbsent(trans.source, k -> new ArrayList<>());
				for (Transition other : others) {
					if (other.read == trans.read && other.top == trans.top) {
						throw new RuntimeException("Duplicate transitions for symbol '" + trans.read + "' with " + trans.top + " on state " + trans.source);
					}
				}
				others.add(trans);
			}
		}
	}

	/**
	 * @return the move for this combination, or null if the table has none
	 */
	public Transition get(State state, StackSymbol top, Symbol read) {
		List<Transition> moves = transitions.get(state);
		if (moves == null) {
			return null;
		}
		for (Transition t : moves) {
			if (t.top == top && t.read == read) {
				return t;
			}
		}
		return null;
	}

	private static String header(BufferedReader input, String name) throws IOException {
		String line = input.readLine();
		if (line == null) {
			throw new RuntimeException("Listing ended before the " + name + " line.");
		}
		return line;
	}

	private static Transition parseTransition(List<String> parts, int lineNumber) {
		if (parts.size() != 5) {
			throw new RuntimeException("Expected source,read,pop,push,target on line " + lineNumber + ", got " + parts.size() + " fields.");
		}
		State source = state(parts.get(0), lineNumber);
		Symbol read = parts.get(1).length() == 1 ? Symbol.of(parts.get(1).charAt(0)) : null;
		if (read == null) {
			throw new RuntimeException("Unknown input symbol '" + parts.get(1) + "' on line " + lineNumber);
		}
		StackSymbol top = stackSymbol(parts.get(2), lineNumber);
		String push = parts.get(3);
		State target = state(parts.get(4), lineNumber);

		if (push.isEmpty()) {
			StackAction action = top == StackSymbol.BOTTOM ? StackAction.POP : StackAction.CANCEL;
			return new Transition(source, top, read, target, action, null);
		}
		if (push.equals(top.id)) {
			return new Transition(source, top, read, target, StackAction.KEEP, null);
		}
		if (push.length() == 2 && push.endsWith(top.id)) {
			return new Transition(source, top, read, target, StackAction.PUSH, stackSymbol(push.substring(0, 1), lineNumber));
		}
		throw new RuntimeException("Unsupported push '" + push + "' over " + top + " on line " + lineNumber);
	}

	private static State state(String id, int lineNumber) {
		State state = State.of(id);
		if (state == null) {
			throw new RuntimeException("Unknown state '" + id + "' on line " + lineNumber);
		}
		return state;
	}

	private static StackSymbol stackSymbol(String id, int lineNumber) {
		StackSymbol symbol = StackSymbol.of(id);
		if (symbol == null) {
			throw new RuntimeException("Unknown stack symbol '" + id + "' on line " + lineNumber);
		}
		return symbol;
	}

	public static List<Transition> enumerate(PushdownAutomaton automaton) {
		List<Transition> result = new ArrayList<>();
		for (State state : State.values()) {
			for (Symbol read : Symbol.alphabet()) {
				for (StackSymbol top : StackSymbol.values()) {
					Transition t = automaton.transition(state, top, read);
					if (t != null) {
						result.add(t);
					}
				}
			}
		}
		return result;
	}

	public int size() {
		int size = 0;
		for (List<Transition> state : transitions.values()) {
			size += state.size();
		}
		return size;
	}

	public void write(File file) throws IOException {
		try (BufferedWriter output = new BufferedWriter(new FileWriter(file))) {
			write(output);
		}
	}

	public void write(Writer output) throws IOException {
		output.write(mergeCommas(inputSymbols));
		output.write("\n");
		output.write(mergeCommas(stackSymbols));
		output.write("\n");
		List<String> stateFragments = new ArrayList<>();
		stateFragments.add(initialState);
		stateFragments.add("I");
		for (String s : acceptingStates) {
			stateFragments.add(s);
			stateFragments.add("A");
		}
		output.write(mergeCommas(stateFragments));
		output.write("\n");
		output.write(initialStackSymbol);
		output.write("\n");
		for (List<Transition> state : transitions.values()) {
			for (Transition t : state) {
				output.write(t.toString());
				output.write("\n");
			}
		}
		output.flush();
	}
}
