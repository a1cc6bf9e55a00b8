package greenscripter.wordbalance.simulator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import greenscripter.wordbalance.automaton.BalanceAutomaton;
import greenscripter.wordbalance.automaton.PushdownAutomaton;
import greenscripter.wordbalance.automaton.State;
import greenscripter.wordbalance.automaton.Symbol;
import greenscripter.wordbalance.automaton.Transition;

/**
 * Runs a {@link PushdownAutomaton} over one input at a time. A simulator keeps
 * no state between calls, so one instance can serve any number of callers.
 */
public class Simulator {

	private static final Logger logger = LoggerFactory.getLogger(Simulator.class);

	public static void main(String[] args) {
		Simulator simulator = new Simulator();
		String input = args.length > 0 ? String.join(" ", args) + Symbol.END_MARKER : "cat apple!";
		TraceResult trace = simulator.trace(input);
		System.out.println(StepsTable.render(trace));
		System.out.println(trace.verdict);
	}

	final PushdownAutomaton automaton;

	public Simulator() {
		this(BalanceAutomaton.INSTANCE);
	}

	public Simulator(PushdownAutomaton automaton) {
		this.automaton = automaton;
	}

	/**
	 * Decides {@code input}, which must be a sentence followed by the end marker.
	 *
	 * @throws MalformedInputException if the input breaks that contract; no step is taken then
	 */
	public Verdict run(String input) {
		parse(input);
		Run run = new Run(input);
		while (!run.isTerminated()) {
			run.step();
		}
		return Verdict.of(run.isAccepting());
	}

	public Verdict run(List<Symbol> input) {
		StringBuilder sb = new StringBuilder();
		for (Symbol s : input) {
			sb.append(s.character);
		}
		return run(sb.toString());
	}

	/**
	 * Lazily yields the initial configuration followed by one configuration per
	 * symbol read. The iterator cannot be restarted. Input problems surface from
	 * {@code hasNext} when the simulator reaches them, as a
	 * {@link MalformedInputException}, and a pop from an empty stack as a
	 * {@link StackUnderflowException}.
	 */
	public Iterator<Configuration> stepwise(String input) {
		return new ConfigurationIterator(new Run(input));
	}

	/**
	 * Collects every configuration of a run. Failures are reported through the
	 * result together with the configurations produced before them.
	 */
	public TraceResult trace(String input) {
		List<Configuration> configurations = new ArrayList<>();
		Run run = new Run(input);
		Iterator<Configuration> steps = new ConfigurationIterator(run);
		try {
			while (steps.hasNext()) {
				configurations.add(steps.next());
			}
		} catch (MalformedInputException e) {
			logger.warn("Malformed trace after {} configurations: {}", configurations.size(), e.getMessage());
			return TraceResult.malformed(configurations, e.getMessage());
		} catch (StackUnderflowException e) {
			logger.warn("Stack exhausted after {} configurations", configurations.size());
			return TraceResult.stackExhausted(configurations, e.getMessage());
		}
		return TraceResult.complete(configurations, Verdict.of(run.isAccepting()));
	}

	/**
	 * Checks the whole input against the input contract.
	 *
	 * @return the symbols of {@code input}, the last one being {@link Symbol#END}
	 */
	public static List<Symbol> parse(String input) {
		if (input == null || input.isEmpty()) {
			throw new MalformedInputException("Input is empty.", 0);
		}
		List<Symbol> symbols = new ArrayList<>();
		for (int i = 0; i < input.length(); i++) {
			symbols.add(read(input, i));
		}
		if (symbols.get(symbols.size() - 1) != Symbol.END) {
			throw new MalformedInputException("Input ended without the end marker '" + Symbol.END_MARKER + "'.", input.length());
		}
		return symbols;
	}

	/**
	 * Appends the end marker to a sentence, as callers of {@link #run(String)} are expected to.
	 */
	public static String terminate(String sentence) {
		return sentence + Symbol.END_MARKER;
	}

	static Symbol read(String input, int position) {
		char c = input.charAt(position);
		Symbol symbol = Symbol.of(c);
		if (symbol == null) {
			throw new MalformedInputException("Character '" + c + "' is outside the input alphabet [a-z ].", position);
		}
		if (symbol == Symbol.END && position != input.length() - 1) {
			throw new MalformedInputException("End marker before the end of the input.", position);
		}
		return symbol;
	}

	/**
	 * The mutable part of one simulation. Never shared between calls.
	 */
	class Run {

		final String input;
		State state;
		Stack stack;
		int cursor = 0;
		int steps = 0;
		boolean terminated = false;

		Run(String input) {
			this.input = input == null ? "" : input;
			state = automaton.initialState();
			stack = new Stack(automaton.initialStackSymbol());
		}

		/**
		 * @return whether a move was made
		 */
		boolean step() {
			if (terminated) {
				return false;
			}
			if (cursor >= input.length()) {
				terminated = true;
				throw new MalformedInputException(input.isEmpty() ? "Input is empty." : "Input ended without the end marker '" + Symbol.END_MARKER + "'.", cursor);
			}
			Symbol symbol = read(input, cursor);
			Transition t = automaton.transition(state, stack.top(), symbol);
			if (t == null) {
				logger.debug("No transition from {} on '{}' with {} on top", state, symbol, stack.top());
				terminated = true;
				return false;
			}
			switch (t.action) {
				case POP, CANCEL -> stack.pop();
				case PUSH -> stack.push(t.pushed);
				case KEEP -> {
				}
			}
			steps++;
			cursor++;
			state = t.target;
			if (logger.isDebugEnabled()) {
				logger.debug("Step {}: {} -> stack {}", steps, t, stack);
			}
			if (symbol == Symbol.END) {
				terminated = true;
			}
			return true;
		}

		boolean isTerminated() {
			return terminated;
		}

		boolean isAccepting() {
			return terminated && automaton.isFinal(state) && stack.isEmpty();
		}

		Configuration configuration() {
			return new Configuration(state, input.substring(cursor), stack.topToBottom());
		}
	}

	static class ConfigurationIterator implements Iterator<Configuration> {

		final Run run;
		Configuration pending;

		ConfigurationIterator(Run run) {
			this.run = run;
			pending = run.configuration();
		}

		@Override
		public boolean hasNext() {
			if (pending == null && !run.isTerminated() && run.step()) {
				pending = run.configuration();
			}
			return pending != null;
		}

		@Override
		public Configuration next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			Configuration c = pending;
			pending = null;
			return c;
		}
	}
}
