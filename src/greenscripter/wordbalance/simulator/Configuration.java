package greenscripter.wordbalance.simulator;

import static greenscripter.wordbalance.utils.Utils.*;

import java.util.List;

import greenscripter.wordbalance.automaton.StackSymbol;
import greenscripter.wordbalance.automaton.State;

/**
 * A snapshot of one run: control state, unread input and stack, top first.
 */
public final class Configuration {

	public final State state;
	public final String remaining;
	public final List<StackSymbol> stack;

	public Configuration(State state, String remaining, List<StackSymbol> stack) {
		this.state = state;
		this.remaining = remaining;
		this.stack = List.copyOf(stack);
	}

	public String remainingText() {
		return orEpsilon(remaining);
	}

	public String stackText() {
		StringBuilder sb = new StringBuilder();
		for (StackSymbol s : stack) {
			sb.append(s.id);
		}
		return orEpsilon(sb.toString());
	}

	public List<String> toRow() {
		return List.of(state.id, remainingText(), stackText());
	}

	public String toString() {
		return "(" + state.id + ", " + remainingText() + ", " + stackText() + ")";
	}
}
