package greenscripter.wordbalance.automaton;

import static greenscripter.wordbalance.utils.Utils.*;

import java.util.List;

/**
 * One move of a pushdown automaton: in {@code source} with {@code top} on the
 * stack, reading {@code read}, go to {@code target} and apply {@code action}.
 */
public final class Transition {

	public final State source;
	public final StackSymbol top;
	public final Symbol read;
	public final State target;
	public final StackAction action;
	public final StackSymbol pushed;

	public Transition(State source, StackSymbol top, Symbol read, State target, StackAction action, StackSymbol pushed) {
		if ((action == StackAction.PUSH) != (pushed != null)) {
			throw new IllegalArgumentException("A pushed symbol is required exactly for PUSH, got " + action + " with " + pushed);
		}
		this.source = source;
		this.top = top;
		this.read = read;
		this.target = target;
		this.action = action;
		this.pushed = pushed;
	}

	/**
	 * The symbols that replace the popped top, written top first. Empty for a pop.
	 */
	public String replacement() {
		return switch (action) {
			case POP, CANCEL -> "";
			case KEEP -> top.id;
			case PUSH -> pushed.id + top.id;
		};
	}

	public String toString() {
		return mergeCommas(List.of(source.id, read.toString(), top.id, replacement(), target.id));
	}
}
