package greenscripter.wordbalance.automaton;

import java.util.List;

/**
 * A deterministic pushdown automaton over {@link Symbol}s that accepts by
 * reaching a final state with an empty stack.
 */
public interface PushdownAutomaton {

	State initialState();

	StackSymbol initialStackSymbol();

	/**
	 * @return the unique move for this combination, or null if the automaton halts
	 */
	Transition transition(State state, StackSymbol top, Symbol read);

	boolean isFinal(State state);

	/**
	 * Every defined move, grouped by source state in declaration order.
	 */
	default List<Transition> transitions() {
		return TransitionTable.enumerate(this);
	}
}
