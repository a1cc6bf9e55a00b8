package greenscripter.wordbalance.automaton;

public enum StackAction {

	/** Pop the top symbol and push nothing. */
	POP,
	/** Re-push the top symbol, leaving the stack as it was. */
	KEEP,
	/** Push a new symbol on top of the current one. */
	PUSH,
	/** Pop one credit because the symbol read cancels it. */
	CANCEL
}
