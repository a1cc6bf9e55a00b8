package greenscripter.wordbalance.automaton;

/**
 * Accepts sentences in which as many words start with a vowel as with a
 * consonant.
 * <p>
 * {@link State#SCANNING} waits for the first letter of a word, which pushes a
 * credit of its kind or cancels a credit of the other kind. {@link State#IN_WORD}
 * skips the rest of the word. The stack therefore holds the signed difference
 * between vowel-first and consonant-first words above the bottom marker, and
 * the end marker can only pop the bottom marker when that difference is zero.
 */
public final class BalanceAutomaton implements PushdownAutomaton {

	public static final BalanceAutomaton INSTANCE = new BalanceAutomaton();

	private BalanceAutomaton() {

	}

	@Override
	public State initialState() {
		return State.SCANNING;
	}

	@Override
	public StackSymbol initialStackSymbol() {
		return StackSymbol.BOTTOM;
	}

	@Override
	public Transition transition(State state, StackSymbol top, Symbol read) {
		return switch (state) {
			case SCANNING -> switch (read.kind) {
				case SPACE -> keep(state, top, read, State.SCANNING);
				case VOWEL -> firstLetter(state, top, read, StackSymbol.VOWEL_CREDIT);
				case CONSONANT -> firstLetter(state, top, read, StackSymbol.CONSONANT_CREDIT);
				case END -> end(state, top, read);
			};
			case IN_WORD -> switch (read.kind) {
				case SPACE -> keep(state, top, read, State.SCANNING);
				case VOWEL, CONSONANT -> keep(state, top, read, State.IN_WORD);
				case END -> end(state, top, read);
			};
			case ACCEPTED -> null;
		};
	}

	@Override
	public boolean isFinal(State state) {
		return state == State.ACCEPTED;
	}

	private static Transition keep(State state, StackSymbol top, Symbol read, State target) {
		return new Transition(state, top, read, target, StackAction.KEEP, null);
	}

	private static Transition firstLetter(State state, StackSymbol top, Symbol read, StackSymbol credit) {
		if (top == credit.opposite()) {
			return new Transition(state, top, read, State.IN_WORD, StackAction.CANCEL, null);
		}
		return new Transition(state, top, read, State.IN_WORD, StackAction.PUSH, credit);
	}

	// Unbalanced input stays where it is; running out of input then rejects it.
	private static Transition end(State state, StackSymbol top, Symbol read) {
		if (top == StackSymbol.BOTTOM) {
			return new Transition(state, top, read, State.ACCEPTED, StackAction.POP, null);
		}
		return keep(state, top, read, state);
	}
}
