package greenscripter.wordbalance.automaton;

public enum State {

	SCANNING("q0"), IN_WORD("q1"), ACCEPTED("q2");

	public final String id;

	State(String id) {
		this.id = id;
	}

	/**
	 * @return the constant written as {@code id}, or null if there is none
	 */
	public static State of(String id) {
		for (State s : values()) {
			if (s.id.equals(id)) {
				return s;
			}
		}
		return null;
	}

	public String toString() {
		return id;
	}
}
