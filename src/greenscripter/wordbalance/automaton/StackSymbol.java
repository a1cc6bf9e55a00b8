package greenscripter.wordbalance.automaton;

public enum StackSymbol {

	BOTTOM("S"), VOWEL_CREDIT("V"), CONSONANT_CREDIT("C");

	public final String id;

	StackSymbol(String id) {
		this.id = id;
	}

	/**
	 * The credit that cancels this one, or null for the bottom marker.
	 */
	public StackSymbol opposite() {
		return switch (this) {
			case VOWEL_CREDIT -> CONSONANT_CREDIT;
			case CONSONANT_CREDIT -> VOWEL_CREDIT;
			case BOTTOM -> null;
		};
	}

	/**
	 * @return the constant written as {@code id}, or null if there is none
	 */
	public static StackSymbol of(String id) {
		for (StackSymbol s : values()) {
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
