package greenscripter.wordbalance.simulator;

public enum Verdict {

	ACCEPTED, REJECTED;

	public static Verdict of(boolean accepted) {
		return accepted ? ACCEPTED : REJECTED;
	}

	public boolean isAccepted() {
		return this == ACCEPTED;
	}
}
