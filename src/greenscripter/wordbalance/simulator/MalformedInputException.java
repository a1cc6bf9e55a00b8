package greenscripter.wordbalance.simulator;

/**
 * The input handed to the simulator is not a sentence of {@code [a-z ]}
 * terminated by exactly one end marker.
 */
public class MalformedInputException extends RuntimeException {

	public final int position;

	public MalformedInputException(String message, int position) {
		super(message + " (position " + position + ")");
		this.position = position;
	}
}
