package greenscripter.wordbalance.simulator;

public class StackUnderflowException extends RuntimeException {

	public StackUnderflowException(String message) {
		super(message);
	}
}
