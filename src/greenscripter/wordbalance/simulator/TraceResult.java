package greenscripter.wordbalance.simulator;

import java.util.ArrayList;
import java.util.List;

/**
 * The configurations of one traced run and how the run ended. A run that
 * failed keeps the configurations produced up to the failure.
 */
public final class TraceResult {

	public enum Status {
		COMPLETE, MALFORMED, STACK_EXHAUSTED
	}

	public final Status status;
	public final List<Configuration> configurations;
	/** Null unless the trace is complete. */
	public final Verdict verdict;
	/** Null for a complete trace. */
	public final String message;

	private TraceResult(Status status, List<Configuration> configurations, Verdict verdict, String message) {
		this.status = status;
		this.configurations = List.copyOf(configurations);
		this.verdict = verdict;
		this.message = message;
	}

	public static TraceResult complete(List<Configuration> configurations, Verdict verdict) {
		return new TraceResult(Status.COMPLETE, configurations, verdict, null);
	}

	public static TraceResult malformed(List<Configuration> configurations, String message) {
		return new TraceResult(Status.MALFORMED, configurations, null, message);
	}

	public static TraceResult stackExhausted(List<Configuration> configurations, String message) {
		return new TraceResult(Status.STACK_EXHAUSTED, configurations, null, message);
	}

	public boolean isComplete() {
		return status == Status.COMPLETE;
	}

	public Configuration last() {
		return configurations.isEmpty() ? null : configurations.get(configurations.size() - 1);
	}

	public List<List<String>> rows() {
		List<List<String>> rows = new ArrayList<>();
		for (Configuration c : configurations) {
			rows.add(c.toRow());
		}
		return rows;
	}
}
