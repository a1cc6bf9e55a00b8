package greenscripter.wordbalance.simulator;

import java.util.List;

/**
 * Renders traces as pipe tables with one left aligned row per configuration.
 * Cell contents are written as they are, spaces included.
 */
public class StepsTable {

	public static final List<String> HEADERS = List.of("State", "Remaining Input", "Stack");

	public static String render(TraceResult trace) {
		StringBuilder sb = new StringBuilder(render(trace.rows()));
		if (!trace.isComplete()) {
			sb.append("\n\n");
			sb.append(trace.message);
		}
		return sb.toString();
	}

	public static String render(List<List<String>> rows) {
		int[] widths = new int[HEADERS.size()];
		for (int i = 0; i < widths.length; i++) {
			widths[i] = HEADERS.get(i).length();
		}
		for (List<String> row : rows) {
			for (int i = 0; i < widths.length; i++) {
				widths[i] = Math.max(widths[i], row.get(i).length());
			}
		}

		StringBuilder sb = new StringBuilder();
		appendRow(sb, HEADERS, widths);
		sb.append("\n|");
		for (int width : widths) {
			sb.append(':').append("-".repeat(width + 1)).append('|');
		}
		for (List<String> row : rows) {
			sb.append("\n");
			appendRow(sb, row, widths);
		}
		return sb.toString();
	}

	private static void appendRow(StringBuilder sb, List<String> cells, int[] widths) {
		sb.append('|');
		for (int i = 0; i < widths.length; i++) {
			sb.append(' ').append(cells.get(i)).append(" ".repeat(widths[i] - cells.get(i).length())).append(" |");
		}
	}
}
