package greenscripter.wordbalance.simulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import greenscripter.wordbalance.automaton.StackSymbol;

public class Stack {

	// bottom first
	List<StackSymbol> symbols = new ArrayList<>();

	public Stack(StackSymbol initial) {
		symbols.add(initial);
	}

	public StackSymbol top() {
		if (symbols.isEmpty()) {
			throw new StackUnderflowException("Stack exhausted unexpectedly.");
		}
		return symbols.get(symbols.size() - 1);
	}

	public StackSymbol pop() {
		if (symbols.isEmpty()) {
			throw new StackUnderflowException("Stack exhausted unexpectedly.");
		}
		return symbols.remove(symbols.size() - 1);
	}

	public void push(StackSymbol s) {
		symbols.add(s);
	}

	public boolean isEmpty() {
		return symbols.isEmpty();
	}

	public int size() {
		return symbols.size();
	}

	public List<StackSymbol> topToBottom() {
		List<StackSymbol> result = new ArrayList<>(symbols);
		Collections.reverse(result);
		return Collections.unmodifiableList(result);
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (int i = symbols.size() - 1; i >= 0; i--) {
			sb.append(symbols.get(i).id);
		}
		return sb.toString();
	}
}
