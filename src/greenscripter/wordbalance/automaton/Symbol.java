package greenscripter.wordbalance.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One input symbol: a space, a lowercase letter or the end marker. Instances
 * are shared, so symbols can be compared with {@code ==}.
 */
public final class Symbol {

	public static final char END_MARKER = '!';
	public static final String VOWELS = "aeiou";

	public static final Symbol SPACE = new Symbol(' ', Kind.SPACE);
	public static final Symbol END = new Symbol(END_MARKER, Kind.END);

	private static final Symbol[] LETTERS = new Symbol['z' - 'a' + 1];
	private static final List<Symbol> ALPHABET;

	static {
		List<Symbol> alphabet = new ArrayList<>();
		for (char c = 'a'; c <= 'z'; c++) {
			LETTERS[c - 'a'] = new Symbol(c, isVowel(c) ? Kind.VOWEL : Kind.CONSONANT);
			alphabet.add(LETTERS[c - 'a']);
		}
		alphabet.add(SPACE);
		alphabet.add(END);
		ALPHABET = Collections.unmodifiableList(alphabet);
	}

	public enum Kind {
		SPACE, VOWEL, CONSONANT, END
	}

	public final char character;
	public final Kind kind;

	private Symbol(char character, Kind kind) {
		this.character = character;
		this.kind = kind;
	}

	/**
	 * @return the symbol for {@code c}, or null if {@code c} is outside the input alphabet
	 */
	public static Symbol of(char c) {
		if (c >= 'a' && c <= 'z') {
			return LETTERS[c - 'a'];
		}
		if (c == ' ') {
			return SPACE;
		}
		if (c == END_MARKER) {
			return END;
		}
		return null;
	}

	public static boolean isVowel(char c) {
		return VOWELS.indexOf(c) >= 0;
	}

	/**
	 * Letters a to z, then space, then the end marker.
	 */
	public static List<Symbol> alphabet() {
		return ALPHABET;
	}

	public boolean isLetter() {
		return kind == Kind.VOWEL || kind == Kind.CONSONANT;
	}

	public String toString() {
		return String.valueOf(character);
	}
}
