package greenscripter.wordbalance.cli;

import java.util.Locale;
import java.util.regex.Pattern;

public class InputValidator {

	static final Pattern ALPHA_SPACE = Pattern.compile("^[a-z ]+$");

	public static final InputValidator MENU = new InputValidator(true, false);
	public static final InputValidator SENTENCE = new InputValidator(false, true);

	final boolean menu;
	final boolean alphaSpace;

	public InputValidator(boolean menu, boolean alphaSpace) {
		this.menu = menu;
		this.alphaSpace = alphaSpace;
	}

	/**
	 * @return null if {@code text} is valid, otherwise the message to show; empty input gives an empty message
	 */
	public String validate(String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		if (menu) {
			if (!isDigits(text)) {
				return "This input contains non-numeric characters";
			}
			String digits = text.replaceFirst("^0+(?=.)", "");
			if (digits.length() > 1 || digits.charAt(0) < '1' || digits.charAt(0) > '3') {
				return "The menu only has 1, 2, and 3 as choices";
			}
		}
		if (alphaSpace && !ALPHA_SPACE.matcher(text.toLowerCase(Locale.ROOT)).matches()) {
			return "This input contains non-alphabet/space characters";
		}
		return null;
	}

	static boolean isDigits(String text) {
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) < '0' || text.charAt(i) > '9') {
				return false;
			}
		}
		return true;
	}
}
