package greenscripter.wordbalance.simulator;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import greenscripter.wordbalance.automaton.Symbol;

public class SimulatorTest {

	private final Simulator simulator = new Simulator();

	@Test
	public void testTwoConsonantWordsAreRejected() {
		assertEquals(Verdict.REJECTED, simulator.run("cat dog!"));
	}

	@Test
	public void testTwoVowelWordsAreRejected() {
		assertEquals(Verdict.REJECTED, simulator.run("apple egg!"));
	}

	@Test
	public void testOneOfEachIsAccepted() {
		assertEquals(Verdict.ACCEPTED, simulator.run("cat apple!"));
		assertEquals(Verdict.ACCEPTED, simulator.run("apple cat!"));
	}

	@Test
	public void testBannerExampleIsAccepted() {
		assertEquals(Verdict.ACCEPTED, simulator.run("captivating melodies echo across the ocean enchanting all who listen!"));
	}

	@Test
	public void testSpacesOnlyIsAccepted() {
		assertEquals(Verdict.ACCEPTED, simulator.run("     !"));
		assertEquals(Verdict.ACCEPTED, simulator.run(" !"));
	}

	@Test
	public void testRepeatedSpacesDoNotCount() {
		assertEquals(Verdict.ACCEPTED, simulator.run("  cat    apple  !"));
		assertEquals(Verdict.REJECTED, simulator.run("  cat    apple  dog !"));
	}

	@Test
	public void testOnlyFirstLettersCount() {
		// every other letter is a vowel, the first letters are all consonants
		assertEquals(Verdict.REJECTED, simulator.run("banana tomato!"));
		assertEquals(Verdict.ACCEPTED, simulator.run("banana orange!"));
		assertEquals(Verdict.ACCEPTED, simulator.run("aaaaaaaaab bbbbbbbbba!"));
	}

	@Test
	public void testVerdictMatchesCountsForGeneratedSentences() {
		String[] vowelWords = { "apple", "egg", "ink", "owl", "up" };
		String[] consonantWords = { "cat", "dog", "yak", "zebra", "rhythm" };
		for (int vowels = 0; vowels < 5; vowels++) {
			for (int consonants = 0; consonants < 5; consonants++) {
				StringBuilder sb = new StringBuilder();
				int v = 0;
				int c = 0;
				// interleave unevenly so cancellation happens in both directions
				while (v < vowels || c < consonants) {
					if (c < consonants && (c <= v || v == vowels)) {
						sb.append(consonantWords[c++]).append(' ');
					} else {
						sb.append(vowelWords[v++]).append(' ');
					}
				}
				Verdict expected = Verdict.of(vowels == consonants);
				String input = Simulator.terminate(sb.toString().trim());
				assertEquals(input, expected, simulator.run(input));
			}
		}
	}

	@Test
	public void testRunIsRepeatable() {
		String input = "zebra umbrella yak!";
		Verdict first = simulator.run(input);
		assertEquals(first, simulator.run(input));
		assertEquals(Verdict.REJECTED, first);
		assertEquals(Verdict.ACCEPTED, simulator.run("cat apple!"));
		assertEquals(Verdict.ACCEPTED, simulator.run("cat apple!"));
	}

	@Test
	public void testRunOnSymbols() {
		List<Symbol> symbols = Simulator.parse("ink dog!");
		assertEquals(8, symbols.size());
		assertSame(Symbol.END, symbols.get(7));
		assertEquals(Verdict.ACCEPTED, simulator.run(symbols));
	}

	@Test
	public void testTerminateAppendsEndMarker() {
		assertEquals("cat apple!", Simulator.terminate("cat apple"));
	}

	@Test
	public void testEmptyInputIsMalformed() {
		try {
			simulator.run("");
			fail();
		} catch (MalformedInputException e) {
			assertEquals(0, e.position);
		}
	}

	@Test
	public void testMissingEndMarkerIsMalformed() {
		try {
			simulator.run("cat apple");
			fail();
		} catch (MalformedInputException e) {
			assertEquals(9, e.position);
		}
	}

	@Test
	public void testEarlyEndMarkerIsMalformed() {
		try {
			simulator.run("cat! apple!");
			fail();
		} catch (MalformedInputException e) {
			assertEquals(3, e.position);
		}
	}

	@Test
	public void testCharactersOutsideAlphabetAreMalformed() {
		for (String input : new String[] { "Cat apple!", "cat, apple!", "cat\tapple!", "caté!", "123!" }) {
			try {
				simulator.run(input);
				fail(input);
			} catch (MalformedInputException e) {
				assertTrue(e.getMessage(), e.getMessage().contains("outside the input alphabet"));
			}
		}
	}
}
