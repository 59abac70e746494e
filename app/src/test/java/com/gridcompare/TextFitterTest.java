package com.gridcompare;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TextFitterTest
{
	// Every character is 10px wide, lines are 10px tall
	private static final TextMeasurer MONO = new TextMeasurer()
	{
		@Override
		public int stringWidth(String text)
		{
			return text.length() * 10;
		}

		@Override
		public int lineHeight()
		{
			return 10;
		}
	};

	@Test
	void shortTextIsOneLine()
	{
		assertEquals(List.of("short"), TextFitter.fit("short", MONO, 100, 10));
	}

	@Test
	void wrapsAtWordBoundary()
	{
		assertEquals(List.of("hello", "world"), TextFitter.fit("hello world", MONO, 60, 20));
	}

	@Test
	void prefixEndingOnSpaceIsKeptWhole()
	{
		assertEquals(List.of("hello", "world"), TextFitter.fit("hello world", MONO, 50, 20));
	}

	@Test
	void overflowEndsWithEllipsis()
	{
		assertEquals(List.of("hello…"), TextFitter.fit("hello world", MONO, 60, 10));
	}

	@Test
	void longTokenIsHardBroken()
	{
		List<String> lines = TextFitter.fit("abcdefghijklmnop", MONO, 50, 30);
		assertEquals(List.of("abcde", "fghij", "klmn…"), lines);
	}

	@Test
	void emojiAreNeverSplitAcrossLines()
	{
		// Each emoji is two chars, so 20px under MONO
		List<String> lines = TextFitter.fit("😀😀😀", MONO, 30, 100);
		assertEquals(List.of("😀", "😀", "😀"), lines);
		for (String line : lines)
		{
			assertFalse(Character.isHighSurrogate(line.charAt(line.length() - 1)), line);
			assertFalse(Character.isLowSurrogate(line.charAt(0)), line);
		}
	}

	@Test
	void emojiOverflowKeepsWholeCodePointBeforeEllipsis()
	{
		assertEquals(List.of("😀…"), TextFitter.fit("😀😀😀", MONO, 30, 10));
		assertEquals("a…", TextFitter.withEllipsis("a😀", MONO, 25));
	}

	@Test
	void whitespaceIsCollapsed()
	{
		assertEquals(List.of("a b"), TextFitter.fit("  a \n\t b  ", MONO, 100, 10));
	}

	@Test
	void boxShorterThanOneLineGivesNothing()
	{
		assertTrue(TextFitter.fit("text", MONO, 100, 9).isEmpty());
	}

	@Test
	void boxNarrowerThanOneCharacterGivesNothing()
	{
		assertTrue(TextFitter.fit("text", MONO, 5, 100).isEmpty());
	}

	@Test
	void emptyAndNullTextGiveNothing()
	{
		assertTrue(TextFitter.fit("", MONO, 100, 100).isEmpty());
		assertTrue(TextFitter.fit("   ", MONO, 100, 100).isEmpty());
		assertTrue(TextFitter.fit(null, MONO, 100, 100).isEmpty());
	}

	@Test
	void longestFittingPrefixUsesFullWidth()
	{
		assertEquals(3, TextFitter.longestFittingPrefix("abcdef", MONO, 35));
		assertEquals(6, TextFitter.longestFittingPrefix("abcdef", MONO, 1000));
		assertEquals(0, TextFitter.longestFittingPrefix("abcdef", MONO, 9));
	}

	@Test
	void ellipsisShortensLineUntilItFits()
	{
		assertEquals("abc…", TextFitter.withEllipsis("abcde", MONO, 40));
		assertEquals("ab…", TextFitter.withEllipsis("ab  cd", MONO, 30));
	}

	@Test
	void neverExceedsBoxForArbitraryInput()
	{
		Random random = new Random(42);
		String alphabet = "abcdefghij       _-.";
		for (int run = 0; run < 500; run++)
		{
			StringBuilder sb = new StringBuilder();
			int length = random.nextInt(80);
			for (int i = 0; i < length; i++)
			{
				sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
			}
			int width = 1 + random.nextInt(120);
			int height = 1 + random.nextInt(60);

			List<String> lines = TextFitter.fit(sb.toString(), MONO, width, height);

			assertTrue(lines.size() <= height / 10, () -> "too many lines for " + sb);
			for (String line : lines)
			{
				assertTrue(MONO.stringWidth(line) <= width, () -> "line too wide: '" + line + "' in " + width);
			}
		}
	}
}
