package com.gridcompare;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a label into a fixed pixel box: greedy lines, each the longest prefix that fits (binary
 * search on character count), pulled back to a word boundary when one is available. Leftover text
 * ends the last line with an ellipsis.
 *
 * <p>The result never has more than {@code boxHeight / lineHeight} lines and no line measures wider
 * than {@code boxWidth}.</p>
 */
public final class TextFitter
{
	public static final String ELLIPSIS = "…";

	private TextFitter() {}

	public static List<String> fit(String text, TextMeasurer measurer, int boxWidth, int boxHeight)
	{
		List<String> lines = new ArrayList<>();
		if (text == null || boxWidth <= 0 || boxHeight <= 0) return lines;

		String remaining = text.replaceAll("\\s+", " ").strip();
		if (remaining.isEmpty()) return lines;

		int lineHeight = Math.max(1, measurer.lineHeight());
		int maxLines = boxHeight / lineHeight;
		if (maxLines == 0) return lines;

		while (!remaining.isEmpty() && lines.size() < maxLines)
		{
			int fits = longestFittingPrefix(remaining, measurer, boxWidth);
			if (fits == 0)
			{
				// Not even one character fits; nothing after this can make progress
				if (measurer.stringWidth(ELLIPSIS) <= boxWidth) lines.add(ELLIPSIS);
				return lines;
			}

			String line = remaining.substring(0, fits);
			if (fits < remaining.length() && remaining.charAt(fits) != ' ')
			{
				int lastSpace = line.lastIndexOf(' ');
				if (lastSpace > 0)
				{
					line = line.substring(0, lastSpace);
				}
			}
			line = line.stripTrailing();
			lines.add(line);
			remaining = remaining.substring(line.length()).stripLeading();
		}

		if (!remaining.isEmpty())
		{
			int last = lines.size() - 1;
			lines.set(last, withEllipsis(lines.get(last), measurer, boxWidth));
		}
		return lines;
	}

	/** Largest n such that the first n chars of {@code text} fit {@code width}, never splitting a surrogate pair. */
	static int longestFittingPrefix(String text, TextMeasurer measurer, int width)
	{
		int low = 0;
		int high = text.length();
		while (low < high)
		{
			int mid = (low + high + 1) >>> 1;
			if (measurer.stringWidth(text.substring(0, mid)) <= width)
			{
				low = mid;
			}
			else
			{
				high = mid - 1;
			}
		}
		if (low > 0 && low < text.length() && Character.isHighSurrogate(text.charAt(low - 1)))
		{
			low--;
		}
		return low;
	}

	static String withEllipsis(String line, TextMeasurer measurer, int width)
	{
		String candidate = line.stripTrailing();
		while (!candidate.isEmpty() && measurer.stringWidth(candidate + ELLIPSIS) > width)
		{
			candidate = candidate.substring(0, candidate.offsetByCodePoints(candidate.length(), -1)).stripTrailing();
		}
		if (measurer.stringWidth(candidate + ELLIPSIS) <= width)
		{
			return candidate + ELLIPSIS;
		}
		return candidate;
	}
}
