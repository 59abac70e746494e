package com.gridcompare;

import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;

/**
 * Everything a draw call needs: the target surface and the fonts it measures with. Created for each
 * paint (or each export canvas) and passed down explicitly.
 */
public record RenderContext(Graphics2D graphics, Font labelFont, Font smallFont)
{
	public static RenderContext create(Graphics2D graphics, ViewerSettings settings)
	{
		graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
		graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
		return new RenderContext(graphics,
				new Font(Font.SANS_SERIF, Font.PLAIN, settings.fontSize()),
				new Font(Font.SANS_SERIF, Font.PLAIN, settings.smallFontSize()));
	}

	public TextMeasurer labelMeasurer()
	{
		return TextMeasurer.of(graphics.getFontMetrics(labelFont));
	}

	public TextMeasurer smallMeasurer()
	{
		return TextMeasurer.of(graphics.getFontMetrics(smallFont));
	}
}
