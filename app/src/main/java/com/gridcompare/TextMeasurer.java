package com.gridcompare;

import java.awt.FontMetrics;

public interface TextMeasurer
{
	int stringWidth(String text);

	int lineHeight();

	static TextMeasurer of(FontMetrics metrics)
	{
		return new TextMeasurer()
		{
			@Override
			public int stringWidth(String text)
			{
				return metrics.stringWidth(text);
			}

			@Override
			public int lineHeight()
			{
				return metrics.getHeight();
			}
		};
	}
}
