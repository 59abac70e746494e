package com.gridcompare;

import java.awt.image.BufferedImage;

/**
 * A bitmap ready to draw, tagged with where it came from. Placeholder and decode-error entries are
 * synthesized boxes; {@code label} carries the text shown on them.
 */
public record CachedImage(BufferedImage image, Kind kind, String label)
{
	public enum Kind
	{
		IMAGE,
		PLACEHOLDER,
		DECODE_ERROR
	}

	public boolean isSynthetic()
	{
		return kind != Kind.IMAGE;
	}
}
