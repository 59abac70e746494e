package com.gridcompare;

import java.awt.Rectangle;

public record HitRegion(int row, int col, Rectangle bounds)
{
	public boolean contains(int x, int y)
	{
		return bounds.contains(x, y);
	}
}
