package com.gridcompare;

/**
 * Inclusive index window of the grid that should be materialized this frame. The strict ends mark
 * the last row/column actually touched by the viewport; {@code rowEnd}/{@code colEnd} add the
 * trailing buffer.
 */
public record VisibleRange(int rowStart, int rowEnd, int colStart, int colEnd,
						   int strictRowEnd, int strictColEnd)
{
	public boolean containsRow(int row)
	{
		return row >= rowStart && row <= rowEnd;
	}

	public boolean containsColumn(int col)
	{
		return col >= colStart && col <= colEnd;
	}
}
