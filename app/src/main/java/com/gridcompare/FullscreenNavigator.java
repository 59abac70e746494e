package com.gridcompare;

/**
 * Focus state of the single-image view. While focused the cell is always a data cell inside the
 * grid: never row 0, never column 0.
 */
public class FullscreenNavigator
{
	public enum Direction
	{
		LEFT,
		RIGHT,
		UP,
		DOWN
	}

	public record Focus(int row, int col) {}

	private Grid grid;
	private Focus focus;

	public FullscreenNavigator(Grid grid)
	{
		this.grid = grid;
	}

	public boolean isFocused()
	{
		return focus != null;
	}

	public Focus getFocus()
	{
		return focus;
	}

	/**
	 * Focuses a data cell, or returns to browsing when the cell is already focused. Header cells and
	 * out-of-range positions leave the state unchanged.
	 *
	 * @return true if the state changed
	 */
	public boolean select(int row, int col)
	{
		if (focus != null && focus.row() == row && focus.col() == col)
		{
			focus = null;
			return true;
		}
		if (!isDataCell(row, col)) return false;
		focus = new Focus(row, col);
		return true;
	}

	public boolean navigate(Direction direction)
	{
		if (focus == null) return false;
		int row = focus.row();
		int col = focus.col();
		switch (direction)
		{
			case LEFT -> col = Math.max(1, col - 1);
			case RIGHT -> col = col + 1;
			case UP -> row = Math.max(1, row - 1);
			case DOWN -> row = row + 1;
		}
		if (row == focus.row() && col == focus.col()) return false;
		if (!isDataCell(row, col)) return false;
		focus = new Focus(row, col);
		return true;
	}

	public void escape()
	{
		focus = null;
	}

	public void reset(Grid newGrid)
	{
		this.grid = newGrid;
		this.focus = null;
	}

	private boolean isDataCell(int row, int col)
	{
		return row >= 1 && col >= 1 && row < grid.rowCount() && col < grid.rowLength(row);
	}
}
