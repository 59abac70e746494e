package com.gridcompare;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.gridcompare.FullscreenNavigator.Direction.*;
import static org.junit.jupiter.api.Assertions.*;

class FullscreenNavigatorTest
{
	private static Grid grid(int folders, int variants)
	{
		return ImageFixtures.syntheticGrid(folders, variants);
	}

	@Test
	void startsBrowsing()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(3, 2));
		assertFalse(navigator.isFocused());
		assertNull(navigator.getFocus());
		assertFalse(navigator.navigate(RIGHT));
	}

	@Test
	void selectingDataCellFocusesIt()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(3, 2));

		assertTrue(navigator.select(2, 3));

		assertEquals(new FullscreenNavigator.Focus(2, 3), navigator.getFocus());
	}

	@Test
	void selectingFocusedCellAgainReturnsToBrowsing()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(3, 2));
		navigator.select(1, 1);

		assertTrue(navigator.select(1, 1));

		assertFalse(navigator.isFocused());
	}

	@Test
	void headersAndOutOfRangeCellsCannotBeSelected()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(3, 2));

		assertFalse(navigator.select(0, 1));
		assertFalse(navigator.select(1, 0));
		assertFalse(navigator.select(0, 0));
		assertFalse(navigator.select(4, 1));
		assertFalse(navigator.select(1, 4));
		assertFalse(navigator.select(-1, 2));
		assertFalse(navigator.isFocused());
	}

	@Test
	void selectingAnotherCellMovesFocus()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(3, 2));
		navigator.select(1, 1);

		assertTrue(navigator.select(2, 2));

		assertEquals(new FullscreenNavigator.Focus(2, 2), navigator.getFocus());
	}

	@Test
	void navigatesInAllDirections()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(3, 3));
		navigator.select(2, 2);

		assertTrue(navigator.navigate(RIGHT));
		assertEquals(new FullscreenNavigator.Focus(2, 3), navigator.getFocus());
		assertTrue(navigator.navigate(DOWN));
		assertEquals(new FullscreenNavigator.Focus(3, 3), navigator.getFocus());
		assertTrue(navigator.navigate(LEFT));
		assertEquals(new FullscreenNavigator.Focus(3, 2), navigator.getFocus());
		assertTrue(navigator.navigate(UP));
		assertEquals(new FullscreenNavigator.Focus(2, 2), navigator.getFocus());
	}

	@Test
	void stopsAtDataEdges()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(2, 1));
		navigator.select(1, 1);

		assertFalse(navigator.navigate(LEFT));
		assertFalse(navigator.navigate(UP));
		assertEquals(new FullscreenNavigator.Focus(1, 1), navigator.getFocus());

		navigator.select(2, 2);
		assertFalse(navigator.navigate(RIGHT));
		assertFalse(navigator.navigate(DOWN));
		assertEquals(new FullscreenNavigator.Focus(2, 2), navigator.getFocus());
	}

	@Test
	void focusNeverLeavesDataCells()
	{
		Grid grid = grid(4, 3);
		FullscreenNavigator navigator = new FullscreenNavigator(grid);
		navigator.select(1, 1);
		FullscreenNavigator.Direction[] moves = FullscreenNavigator.Direction.values();
		Random random = new Random(7);

		for (int i = 0; i < 1000; i++)
		{
			navigator.navigate(moves[random.nextInt(moves.length)]);
			FullscreenNavigator.Focus focus = navigator.getFocus();
			assertTrue(focus.row() >= 1 && focus.row() < grid.rowCount());
			assertTrue(focus.col() >= 1 && focus.col() < grid.rowLength(focus.row()));
		}
	}

	@Test
	void escapeAlwaysReturnsToBrowsing()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(3, 2));
		navigator.escape();
		assertFalse(navigator.isFocused());

		navigator.select(2, 1);
		navigator.escape();
		assertFalse(navigator.isFocused());
	}

	@Test
	void resetDropsFocusAndUsesNewGrid()
	{
		FullscreenNavigator navigator = new FullscreenNavigator(grid(3, 3));
		navigator.select(3, 3);

		navigator.reset(grid(1, 0));

		assertFalse(navigator.isFocused());
		assertFalse(navigator.select(2, 1));
		assertTrue(navigator.select(1, 1));
	}
}
