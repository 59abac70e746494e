package com.gridcompare;

import java.awt.Rectangle;

/**
 * Zoom, cell size and scroll offset of the grid view, plus the conversions between viewport pixels
 * and grid coordinates. Event-thread only.
 *
 * <p>Content space puts the header column at x = 0 and the header row at y = 0; data column
 * {@code c} starts at {@code filenameWidth + (c - 1) * cellSize}. Grid coordinates are fractional
 * indices: 2.5 is the middle of column 2.</p>
 */
public class ViewportController
{
	private static final int SCROLLBAR_THICKNESS = 10;
	private static final int MIN_THUMB = 10;

	private final ViewerSettings.ViewportSettings settings;
	private final int baseCellSize;

	private double zoomLevel = 1.0;
	private int cellSize;
	private double scrollX;
	private double scrollY;
	private int viewportWidth;
	private int viewportHeight;
	private int rowCount;
	private int colCount;

	public ViewportController(ViewerSettings.ViewportSettings settings, int baseCellSize)
	{
		if (baseCellSize <= 0) throw new IllegalArgumentException("baseCellSize must be positive");
		this.settings = settings;
		this.baseCellSize = baseCellSize;
		this.cellSize = baseCellSize;
	}

	public void setGridSize(int rows, int cols)
	{
		this.rowCount = rows;
		this.colCount = cols;
		clampScroll();
	}

	public double getZoomLevel()
	{
		return zoomLevel;
	}

	public int getCellSize()
	{
		return cellSize;
	}

	public int getBaseCellSize()
	{
		return baseCellSize;
	}

	public double getScrollX()
	{
		return scrollX;
	}

	public double getScrollY()
	{
		return scrollY;
	}

	public int getViewportWidth()
	{
		return viewportWidth;
	}

	public int getViewportHeight()
	{
		return viewportHeight;
	}

	// --- Layout ---

	/** Width of the filename column: cellSize within [1, max], soft minimum unless the viewport is narrow. */
	public int filenameColumnWidth()
	{
		return headerExtent(settings.filenameMaxWidth(), viewportWidth);
	}

	public int headerRowHeight()
	{
		return headerExtent(settings.headerMaxHeight(), viewportHeight);
	}

	private int headerExtent(int max, int viewportExtent)
	{
		int size = cellSize;
		int softMin = Math.min(settings.headerSoftMin(), max);
		if (viewportExtent >= 2 * softMin)
		{
			size = Math.max(size, softMin);
		}
		return Math.max(1, Math.min(max, size));
	}

	public int columnWidth(int col)
	{
		return col == 0 ? filenameColumnWidth() : cellSize;
	}

	public int rowHeight(int row)
	{
		return row == 0 ? headerRowHeight() : cellSize;
	}

	public int columnX(int col)
	{
		return col == 0 ? 0 : filenameColumnWidth() + (col - 1) * cellSize;
	}

	public int rowY(int row)
	{
		return row == 0 ? 0 : headerRowHeight() + (row - 1) * cellSize;
	}

	public long contentWidth()
	{
		if (colCount == 0) return 0;
		return filenameColumnWidth() + (long) (colCount - 1) * cellSize;
	}

	public long contentHeight()
	{
		if (rowCount == 0) return 0;
		return headerRowHeight() + (long) (rowCount - 1) * cellSize;
	}

	// --- Coordinate transform ---

	public double toGridX(double px)
	{
		return toGrid(scrollX + px, filenameColumnWidth());
	}

	public double toGridY(double py)
	{
		return toGrid(scrollY + py, headerRowHeight());
	}

	private double toGrid(double content, int headerExtent)
	{
		if (content < headerExtent) return content / headerExtent;
		return 1 + (content - headerExtent) / cellSize;
	}

	private double toContent(double grid, int headerExtent)
	{
		if (grid < 1) return grid * headerExtent;
		return headerExtent + (grid - 1) * cellSize;
	}

	public double toScreenX(double gridX)
	{
		return toContent(gridX, filenameColumnWidth()) - scrollX;
	}

	public double toScreenY(double gridY)
	{
		return toContent(gridY, headerRowHeight()) - scrollY;
	}

	// --- Queries ---

	public VisibleRange visibleRange(int width, int height)
	{
		if (rowCount == 0 || colCount == 0)
		{
			return new VisibleRange(0, -1, 0, -1, -1, -1);
		}
		int rowStart = clampIndex((int) Math.floor(toGridY(0)), rowCount);
		int colStart = clampIndex((int) Math.floor(toGridX(0)), colCount);
		int strictRowEnd = (int) Math.floor(toGridY(height));
		int strictColEnd = (int) Math.floor(toGridX(width));
		int rowEnd = clampIndex(strictRowEnd + settings.bufferRows(), rowCount);
		int colEnd = clampIndex(strictColEnd + settings.bufferCols(), colCount);
		return new VisibleRange(rowStart, rowEnd, colStart, colEnd,
				clampIndex(strictRowEnd, rowCount), clampIndex(strictColEnd, colCount));
	}

	public VisibleRange visibleRange()
	{
		return visibleRange(viewportWidth, viewportHeight);
	}

	private static int clampIndex(int index, int count)
	{
		return Math.max(0, Math.min(count - 1, index));
	}

	// --- Mutations ---

	public void resize(int width, int height)
	{
		this.viewportWidth = Math.max(0, width);
		this.viewportHeight = Math.max(0, height);
		clampScroll();
	}

	public void scroll(double dx, double dy)
	{
		scrollX += dx;
		scrollY += dy;
		clampScroll();
	}

	public void zoom(int direction)
	{
		zoom(direction, viewportWidth / 2.0, viewportHeight / 2.0);
	}

	/**
	 * Steps the zoom level and keeps the grid point under ({@code anchorX}, {@code anchorY})
	 * fixed on screen, subject to the scroll bounds.
	 */
	public void zoom(int direction, double anchorX, double anchorY)
	{
		double gridX = toGridX(anchorX);
		double gridY = toGridY(anchorY);

		setZoomLevel(zoomLevel + Integer.signum(direction) * settings.zoomStep());

		scrollX = toContent(gridX, filenameColumnWidth()) - anchorX;
		scrollY = toContent(gridY, headerRowHeight()) - anchorY;
		clampScroll();
	}

	void setZoomLevel(double zoom)
	{
		zoomLevel = Math.max(settings.minZoom(), Math.min(settings.maxZoom(), zoom));
		cellSize = Math.max(1, (int) Math.round(baseCellSize * zoomLevel));
	}

	/**
	 * Back to 100% at the origin, unless that would show fewer than 3x3 cells; then the zoom drops
	 * (not below the start floor) until three full rows and columns fit.
	 */
	public void resetViewport(int width, int height)
	{
		this.viewportWidth = Math.max(0, width);
		this.viewportHeight = Math.max(0, height);
		setZoomLevel(1.0);
		if (viewportWidth / cellSize < 3 || viewportHeight / cellSize < 3)
		{
			int target = Math.min(viewportWidth / 3, viewportHeight / 3);
			setZoomLevel(Math.max(settings.minStartZoom(), (double) target / baseCellSize));
		}
		scrollX = 0;
		scrollY = 0;
		clampScroll();
	}

	private void clampScroll()
	{
		double maxX = Math.max(0, contentWidth() - viewportWidth);
		double maxY = Math.max(0, contentHeight() - viewportHeight);
		scrollX = Math.max(0, Math.min(maxX, scrollX));
		scrollY = Math.max(0, Math.min(maxY, scrollY));
	}

	// --- Scroll indicators ---

	public Rectangle verticalThumb()
	{
		long maxScroll = contentHeight() - viewportHeight;
		if (maxScroll <= 0 || viewportHeight <= 0) return null;
		int thumb = Math.max(MIN_THUMB, viewportHeight / 10);
		double fraction = Math.max(0, Math.min(1, scrollY / maxScroll));
		int y = (int) Math.round(fraction * (viewportHeight - thumb));
		return new Rectangle(viewportWidth - SCROLLBAR_THICKNESS, y, SCROLLBAR_THICKNESS, thumb);
	}

	public Rectangle horizontalThumb()
	{
		long maxScroll = contentWidth() - viewportWidth;
		if (maxScroll <= 0 || viewportWidth <= 0) return null;
		int thumb = Math.max(MIN_THUMB, viewportWidth / 10);
		double fraction = Math.max(0, Math.min(1, scrollX / maxScroll));
		int x = (int) Math.round(fraction * (viewportWidth - thumb));
		return new Rectangle(x, viewportHeight - SCROLLBAR_THICKNESS, thumb, SCROLLBAR_THICKNESS);
	}
}
