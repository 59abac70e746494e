package com.gridcompare;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Composite;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lays out one frame of the grid view. Only the visible range (plus buffer) is resolved through the
 * cache; the header row and filename column are drawn last so they stay pinned while scrolling.
 */
public class GridRenderer
{
	static final Color BACKGROUND_COLOR = new Color(30, 30, 30);
	static final Color GRID_COLOR = new Color(60, 60, 60);
	static final Color HEADER_COLOR = new Color(50, 50, 70);
	static final Color TEXT_COLOR = new Color(220, 220, 220);
	static final Color SUBTLE_TEXT_COLOR = new Color(180, 180, 180);
	static final Color BORDER_COLOR = new Color(100, 100, 100);
	static final Color PLACEHOLDER_COLOR = new Color(80, 40, 40);
	static final Color ERROR_COLOR = new Color(120, 40, 40);
	private static final Color FULLSCREEN_BG = new Color(0, 0, 0, 200);
	private static final Color INFO_BOX_BG = new Color(0, 0, 0, 100);
	private static final Color SCROLL_TRACK = new Color(100, 100, 100);
	private static final Color SCROLL_THUMB = new Color(200, 200, 200);

	static final int FULLSCREEN_BOX_WIDTH = 800;
	static final int FULLSCREEN_BOX_HEIGHT = 600;
	private static final int FULLSCREEN_BOX_FONT_SIZE = 36;
	static final String FULLSCREEN_HELP = "Click to exit fullscreen | Arrows: Navigate | ESC: Exit";

	public record RenderedFrame(List<HitRegion> hitRegions, Set<String> visibleKeys)
	{
		public HitRegion hitAt(int x, int y)
		{
			for (HitRegion region : hitRegions)
			{
				if (region.contains(x, y)) return region;
			}
			return null;
		}
	}

	private final int padding;

	public GridRenderer(ViewerSettings settings)
	{
		this.padding = settings.cellPadding();
	}

	public RenderedFrame draw(RenderContext ctx, Grid grid, ViewportController viewport, ImageCache cache)
	{
		Graphics2D g = ctx.graphics();
		int width = viewport.getViewportWidth();
		int height = viewport.getViewportHeight();
		int scrollX = (int) Math.round(viewport.getScrollX());
		int scrollY = (int) Math.round(viewport.getScrollY());
		int headerW = viewport.filenameColumnWidth();
		int headerH = viewport.headerRowHeight();
		int cellSize = viewport.getCellSize();

		g.setColor(BACKGROUND_COLOR);
		g.fillRect(0, 0, width, height);

		VisibleRange range = viewport.visibleRange(width, height);
		List<HitRegion> hits = new ArrayList<>();
		Set<String> visibleKeys = new HashSet<>();
		Rectangle dataArea = new Rectangle(headerW, headerH, Math.max(0, width - headerW), Math.max(0, height - headerH));

		// Data cells
		for (int row = Math.max(1, range.rowStart()); row <= range.rowEnd(); row++)
		{
			int rowEnd = Math.min(range.colEnd(), grid.rowLength(row) - 1);
			for (int col = Math.max(1, range.colStart()); col <= rowEnd; col++)
			{
				Cell cell = grid.cell(row, col);
				visibleKeys.add(ImageCache.keyOf(cell));
				CachedImage image = cache.get(cell);

				Rectangle bounds = new Rectangle(
						viewport.columnX(col) - scrollX, viewport.rowY(row) - scrollY, cellSize, cellSize);
				if (!bounds.intersects(dataArea)) continue;

				drawDataCell(g, bounds, image);
				Rectangle clickable = bounds.intersection(dataArea);
				if (!clickable.isEmpty()) hits.add(new HitRegion(row, col, clickable));
			}
		}

		// Header row, pinned to the top
		TextMeasurer label = ctx.labelMeasurer();
		g.setFont(ctx.labelFont());
		for (int col = Math.max(1, range.colStart()); col <= range.colEnd(); col++)
		{
			Rectangle bounds = new Rectangle(viewport.columnX(col) - scrollX, 0, cellSize, headerH);
			if (bounds.x + bounds.width < headerW || bounds.x > width) continue;
			drawLabelCell(g, label, bounds, grid.columnLabel(col));
		}

		// Filename column, pinned to the left
		for (int row = Math.max(1, range.rowStart()); row <= range.rowEnd(); row++)
		{
			Rectangle bounds = new Rectangle(0, viewport.rowY(row) - scrollY, headerW, cellSize);
			if (bounds.y + bounds.height < headerH || bounds.y > height) continue;
			drawLabelCell(g, label, bounds, grid.rowLabel(row));
		}

		drawCorner(ctx, new Rectangle(0, 0, headerW, headerH), grid.baseResolution(), cellSize);
		drawScrollIndicators(g, viewport);

		return new RenderedFrame(List.copyOf(hits), visibleKeys);
	}

	private void drawDataCell(Graphics2D g, Rectangle bounds, CachedImage image)
	{
		g.setColor(switch (image.kind())
		{
			case IMAGE -> GRID_COLOR;
			case PLACEHOLDER -> PLACEHOLDER_COLOR;
			case DECODE_ERROR -> ERROR_COLOR;
		});
		g.fillRect(bounds.x, bounds.y, bounds.width, bounds.height);

		Rectangle inner = inset(bounds, padding);
		if (!inner.isEmpty())
		{
			Rectangle target = image.isSynthetic()
					? inner
					: fitInside(image.image().getWidth(), image.image().getHeight(), inner);
			g.drawImage(image.image(), target.x, target.y, target.width, target.height, null);
		}

		g.setColor(BORDER_COLOR);
		g.drawRect(bounds.x, bounds.y, bounds.width - 1, bounds.height - 1);
	}

	private void drawLabelCell(Graphics2D g, TextMeasurer measurer, Rectangle bounds, String text)
	{
		g.setColor(HEADER_COLOR);
		g.fillRect(bounds.x, bounds.y, bounds.width, bounds.height);
		g.setColor(BORDER_COLOR);
		g.drawRect(bounds.x, bounds.y, bounds.width - 1, bounds.height - 1);

		Rectangle box = inset(bounds, padding);
		List<String> lines = TextFitter.fit(text, measurer, box.width, box.height);
		g.setColor(TEXT_COLOR);
		drawLines(g, lines, box.x, box.y);
	}

	private void drawCorner(RenderContext ctx, Rectangle bounds, String resolution, int cellSize)
	{
		Graphics2D g = ctx.graphics();
		g.setColor(BACKGROUND_COLOR);
		g.fillRect(bounds.x, bounds.y, bounds.width, bounds.height);
		g.setColor(BORDER_COLOR);
		g.drawRect(bounds.x, bounds.y, bounds.width - 1, bounds.height - 1);
		g.setColor(SUBTLE_TEXT_COLOR);
		drawCenteredPair(g, ctx.smallFont(), bounds, resolution, cellSize + "px");
	}

	static void drawCenteredPair(Graphics2D g, Font font, Rectangle bounds, String first, String second)
	{
		g.setFont(font);
		FontMetrics fm = g.getFontMetrics();
		int lineHeight = fm.getHeight();
		int top = bounds.y + (bounds.height - 2 * lineHeight) / 2;
		g.drawString(first, bounds.x + (bounds.width - fm.stringWidth(first)) / 2, top + fm.getAscent());
		g.drawString(second, bounds.x + (bounds.width - fm.stringWidth(second)) / 2, top + lineHeight + fm.getAscent());
	}

	private void drawScrollIndicators(Graphics2D g, ViewportController viewport)
	{
		int width = viewport.getViewportWidth();
		int height = viewport.getViewportHeight();
		Rectangle vertical = viewport.verticalThumb();
		if (vertical != null)
		{
			g.setColor(SCROLL_TRACK);
			g.fillRect(vertical.x, 0, vertical.width, height);
			g.setColor(SCROLL_THUMB);
			g.fillRect(vertical.x, vertical.y, vertical.width, vertical.height);
		}
		Rectangle horizontal = viewport.horizontalThumb();
		if (horizontal != null)
		{
			g.setColor(SCROLL_TRACK);
			g.fillRect(0, horizontal.y, width, horizontal.height);
			g.setColor(SCROLL_THUMB);
			g.fillRect(horizontal.x, horizontal.y, horizontal.width, horizontal.height);
		}
	}

	/**
	 * Focused single image: darkened backdrop, bitmap scaled to fit preserving aspect ratio, the
	 * row/column names bottom-left and the key help bottom-centre.
	 */
	public void drawFullscreen(RenderContext ctx, CachedImage image, String rowName, String columnName,
							   int width, int height)
	{
		Graphics2D g = ctx.graphics();
		g.setColor(FULLSCREEN_BG);
		g.fillRect(0, 0, width, height);

		if (image.isSynthetic())
		{
			// Placeholder boxes are redrawn at fullscreen size; never scaled up past it
			BufferedImage box = ImageCache.synthesize(image.kind() == CachedImage.Kind.PLACEHOLDER
					? PLACEHOLDER_COLOR : ERROR_COLOR, image.label(),
					FULLSCREEN_BOX_WIDTH, FULLSCREEN_BOX_HEIGHT, FULLSCREEN_BOX_FONT_SIZE);
			Rectangle target = fitInside(box.getWidth(), box.getHeight(), new Rectangle(0, 0, width, height));
			if (target.width > box.getWidth())
			{
				target = new Rectangle((width - box.getWidth()) / 2, (height - box.getHeight()) / 2,
						box.getWidth(), box.getHeight());
			}
			g.drawImage(box, target.x, target.y, target.width, target.height, null);
		}
		else
		{
			BufferedImage bitmap = image.image();
			Rectangle target = fitInside(bitmap.getWidth(), bitmap.getHeight(), new Rectangle(0, 0, width, height));
			g.drawImage(bitmap, target.x, target.y, target.width, target.height, null);
		}

		g.setFont(ctx.labelFont());
		FontMetrics fm = g.getFontMetrics();
		int pad = 10;
		String rowText = "Row: " + rowName;
		String colText = "Column: " + columnName;
		int lineHeight = fm.getHeight();

		int helpBoxW = fm.stringWidth(FULLSCREEN_HELP) + 2 * pad;
		int helpBoxH = lineHeight + 2 * pad;
		int helpBoxX = (width - helpBoxW) / 2;
		int helpBoxY = height - helpBoxH;

		int infoBoxW = Math.max(fm.stringWidth(rowText), fm.stringWidth(colText)) + 2 * pad;
		int infoBoxH = 2 * lineHeight + 3 * pad;
		int infoBoxY = helpBoxY - infoBoxH - pad;

		Composite old = g.getComposite();
		g.setComposite(AlphaComposite.SrcOver);
		g.setColor(INFO_BOX_BG);
		g.fillRect(pad, infoBoxY, infoBoxW, infoBoxH);
		g.fillRect(helpBoxX, helpBoxY, helpBoxW, helpBoxH);
		g.setComposite(old);

		g.setColor(Color.WHITE);
		g.drawString(rowText, 2 * pad, infoBoxY + pad + fm.getAscent());
		g.drawString(colText, 2 * pad, infoBoxY + 2 * pad + lineHeight + fm.getAscent());
		g.setColor(new Color(200, 200, 200));
		g.drawString(FULLSCREEN_HELP, helpBoxX + pad, helpBoxY + pad + fm.getAscent());
	}

	// --- Layout helpers shared with the PNG exporter ---

	static void drawLines(Graphics2D g, List<String> lines, int x, int y)
	{
		FontMetrics fm = g.getFontMetrics();
		int baseline = y + fm.getAscent();
		for (String line : lines)
		{
			g.drawString(line, x, baseline);
			baseline += fm.getHeight();
		}
	}

	static Rectangle inset(Rectangle r, int by)
	{
		return new Rectangle(r.x + by, r.y + by, Math.max(0, r.width - 2 * by), Math.max(0, r.height - 2 * by));
	}

	static Rectangle fitInside(int imageWidth, int imageHeight, Rectangle box)
	{
		if (imageWidth <= 0 || imageHeight <= 0 || box.isEmpty())
		{
			return new Rectangle(box.x, box.y, 0, 0);
		}
		double scale = Math.min((double) box.width / imageWidth, (double) box.height / imageHeight);
		int w = Math.max(1, (int) (imageWidth * scale));
		int h = Math.max(1, (int) (imageHeight * scale));
		return new Rectangle(box.x + (box.width - w) / 2, box.y + (box.height - h) / 2, w, h);
	}
}
