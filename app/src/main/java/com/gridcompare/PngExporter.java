package com.gridcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Renders the whole grid, ignoring the viewport, into one PNG. The header column is as wide as the
 * longest filename and the header row as tall as the tallest wrapped folder name, each within the
 * export bounds.
 */
public class PngExporter
{
	private static final Logger logger = LoggerFactory.getLogger(PngExporter.class);

	private static final int LABEL_MARGIN = 20;
	static final String IMAGE_ERROR = "Image Error";

	public record MosaicLayout(int firstColumnWidth, int headerHeight, int cellSize, int width, int height)
	{
		int columnX(int col)
		{
			return col == 0 ? 0 : firstColumnWidth + (col - 1) * cellSize;
		}

		int rowY(int row)
		{
			return row == 0 ? 0 : headerHeight + (row - 1) * cellSize;
		}

		Rectangle cell(int row, int col)
		{
			return new Rectangle(columnX(col), rowY(row),
					col == 0 ? firstColumnWidth : cellSize,
					row == 0 ? headerHeight : cellSize);
		}
	}

	private PngExporter() {}

	static MosaicLayout layout(Grid grid, int cellSize, ViewerSettings settings, TextMeasurer measurer)
			throws IOException
	{
		ViewerSettings.ExportSettings export = settings.export();
		int padding = settings.cellPadding();

		int firstColumn = export.columnMinWidth();
		for (int row = 1; row < grid.rowCount(); row++)
		{
			int needed = measurer.stringWidth(grid.rowLabel(row)) + LABEL_MARGIN;
			firstColumn = Math.max(firstColumn, Math.min(needed, export.columnMaxWidth()));
		}

		int header = export.headerMinHeight();
		for (int col = 1; col < grid.colCount(); col++)
		{
			int lines = TextFitter.fit(grid.columnLabel(col), measurer,
					cellSize - 2 * padding, export.headerMaxHeight() - 2 * padding).size();
			int needed = lines * measurer.lineHeight() + 2 * padding;
			header = Math.max(header, Math.min(needed, export.headerMaxHeight()));
		}

		long width = firstColumn + (long) (grid.colCount() - 1) * cellSize;
		long height = header + (long) (grid.rowCount() - 1) * cellSize;
		if (width * height > Integer.MAX_VALUE)
		{
			throw new IOException("Mosaic too large to rasterize: " + width + "x" + height);
		}
		return new MosaicLayout(firstColumn, header, cellSize, (int) width, (int) height);
	}

	public static Path export(Grid grid, int cellSize, ViewerSettings settings, ImageDecoder decoder,
							  Path output, ProgressListener listener) throws IOException
	{
		MosaicLayout layout = measure(grid, cellSize, settings);
		BufferedImage canvas = new BufferedImage(layout.width(), layout.height(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g = canvas.createGraphics();
		try
		{
			RenderContext ctx = RenderContext.create(g, settings);
			g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
			g.setColor(GridRenderer.BACKGROUND_COLOR);
			g.fillRect(0, 0, layout.width(), layout.height());

			int total = grid.totalCells();
			int processed = 0;
			for (int row = 0; row < grid.rowCount(); row++)
			{
				for (int col = 0; col < grid.rowLength(row); col++)
				{
					drawCell(ctx, grid, row, col, layout, settings.cellPadding(), decoder);
					processed++;
					if (listener != null) listener.onProgress(processed, total);
				}
			}
		}
		finally
		{
			g.dispose();
		}

		writeAtomically(canvas, output);
		logger.info("Grid exported to {} ({}x{})", output, layout.width(), layout.height());
		return output;
	}

	private static MosaicLayout measure(Grid grid, int cellSize, ViewerSettings settings) throws IOException
	{
		// Scratch surface for font metrics; the canvas size depends on what they say
		BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = scratch.createGraphics();
		try
		{
			return layout(grid, cellSize, settings, RenderContext.create(g, settings).labelMeasurer());
		}
		finally
		{
			g.dispose();
		}
	}

	private static void drawCell(RenderContext ctx, Grid grid, int row, int col, MosaicLayout layout,
								 int padding, ImageDecoder decoder)
	{
		Graphics2D g = ctx.graphics();
		Cell cell = grid.cell(row, col);
		Rectangle box = layout.cell(row, col);

		if (cell instanceof Cell.Corner)
		{
			fill(g, box, GridRenderer.BACKGROUND_COLOR);
			g.setColor(GridRenderer.TEXT_COLOR);
			GridRenderer.drawCenteredPair(g, ctx.smallFont(), box, grid.baseResolution(), layout.cellSize() + "px");
			return;
		}

		if (cell instanceof Cell.ColumnHeader || cell instanceof Cell.RowHeader)
		{
			fill(g, box, GridRenderer.HEADER_COLOR);
			String text = cell instanceof Cell.ColumnHeader header ? header.folderName() : ((Cell.RowHeader) cell).text();
			Rectangle inner = GridRenderer.inset(box, padding);
			g.setFont(ctx.labelFont());
			g.setColor(GridRenderer.TEXT_COLOR);
			GridRenderer.drawLines(g, TextFitter.fit(text, ctx.labelMeasurer(), inner.width, inner.height),
					inner.x, inner.y);
			return;
		}

		if (cell instanceof Cell.Placeholder placeholder)
		{
			fill(g, box, GridRenderer.PLACEHOLDER_COLOR);
			drawNote(ctx, box, padding, placeholder.reason());
			return;
		}

		Cell.ImagePath image = (Cell.ImagePath) cell;
		try
		{
			BufferedImage bitmap = decoder.decode(image.path());
			fill(g, box, GridRenderer.GRID_COLOR);
			Rectangle target = GridRenderer.fitInside(bitmap.getWidth(), bitmap.getHeight(),
					GridRenderer.inset(box, padding));
			g.drawImage(bitmap, target.x, target.y, target.width, target.height, null);
			g.setColor(GridRenderer.BORDER_COLOR);
			g.drawRect(box.x, box.y, box.width - 1, box.height - 1);
		}
		catch (IOException | RuntimeException e)
		{
			logger.warn("Image error at {}: {}", image.path(), e.getMessage());
			fill(g, box, GridRenderer.ERROR_COLOR);
			drawNote(ctx, box, padding, IMAGE_ERROR);
		}
	}

	private static void fill(Graphics2D g, Rectangle box, Color color)
	{
		g.setColor(color);
		g.fillRect(box.x, box.y, box.width, box.height);
		g.setColor(GridRenderer.BORDER_COLOR);
		g.drawRect(box.x, box.y, box.width - 1, box.height - 1);
	}

	private static void drawNote(RenderContext ctx, Rectangle box, int padding, String text)
	{
		Rectangle inner = GridRenderer.inset(box, padding);
		Graphics2D g = ctx.graphics();
		g.setFont(ctx.smallFont());
		g.setColor(GridRenderer.TEXT_COLOR);
		GridRenderer.drawLines(g, TextFitter.fit(text, ctx.smallMeasurer(), inner.width, inner.height),
				inner.x, inner.y);
	}

	/** Writes to a hidden sibling first so the target only ever appears complete. */
	static void writeAtomically(BufferedImage image, Path output) throws IOException
	{
		Path absolute = output.toAbsolutePath();
		Path parent = absolute.getParent();
		if (parent != null) Files.createDirectories(parent);
		Path partial = absolute.resolveSibling("." + absolute.getFileName() + ".part");
		try
		{
			if (!ImageIO.write(image, "png", partial.toFile()))
			{
				throw new IOException("No PNG writer available");
			}
			try
			{
				Files.move(partial, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e)
			{
				Files.move(partial, absolute, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally
		{
			Files.deleteIfExists(partial);
		}
	}
}
