package com.gridcompare;

import javax.swing.AbstractAction;
import javax.swing.JComponent;
import javax.swing.JPanel;
import javax.swing.KeyStroke;
import javax.swing.SwingUtilities;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Window;
import java.awt.event.ActionEvent;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.event.MouseWheelEvent;
import java.awt.event.WindowEvent;

/**
 * The comparison surface: draws the visible part of the grid with pinned headers, pans on drag,
 * zooms on the wheel, and switches to a single focused image on click.
 */
public class GridViewPanel extends JPanel
{
	private final ViewerSettings settings;
	private final GridRenderer renderer;
	private final ImageCache cache;
	private final ViewportController viewport;
	private final FullscreenNavigator navigator;
	private Grid grid;

	private GridRenderer.RenderedFrame lastFrame;
	private boolean sized;

	// Press position and the last drag position
	private int pressX, pressY;
	private int lastDragX, lastDragY;
	private boolean pressed;
	private boolean panning;

	public GridViewPanel(Grid grid, ViewerSettings settings, ImageDecoder decoder, int baseCellSize)
	{
		this.grid = grid;
		this.settings = settings;
		this.renderer = new GridRenderer(settings);
		this.cache = new ImageCache(decoder);
		this.viewport = new ViewportController(settings.viewport(), baseCellSize);
		this.navigator = new FullscreenNavigator(grid);
		viewport.setGridSize(grid.rowCount(), grid.colCount());

		setPreferredSize(new Dimension(1024, 768));
		setBackground(GridRenderer.BACKGROUND_COLOR);
		setFocusable(true);

		addComponentListener(new ComponentAdapter()
		{
			@Override
			public void componentResized(ComponentEvent e)
			{
				if (!sized)
				{
					viewport.resetViewport(getWidth(), getHeight());
					sized = true;
				}
				else
				{
					viewport.resize(getWidth(), getHeight());
				}
				repaint();
			}
		});

		MouseAdapter mouse = new MouseAdapter()
		{
			@Override
			public void mousePressed(MouseEvent e)
			{
				if (!SwingUtilities.isLeftMouseButton(e)) return;
				requestFocusInWindow();
				pressed = true;
				panning = false;
				pressX = lastDragX = e.getX();
				pressY = lastDragY = e.getY();
			}

			@Override
			public void mouseDragged(MouseEvent e)
			{
				if (!pressed || navigator.isFocused()) return;
				int threshold = settings.input().dragThreshold();
				if (!panning && (Math.abs(e.getX() - pressX) >= threshold || Math.abs(e.getY() - pressY) >= threshold))
				{
					panning = true;
				}
				if (panning)
				{
					viewport.scroll(lastDragX - e.getX(), lastDragY - e.getY());
					lastDragX = e.getX();
					lastDragY = e.getY();
					repaint();
				}
			}

			@Override
			public void mouseReleased(MouseEvent e)
			{
				if (!pressed || !SwingUtilities.isLeftMouseButton(e)) return;
				pressed = false;
				if (!panning) handleClick(e.getX(), e.getY());
				panning = false;
			}

			@Override
			public void mouseWheelMoved(MouseWheelEvent e)
			{
				if (navigator.isFocused()) return;
				double rotation = e.getPreciseWheelRotation();
				if (rotation == 0) return;
				// Wheel away from the user zooms in
				viewport.zoom(rotation < 0 ? 1 : -1, e.getX(), e.getY());
				repaint();
			}
		};
		addMouseListener(mouse);
		addMouseMotionListener(mouse);
		addMouseWheelListener(mouse);

		int step = settings.input().scrollStep();
		bind("LEFT", "left", () -> arrow(FullscreenNavigator.Direction.LEFT, -step, 0));
		bind("RIGHT", "right", () -> arrow(FullscreenNavigator.Direction.RIGHT, step, 0));
		bind("UP", "up", () -> arrow(FullscreenNavigator.Direction.UP, 0, -step));
		bind("DOWN", "down", () -> arrow(FullscreenNavigator.Direction.DOWN, 0, step));
		bind("typed +", "zoomIn", () -> zoomCentered(1));
		bind("typed =", "zoomInEquals", () -> zoomCentered(1));
		bind("ADD", "zoomInKeypad", () -> zoomCentered(1));
		bind("typed -", "zoomOut", () -> zoomCentered(-1));
		bind("SUBTRACT", "zoomOutKeypad", () -> zoomCentered(-1));
		bind("typed 0", "resetView", this::resetView);
		bind("ESCAPE", "escape", this::escape);
	}

	void bind(String keyStroke, String name, Runnable action)
	{
		getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW).put(KeyStroke.getKeyStroke(keyStroke), name);
		getActionMap().put(name, new AbstractAction()
		{
			@Override
			public void actionPerformed(ActionEvent e)
			{
				action.run();
			}
		});
	}

	private void handleClick(int x, int y)
	{
		if (navigator.isFocused())
		{
			leaveFullscreen();
			return;
		}
		if (lastFrame == null) return;
		HitRegion hit = lastFrame.hitAt(x, y);
		if (hit != null && navigator.select(hit.row(), hit.col()))
		{
			syncFullscreenKey();
			repaint();
		}
	}

	private void arrow(FullscreenNavigator.Direction direction, int dx, int dy)
	{
		if (navigator.isFocused())
		{
			if (navigator.navigate(direction))
			{
				syncFullscreenKey();
				repaint();
			}
			return;
		}
		viewport.scroll(dx, dy);
		repaint();
	}

	private void zoomCentered(int direction)
	{
		if (navigator.isFocused()) return;
		viewport.zoom(direction);
		repaint();
	}

	private void resetView()
	{
		if (navigator.isFocused()) return;
		viewport.resetViewport(getWidth(), getHeight());
		repaint();
	}

	private void escape()
	{
		if (navigator.isFocused())
		{
			leaveFullscreen();
			return;
		}
		Window window = SwingUtilities.getWindowAncestor(this);
		if (window != null)
		{
			window.dispatchEvent(new WindowEvent(window, WindowEvent.WINDOW_CLOSING));
		}
	}

	private void leaveFullscreen()
	{
		navigator.escape();
		syncFullscreenKey();
		repaint();
	}

	private void syncFullscreenKey()
	{
		FullscreenNavigator.Focus focus = navigator.getFocus();
		cache.setFullscreenKey(focus == null ? null : ImageCache.keyOf(grid.cell(focus.row(), focus.col())));
	}

	/** Swaps in a rebuilt grid. Zoom is kept, scroll re-clamped, fullscreen and the cache dropped. */
	public void setGrid(Grid newGrid)
	{
		this.grid = newGrid;
		navigator.reset(newGrid);
		cache.setFullscreenKey(null);
		cache.clear();
		viewport.setGridSize(newGrid.rowCount(), newGrid.colCount());
		lastFrame = null;
		repaint();
	}

	public Grid getGrid()
	{
		return grid;
	}

	public ViewportController getViewport()
	{
		return viewport;
	}

	@Override
	protected void paintComponent(Graphics g)
	{
		super.paintComponent(g);
		Graphics2D g2 = (Graphics2D) g.create();
		try
		{
			RenderContext ctx = RenderContext.create(g2, settings);
			lastFrame = renderer.draw(ctx, grid, viewport, cache);
			cache.evict(lastFrame.visibleKeys());

			FullscreenNavigator.Focus focus = navigator.getFocus();
			if (focus != null)
			{
				CachedImage image = cache.get(grid.cell(focus.row(), focus.col()));
				renderer.drawFullscreen(ctx, image, grid.rowLabel(focus.row()), grid.columnLabel(focus.col()),
						getWidth(), getHeight());
			}
		}
		finally
		{
			g2.dispose();
		}
	}
}
