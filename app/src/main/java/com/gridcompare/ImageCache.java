package com.gridcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Decoded bitmaps for the cells currently on screen. Confined to the event thread: export jobs
 * decode on their own and never see this map.
 */
public class ImageCache
{
	private static final Logger logger = LoggerFactory.getLogger(ImageCache.class);

	static final String PLACEHOLDER_PREFIX = "placeholder:";
	static final String ERROR_LABEL = "Error";
	private static final int SYNTHETIC_SIZE = 100;

	private final ImageDecoder decoder;
	private final Map<String, CachedImage> entries = new HashMap<>();
	private String fullscreenKey;

	public ImageCache(ImageDecoder decoder)
	{
		this.decoder = decoder;
	}

	public static String keyOf(Cell cell)
	{
		if (cell instanceof Cell.ImagePath image) return image.path().toString();
		if (cell instanceof Cell.Placeholder placeholder) return PLACEHOLDER_PREFIX + placeholder.reason();
		return null;
	}

	public CachedImage get(Cell cell)
	{
		String key = keyOf(cell);
		if (key == null)
		{
			throw new IllegalArgumentException("Not a data cell: " + cell);
		}
		CachedImage cached = entries.get(key);
		if (cached != null) return cached;

		if (cell instanceof Cell.Placeholder placeholder)
		{
			cached = new CachedImage(synthesize(GridRenderer.PLACEHOLDER_COLOR, placeholder.reason()),
					CachedImage.Kind.PLACEHOLDER, placeholder.reason());
		}
		else
		{
			Cell.ImagePath image = (Cell.ImagePath) cell;
			try
			{
				cached = new CachedImage(decoder.decode(image.path()), CachedImage.Kind.IMAGE, "");
			}
			catch (IOException | RuntimeException e)
			{
				logger.warn("Error loading image {}: {}", image.path(), e.getMessage());
				cached = new CachedImage(synthesize(GridRenderer.ERROR_COLOR, ERROR_LABEL),
						CachedImage.Kind.DECODE_ERROR, ERROR_LABEL);
			}
		}
		entries.put(key, cached);
		return cached;
	}

	/** Keeps the fullscreen entry alive through {@link #evict} until cleared with null. */
	public void setFullscreenKey(String key)
	{
		this.fullscreenKey = key;
	}

	public String getFullscreenKey()
	{
		return fullscreenKey;
	}

	public void evict(Collection<String> visibleKeys)
	{
		entries.keySet().removeIf(key -> !visibleKeys.contains(key) && !key.equals(fullscreenKey));
	}

	public void clear()
	{
		entries.clear();
		fullscreenKey = null;
	}

	public int size()
	{
		return entries.size();
	}

	public Set<String> keys()
	{
		return Set.copyOf(entries.keySet());
	}

	public boolean contains(String key)
	{
		return entries.containsKey(key);
	}

	static BufferedImage synthesize(Color fill, String text)
	{
		return synthesize(fill, text, SYNTHETIC_SIZE, SYNTHETIC_SIZE, 16);
	}

	static BufferedImage synthesize(Color fill, String text, int width, int height, int fontSize)
	{
		BufferedImage box = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		Graphics2D g = box.createGraphics();
		try
		{
			g.setColor(fill);
			g.fillRect(0, 0, width, height);
			if (text != null && !text.isEmpty())
			{
				g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
				g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, fontSize));
				g.setColor(Color.WHITE);
				FontMetrics fm = g.getFontMetrics();
				g.drawString(text, fontSize * 10 / 16, (height + fm.getAscent()) / 2);
			}
		}
		finally
		{
			g.dispose();
		}
		return box;
	}
}
