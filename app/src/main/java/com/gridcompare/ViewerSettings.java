package com.gridcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Tunables for the viewer. Defaults come from {@code gridcompare.yml} on the classpath; a file named
 * by the {@code gridcompare.config} system property may override any subset of keys.
 */
public record ViewerSettings(
		ViewportSettings viewport,
		InputSettings input,
		ExportSettings export,
		int fontSize,
		int smallFontSize,
		int cellPadding)
{
	private static final Logger logger = LoggerFactory.getLogger(ViewerSettings.class);

	static final String DEFAULTS_RESOURCE = "/gridcompare.yml";
	static final String CONFIG_PROPERTY = "gridcompare.config";

	public record ViewportSettings(
			double minZoom,
			double maxZoom,
			double zoomStep,
			double minStartZoom,
			int bufferRows,
			int bufferCols,
			int headerMaxHeight,
			int filenameMaxWidth,
			int headerSoftMin,
			int defaultCellSize) {}

	public record InputSettings(int scrollStep, int dragThreshold, int frameIntervalMs) {}

	public record ExportSettings(
			int columnMinWidth,
			int columnMaxWidth,
			int headerMinHeight,
			int headerMaxHeight,
			float thumbnailQuality,
			String htmlDirectory) {}

	public static ViewerSettings defaults()
	{
		return fromMap(readResource());
	}

	public static ViewerSettings load()
	{
		Map<String, Object> merged = readResource();
		String override = System.getProperty(CONFIG_PROPERTY);
		if (override != null && !override.isBlank())
		{
			Path path = Path.of(override);
			try (InputStream in = Files.newInputStream(path))
			{
				merge(merged, asMap(new Yaml().load(in)));
				logger.info("Loaded settings overrides from {}", path);
			}
			catch (IOException e)
			{
				logger.warn("Cannot read settings file {}: {}", path, e.getMessage());
			}
		}
		return fromMap(merged);
	}

	static ViewerSettings fromMap(Map<String, Object> root)
	{
		Map<String, Object> viewport = section(root, "viewport");
		Map<String, Object> input = section(root, "input");
		Map<String, Object> export = section(root, "export");
		Map<String, Object> text = section(root, "text");

		ViewportSettings vp = new ViewportSettings(
				getDouble(viewport, "minZoom"),
				getDouble(viewport, "maxZoom"),
				getDouble(viewport, "zoomStep"),
				getDouble(viewport, "minStartZoom"),
				getInt(viewport, "bufferRows"),
				getInt(viewport, "bufferCols"),
				getInt(viewport, "headerMaxHeight"),
				getInt(viewport, "filenameMaxWidth"),
				getInt(viewport, "headerSoftMin"),
				getInt(viewport, "defaultCellSize"));
		if (vp.minZoom() <= 0 || vp.minZoom() > vp.maxZoom())
		{
			throw new IllegalArgumentException("Invalid zoom bounds: " + vp.minZoom() + " .. " + vp.maxZoom());
		}

		InputSettings in = new InputSettings(
				getInt(input, "scrollStep"),
				getInt(input, "dragThreshold"),
				getInt(input, "frameIntervalMs"));

		ExportSettings ex = new ExportSettings(
				getInt(export, "columnMinWidth"),
				getInt(export, "columnMaxWidth"),
				getInt(export, "headerMinHeight"),
				getInt(export, "headerMaxHeight"),
				(float) getDouble(export, "thumbnailQuality"),
				String.valueOf(export.get("htmlDirectory")));

		return new ViewerSettings(vp, in, ex,
				getInt(text, "fontSize"),
				getInt(text, "smallFontSize"),
				getInt(text, "cellPadding"));
	}

	private static Map<String, Object> readResource()
	{
		try (InputStream in = ViewerSettings.class.getResourceAsStream(DEFAULTS_RESOURCE))
		{
			if (in == null)
			{
				throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
			}
			return asMap(new Yaml().load(in));
		}
		catch (IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object loaded)
	{
		if (loaded instanceof Map<?, ?> map)
		{
			return new HashMap<>((Map<String, Object>) map);
		}
		return new HashMap<>();
	}

	static void merge(Map<String, Object> target, Map<String, Object> source)
	{
		for (Map.Entry<String, Object> entry : source.entrySet())
		{
			Object existing = target.get(entry.getKey());
			if (existing instanceof Map<?, ?> && entry.getValue() instanceof Map<?, ?>)
			{
				Map<String, Object> nested = asMap(existing);
				merge(nested, asMap(entry.getValue()));
				target.put(entry.getKey(), nested);
			}
			else
			{
				target.put(entry.getKey(), entry.getValue());
			}
		}
	}

	private static Map<String, Object> section(Map<String, Object> root, String name)
	{
		Object value = root.get(name);
		if (!(value instanceof Map<?, ?>))
		{
			throw new IllegalArgumentException("Missing settings section: " + name);
		}
		return asMap(value);
	}

	private static int getInt(Map<String, Object> section, String key)
	{
		return (int) Math.round(getDouble(section, key));
	}

	private static double getDouble(Map<String, Object> section, String key)
	{
		Object value = section.get(key);
		if (value instanceof Number n) return n.doubleValue();
		if (value instanceof String s)
		{
			try
			{
				return Double.parseDouble(s.trim());
			}
			catch (NumberFormatException e)
			{
				throw new IllegalArgumentException("Setting '" + key + "' is not a number: " + s, e);
			}
		}
		throw new IllegalArgumentException("Missing setting: " + key);
	}
}
