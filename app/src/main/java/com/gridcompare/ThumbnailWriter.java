package com.gridcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;

/**
 * Scales and encodes gallery thumbnails. WebP through the ImageIO plugin when it is usable; if the
 * plugin is missing or its native encoder fails to load, the rest of the job falls back to PNG.
 * One instance per export job.
 */
public class ThumbnailWriter
{
	private static final Logger logger = LoggerFactory.getLogger(ThumbnailWriter.class);

	static final String WEBP = "webp";
	static final String PNG = "png";

	private final float quality;
	private String format;

	ThumbnailWriter(String format, float quality)
	{
		this.format = format;
		this.quality = quality;
	}

	public static ThumbnailWriter create(float quality)
	{
		if (ImageIO.getImageWritersByFormatName(WEBP).hasNext())
		{
			return new ThumbnailWriter(WEBP, quality);
		}
		logger.warn("No WebP writer registered; gallery thumbnails will be PNG");
		return new ThumbnailWriter(PNG, quality);
	}

	public String getFormat()
	{
		return format;
	}

	static BufferedImage scaleToFit(BufferedImage source, int target)
	{
		int w = source.getWidth();
		int h = source.getHeight();
		double ratio = Math.min((double) target / w, (double) target / h);
		int newW = Math.max(1, (int) (w * ratio));
		int newH = Math.max(1, (int) (h * ratio));

		int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
		BufferedImage scaled = new BufferedImage(newW, newH, type);
		Graphics2D g = scaled.createGraphics();
		try
		{
			g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
			g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
			g.drawImage(source, 0, 0, newW, newH, null);
		}
		finally
		{
			g.dispose();
		}
		return scaled;
	}

	public String write(BufferedImage image, Path directory, String baseName) throws IOException
	{
		if (WEBP.equals(format))
		{
			Path file = directory.resolve(baseName + "." + WEBP);
			try
			{
				encode(image, file, WEBP);
				return file.getFileName().toString();
			}
			catch (LinkageError | IOException e)
			{
				logger.warn("WebP encoding unavailable ({}); switching to PNG", e.toString());
				Files.deleteIfExists(file);
				format = PNG;
			}
		}
		Path file = directory.resolve(baseName + "." + PNG);
		encode(image, file, PNG);
		return file.getFileName().toString();
	}

	private void encode(BufferedImage image, Path file, String formatName) throws IOException
	{
		Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
		if (!writers.hasNext())
		{
			throw new IOException("No " + formatName + " writer available");
		}
		ImageWriter writer = writers.next();
		try (ImageOutputStream ios = ImageIO.createImageOutputStream(file.toFile()))
		{
			if (ios == null)
			{
				throw new IOException("Cannot open " + file + " for writing");
			}
			writer.setOutput(ios);
			ImageWriteParam param = writer.getDefaultWriteParam();
			configureQuality(param);
			writer.write(null, new IIOImage(image, null, null), param);
		}
		finally
		{
			writer.dispose();
		}
	}

	private void configureQuality(ImageWriteParam param)
	{
		if (!param.canWriteCompressed()) return;
		String[] types = param.getCompressionTypes();
		if (types == null || types.length == 0) return;
		String chosen = types[0];
		for (String type : types)
		{
			if (type.toLowerCase(Locale.ROOT).contains("lossy"))
			{
				chosen = type;
				break;
			}
		}
		param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
		param.setCompressionType(chosen);
		if (!chosen.toLowerCase(Locale.ROOT).contains("lossless"))
		{
			param.setCompressionQuality(quality);
		}
	}
}
