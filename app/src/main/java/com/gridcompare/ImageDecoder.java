package com.gridcompare;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a file into a bitmap. The interactive cache and each export job hold their own calls to it,
 * so implementations must be safe to use from more than one thread.
 */
@FunctionalInterface
public interface ImageDecoder
{
	BufferedImage decode(Path path) throws IOException;

	static ImageDecoder imageIo()
	{
		return path -> {
			BufferedImage image = ImageIO.read(path.toFile());
			if (image == null)
			{
				throw new IOException("No image reader for " + path.getFileName());
			}
			return image;
		};
	}
}
