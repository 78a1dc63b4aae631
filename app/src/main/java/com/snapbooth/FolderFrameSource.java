package com.snapbooth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Camera stand-in that replays the images of a directory in natural filename order, wrapping
 * around at the end. The directory is re-listed on every request so images can be dropped in
 * while the booth runs.
 */
public class FolderFrameSource implements FrameSource
{
	private static final Logger logger = LoggerFactory.getLogger(FolderFrameSource.class);

	private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp", "gif");
	private static final Pattern NATURAL_SORT_SPLIT = Pattern.compile("(\\d+|\\D+)");

	static final Comparator<File> NATURAL_ORDER = (a, b) -> {
		List<String> partsA = splitNatural(a.getName());
		List<String> partsB = splitNatural(b.getName());
		int len = Math.min(partsA.size(), partsB.size());
		for (int i = 0; i < len; i++)
		{
			String pa = partsA.get(i);
			String pb = partsB.get(i);
			boolean aDigit = isAsciiDigit(pa.charAt(0));
			boolean bDigit = isAsciiDigit(pb.charAt(0));
			int cmp;
			if (aDigit && bDigit)
			{
				cmp = compareDigitRuns(pa, pb);
			}
			else
			{
				cmp = pa.compareToIgnoreCase(pb);
			}
			if (cmp != 0) return cmp;
		}
		return Integer.compare(partsA.size(), partsB.size());
	};

	private final File directory;
	private int next;

	public FolderFrameSource(File directory)
	{
		this.directory = directory;
	}

	@Override
	public synchronized BufferedImage requestFrame() throws FrameSourceException
	{
		List<File> images = listImages();
		if (images.isEmpty())
		{
			throw FrameSourceException.unavailable("No images in " + directory);
		}

		File file = images.get(next % images.size());
		next = (next + 1) % images.size();
		try
		{
			BufferedImage image = ImageIO.read(file);
			if (image == null)
			{
				throw new FrameSourceException("Unsupported image: " + file.getName(), false);
			}
			logger.debug("Serving frame {}", file.getName());
			return image;
		}
		catch (IOException e)
		{
			throw new FrameSourceException("Cannot read " + file.getName() + ": " + e.getMessage(), false, e);
		}
	}

	List<File> listImages()
	{
		File[] files = directory.listFiles();
		if (files == null)
		{
			return List.of();
		}
		List<File> images = new ArrayList<>();
		for (File f : files)
		{
			if (f.isFile() && isImageFilename(f.getName()))
			{
				images.add(f);
			}
		}
		images.sort(NATURAL_ORDER);
		return images;
	}

	static boolean isImageFilename(String name)
	{
		int dot = name.lastIndexOf('.');
		if (dot <= 0 || dot == name.length() - 1) return false;
		return IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
	}

	/**
	 * Numeric comparison of two digit runs of any length: fewer significant digits is smaller,
	 * equal lengths compare lexically. Equal values put the shorter zero-padding first.
	 */
	static int compareDigitRuns(String a, String b)
	{
		String sa = stripLeadingZeros(a);
		String sb = stripLeadingZeros(b);
		int cmp = Integer.compare(sa.length(), sb.length());
		if (cmp == 0) cmp = sa.compareTo(sb);
		if (cmp == 0) cmp = Integer.compare(a.length(), b.length());
		return cmp;
	}

	private static String stripLeadingZeros(String digits)
	{
		int i = 0;
		while (i < digits.length() - 1 && digits.charAt(i) == '0')
		{
			i++;
		}
		return digits.substring(i);
	}

	private static boolean isAsciiDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static List<String> splitNatural(String s)
	{
		List<String> parts = new ArrayList<>();
		Matcher m = NATURAL_SORT_SPLIT.matcher(s);
		while (m.find())
		{
			parts.add(m.group());
		}
		return parts;
	}
}
