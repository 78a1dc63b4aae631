package com.snapbooth;

import com.formdev.flatlaf.themes.FlatMacDarkLaf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.SwingUtilities;
import java.io.IOException;
import java.nio.file.Path;

public class SnapBoothApp
{
	private static final Logger logger = LoggerFactory.getLogger(SnapBoothApp.class);

	public static void main(String[] args) throws IOException
	{
		BoothSettings settings = BoothSettings.load(args.length > 0 ? Path.of(args[0]) : null);
		logger.info("Starting SnapBooth: {} layout, {} x {} mode, storage {}",
				settings.layoutKind(), settings.session().targetShotCount(), settings.session().mode(),
				settings.storageDir());

		FlatMacDarkLaf.setup();
		SwingUtilities.invokeLater(() -> {
			BoothFrame frame = new BoothFrame(settings);
			frame.setVisible(true);
		});
	}
}
