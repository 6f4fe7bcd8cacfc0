package org.overlaynet.test.common;

import org.overlaynet.settings.Settings;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Paths;

public class Common {

	public static final String testSettingsFilename = "test-settings.json";

	public static void useSettings(String settingsFilename) {
		URL settingsUrl = Common.class.getClassLoader().getResource(settingsFilename);
		if (settingsUrl == null)
			throw new IllegalStateException("Missing test resource " + settingsFilename);

		try {
			Settings.fileInstance(Paths.get(settingsUrl.toURI()).toString());
		} catch (URISyntaxException e) {
			throw new IllegalStateException("Bad test resource URL " + settingsUrl, e);
		}
	}

	public static void useDefaultSettings() {
		useSettings(testSettingsFilename);
	}

}
