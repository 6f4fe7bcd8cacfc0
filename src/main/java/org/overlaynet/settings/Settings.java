package org.overlaynet.settings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.persistence.exceptions.XMLMarshalException;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.UnmarshallerProperties;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.UnmarshalException;
import javax.xml.bind.Unmarshaller;
import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.transform.stream.StreamSource;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class Settings {

	private static final Logger LOGGER = LogManager.getLogger(Settings.class);

	private static final String SETTINGS_FILENAME = "settings.json";

	private static final int DEFAULT_LISTEN_PORT = 12000;

	// Properties
	private static Settings instance;

	/** Port assumed when an address string carries none. */
	private int defaultPort = DEFAULT_LISTEN_PORT;

	/** Addresses ("host:port") that must never enter a registry. */
	private List<String> blacklist = new ArrayList<>();

	/** Hex-encoded public keys whose identities are never registered. */
	private List<String> blacklistedPublicKeys = new ArrayList<>();

	// Constructors

	private Settings() {
	}

	// Other methods

	public static synchronized Settings getInstance() {
		if (instance == null)
			fileInstance(SETTINGS_FILENAME);

		return instance;
	}

	/**
	 * Parse settings from given file.
	 * <p>
	 * A missing file leaves every setting at its default.
	 * Throws <tt>RuntimeException</tt> with <tt>UnmarshalException</tt> as cause if settings file could not be parsed.
	 */
	public static synchronized void fileInstance(String filename) {
		instance = loadFrom(filename);
	}

	/** Replaces the current instance with default settings. */
	public static synchronized void useDefaults() {
		instance = new Settings();
	}

	private static Settings loadFrom(String filename) {
		Unmarshaller unmarshaller;

		try {
			// Create JAXB context aware of Settings
			JAXBContext jc = JAXBContextFactory.createContext(new Class[] { Settings.class }, null);

			// Create unmarshaller
			unmarshaller = jc.createUnmarshaller();

			// Set the unmarshaller media type to JSON
			unmarshaller.setProperty(UnmarshallerProperties.MEDIA_TYPE, "application/json");

			// Tell unmarshaller that there's no JSON root element in the JSON input
			unmarshaller.setProperty(UnmarshallerProperties.JSON_INCLUDE_ROOT, false);
		} catch (JAXBException e) {
			String message = "Failed to setup unmarshaller to process settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		}

		File file = new File(filename);
		if (!file.exists()) {
			LOGGER.info("No settings file {}, using defaults", filename);
			return new Settings();
		}

		LOGGER.info("Using settings file: {}", file.getAbsolutePath());

		try (Reader reader = new FileReader(file, StandardCharsets.UTF_8)) {
			StreamSource json = new StreamSource(reader);

			// Attempt to unmarshal JSON stream to Settings
			Settings settings = unmarshaller.unmarshal(json, Settings.class).getValue();
			settings.validate();
			return settings;
		} catch (FileNotFoundException e) {
			String message = "Settings file vanished while opening: " + filename;
			LOGGER.error(message);
			throw new RuntimeException(message, e);
		} catch (UnmarshalException e) {
			Throwable linkedException = e.getLinkedException();
			if (linkedException instanceof XMLMarshalException) {
				String message = ((XMLMarshalException) linkedException).getInternalException().getLocalizedMessage();
				LOGGER.error(message);
				throw new RuntimeException(message, e);
			}

			String message = "Failed to parse settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		} catch (JAXBException e) {
			String message = "Unexpected JAXB issue while processing settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		} catch (IOException e) {
			String message = "Unable to read settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		}
	}

	private void validate() {
		if (this.defaultPort <= 0 || this.defaultPort > 65535) {
			String message = "Invalid defaultPort in settings: " + this.defaultPort;
			LOGGER.error(message);
			throw new RuntimeException(message);
		}

		// MOXy leaves absent lists as null
		if (this.blacklist == null)
			this.blacklist = new ArrayList<>();

		if (this.blacklistedPublicKeys == null)
			this.blacklistedPublicKeys = new ArrayList<>();
	}

	// Getters

	public int getDefaultPort() {
		return this.defaultPort;
	}

	public List<String> getBlacklist() {
		return Collections.unmodifiableList(this.blacklist);
	}

	public List<String> getBlacklistedPublicKeys() {
		return Collections.unmodifiableList(this.blacklistedPublicKeys);
	}

}
