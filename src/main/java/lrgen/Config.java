package lrgen;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, read on first use from a simple <code>key = value</code> file.
 *
 * The file is <code>lrgen.ini</code> in the working directory, the system property <code>lrgen.config</code>
 * points to another one. Missing keys keep their defaults.
 */
public class Config {

	public static final String configFile = "lrgen.ini";

	public static final String configFileProperty = "lrgen.config";

	private static final Logger LOG = Logger.getLogger("lrgen");

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("endMarker", "$");
		put("epsilonMarkers", "ε,epsilon");
		put("cacheSize", "10");
		put("maxSteps", "100000");
		put("logLevel", "WARNING");
	}};

	private static Map<String, String> config = null;

	private static synchronized Map<String, String> config(){
		if (config == null){
			config = readConfig(new File(System.getProperty(configFileProperty, configFile)));
			LOG.setLevel(Level.parse(config.get("logLevel")));
		}
		return config;
	}

	/** Name of the end of input terminal */
	public static String endMarker(){
		return config().get("endMarker");
	}

	/** Tokens that stand for an empty right hand side */
	public static Set<String> epsilonMarkers(){
		Set<String> markers = new HashSet<>();
		for (String marker : config().get("epsilonMarkers").split(",")){
			if (!marker.trim().isEmpty()){
				markers.add(marker.trim());
			}
		}
		return markers;
	}

	/** Number of generated parser tables kept in memory */
	public static int cacheSize(){
		return Integer.parseInt(config().get("cacheSize"));
	}

	/** Base number of parser steps before a run to completion is aborted */
	public static int maxSteps(){
		return Integer.parseInt(config().get("maxSteps"));
	}

	public static Level logLevel(){
		return Level.parse(config().get("logLevel"));
	}

	/**
	 * Reads the passed file on top of the defaults
	 *
	 * @return defaults if the file doesn't exist
	 * @throws LRException if the file can't be read or a value is malformed
	 */
	static Map<String, String> readConfig(File file){
		Map<String, String> values = new HashMap<>(defaults);
		if (!file.exists()){
			return values;
		}
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file),
				StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					if (values.containsKey(parts[0].trim())){
						values.put(parts[0].trim(), parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + parts[0] + "\"");
					}
				}
			}
		} catch (IOException e) {
			throw new LRException("Can't read config file " + file, e);
		}
		validate(file, values);
		return values;
	}

	private static void validate(File file, Map<String, String> values){
		checkInt(file, values, "cacheSize", 0);
		checkInt(file, values, "maxSteps", 0);
		if (values.get("endMarker").isEmpty()){
			throw new LRException(String.format("Invalid value for endMarker in %s: must not be empty", file));
		}
		try {
			Level.parse(values.get("logLevel"));
		} catch (IllegalArgumentException e) {
			throw new LRException(String.format("Invalid value for logLevel in %s: \"%s\"", file,
					values.get("logLevel")), e);
		}
	}

	private static void checkInt(File file, Map<String, String> values, String key, int min){
		int value;
		try {
			value = Integer.parseInt(values.get(key));
		} catch (NumberFormatException e) {
			throw new LRException(String.format("Invalid value for %s in %s: \"%s\" is not a number", key, file,
					values.get(key)), e);
		}
		if (value < min){
			throw new LRException(String.format("Invalid value for %s in %s: %d is smaller than %d", key, file,
					value, min));
		}
	}
}
