package elmfmt;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import elmfmt.fixity.FixityTable;

/**
 * Settings for one formatting run, usually read from a JSON file such as
 * <pre>
 * {
 *   "width": 100,
 *   "coreFixities": true,
 *   "fixities": [{"operator": "|=", "precedence": 5, "associativity": "left"}]
 * }
 * </pre>
 * Every key is optional.
 */
public class FormatterOptions {
	private static final Logger logger = Logger.getLogger("Formatter Options");

	public static final String WIDTH_FIELD = "width";
	public static final String FIXITIES_FIELD = "fixities";
	public static final String CORE_FIXITIES_FIELD = "coreFixities";

	public static final int DEFAULT_WIDTH = 80;

	private final int width;
	private final FixityTable fixities;

	public FormatterOptions(int width, FixityTable fixities) {
		if (width <= 0) {
			throw new IllegalArgumentException("page width must be positive, got " + width);
		}
		this.width = width;
		this.fixities = fixities;
	}

	/**
	 * Default width with the core library's operators.
	 */
	public static FormatterOptions defaults() {
		return new FormatterOptions(DEFAULT_WIDTH, FixityTable.core());
	}

	public int getWidth() {
		return width;
	}

	public FixityTable getFixities() {
		return fixities;
	}

	public FormatterOptions withWidth(int width) {
		return new FormatterOptions(width, fixities);
	}

	public FormatterOptions withFixities(FixityTable fixities) {
		return new FormatterOptions(width, fixities);
	}

	public static FormatterOptions fromJSON(JSONObject config) throws FormatterOptionException {
		int width = DEFAULT_WIDTH;
		boolean coreFixities = true;
		FixityTable extra = FixityTable.empty();
		try {
			if (config.has(WIDTH_FIELD)) {
				width = config.getInt(WIDTH_FIELD);
			}
			if (config.has(CORE_FIXITIES_FIELD)) {
				coreFixities = config.getBoolean(CORE_FIXITIES_FIELD);
			}
			if (config.has(FIXITIES_FIELD)) {
				JSONArray entries = config.getJSONArray(FIXITIES_FIELD);
				extra = FixityTable.fromJSON(entries);
			}
		} catch (JSONException e) {
			throw new FormatterOptionException("invalid formatter options: " + e.getMessage(), e);
		}
		if (width <= 0) {
			throw new FormatterOptionException("width must be positive, got " + width);
		}

		FixityTable fixities = coreFixities ? FixityTable.core().withTable(extra) : extra;
		logger.fine("width " + width + ", " + fixities.size() + " operator fixities");
		return new FormatterOptions(width, fixities);
	}

	public static FormatterOptions load(File configFile) throws FormatterOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(configFile, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new FormatterOptionException("Error reading configuration file: " + ex.getMessage(), ex);
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new FormatterOptionException(configFile + ": parsing error: " + e.getMessage(), e);
		}
		return fromJSON(config);
	}
}
