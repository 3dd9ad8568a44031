package elmfmt.fixity;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import elmfmt.FormatterOptionException;
import elmfmt.InternalFormatterError;
import elmfmt.model.elm.ElmDeclaration;
import elmfmt.model.elm.ElmInfixDeclaration;

/**
 * 
 * Read-only mapping from operator symbol to {@link Fixity}. A missing symbol is
 * not an error here: {@link #lookup(String)} returns null and the caller decides
 * how to parenthesize conservatively.
 * 
 * Entries are read from JSON arrays of the form
 * <pre>
 * [ { "operator": "+", "precedence": 6, "associativity": "left" } ]
 * </pre>
 *
 */
public class FixityTable {

	public static final String CORE_RESOURCE = "/elmfmt/core-fixities.json";

	private static final FixityTable EMPTY = new FixityTable(Collections.emptyMap());

	private final Map<String, Fixity> fixities;

	private FixityTable(Map<String, Fixity> fixities) {
		this.fixities = fixities;
	}

	public static FixityTable empty() {
		return EMPTY;
	}

	public static FixityTable of(Collection<Fixity> entries) {
		return EMPTY.withEntries(entries);
	}

	/**
	 * The operators defined by the core library, bundled as a resource.
	 */
	public static FixityTable core() {
		try (InputStream in = FixityTable.class.getResourceAsStream(CORE_RESOURCE)) {
			if (in == null) {
				throw new InternalFormatterError("missing resource " + CORE_RESOURCE);
			}
			return fromJSON(new JSONArray(IOUtils.toString(in, StandardCharsets.UTF_8)));
		} catch (IOException | FormatterOptionException | JSONException e) {
			throw new InternalFormatterError(e);
		}
	}

	public static FixityTable fromJSON(JSONArray entries) throws FormatterOptionException {
		Map<String, Fixity> fixities = new HashMap<>();
		for (int i = 0; i < entries.length(); i++) {
			try {
				JSONObject entry = entries.getJSONObject(i);
				Fixity fixity = new Fixity(
						entry.getString("operator"),
						entry.getInt("precedence"),
						Associativity.fromKeyword(entry.getString("associativity")));
				fixities.put(fixity.getSymbol(), fixity);
			} catch (JSONException | IllegalArgumentException e) {
				throw new FormatterOptionException("invalid fixity entry " + i + ": " + e.getMessage(), e);
			}
		}
		return new FixityTable(Collections.unmodifiableMap(fixities));
	}

	public Fixity lookup(String symbol) {
		return fixities.get(symbol);
	}

	public boolean isEmpty() {
		return fixities.isEmpty();
	}

	public int size() {
		return fixities.size();
	}

	/**
	 * @return a new table where {@code entries} replace any existing entries for the same symbols
	 */
	public FixityTable withEntries(Collection<Fixity> entries) {
		if (entries.isEmpty()) {
			return this;
		}
		Map<String, Fixity> merged = new HashMap<>(fixities);
		for (Fixity fixity : entries) {
			merged.put(fixity.getSymbol(), fixity);
		}
		return new FixityTable(Collections.unmodifiableMap(merged));
	}

	public FixityTable withTable(FixityTable other) {
		return withEntries(other.fixities.values());
	}

	/**
	 * Adds the {@code infix} declarations found among a file's top-level declarations.
	 */
	public FixityTable withDeclarations(List<ElmDeclaration> declarations) {
		Map<String, Fixity> local = new HashMap<>();
		for (ElmDeclaration declaration : declarations) {
			if (declaration instanceof ElmInfixDeclaration) {
				Fixity fixity = ((ElmInfixDeclaration) declaration).toFixity();
				local.put(fixity.getSymbol(), fixity);
			}
		}
		return withEntries(local.values());
	}
}
