package elmfmt;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import elmfmt.fixity.Associativity;
import elmfmt.fixity.Fixity;

public class FormatterOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File config(String json) throws IOException {
		File file = folder.newFile("elmfmt.json");
		FileUtils.writeStringToFile(file, json, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void testDefaults() throws FormatterOptionException {
		FormatterOptions options = FormatterOptions.fromJSON(new JSONObject());
		assertThat(options.getWidth(), is(FormatterOptions.DEFAULT_WIDTH));
		assertEquals(new Fixity("*", 7, Associativity.LEFT), options.getFixities().lookup("*"));
	}

	@Test
	public void testLoadFromFile() throws IOException, FormatterOptionException {
		FormatterOptions options = FormatterOptions.load(config(
				"{\"width\": 100, \"fixities\": [" +
				"{\"operator\": \"|=\", \"precedence\": 5, \"associativity\": \"left\"}]}"));
		assertThat(options.getWidth(), is(100));
		assertEquals(new Fixity("|=", 5, Associativity.LEFT), options.getFixities().lookup("|="));
		assertThat(options.getFixities().lookup("+"), is(notNullValue()));
	}

	@Test
	public void testConfiguredEntriesOverrideCore() throws FormatterOptionException {
		FormatterOptions options = FormatterOptions.fromJSON(new JSONObject(
				"{\"fixities\": [{\"operator\": \"+\", \"precedence\": 2, \"associativity\": \"right\"}]}"));
		assertEquals(new Fixity("+", 2, Associativity.RIGHT), options.getFixities().lookup("+"));
	}

	@Test
	public void testWithoutCoreFixities() throws FormatterOptionException {
		FormatterOptions options = FormatterOptions.fromJSON(new JSONObject("{\"coreFixities\": false}"));
		assertTrue(options.getFixities().isEmpty());
	}

	@Test(expected = FormatterOptionException.class)
	public void testMissingFile() throws FormatterOptionException {
		FormatterOptions.load(new File(folder.getRoot(), "missing.json"));
	}

	@Test(expected = FormatterOptionException.class)
	public void testMalformedJSON() throws IOException, FormatterOptionException {
		FormatterOptions.load(config("{\"width\": "));
	}

	@Test(expected = FormatterOptionException.class)
	public void testWidthMustBePositive() throws FormatterOptionException {
		FormatterOptions.fromJSON(new JSONObject("{\"width\": 0}"));
	}

	@Test(expected = FormatterOptionException.class)
	public void testWidthMustBeANumber() throws FormatterOptionException {
		FormatterOptions.fromJSON(new JSONObject("{\"width\": \"wide\"}"));
	}
}
