package elmfmt.exports;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class DocTagExportOrdererTest {

	private static ExportOrdering order(List<List<String>> tags, String... declared) {
		return new DocTagExportOrderer().order(tags, Arrays.asList(declared));
	}

	@Test
	public void testTaggedNamesFirstThenDeclarationOrder() {
		ExportOrdering actual = order(
				Arrays.asList(Arrays.asList("foo", "bar"), Arrays.asList("baz")),
				"bar", "baz", "foo", "qux");
		assertEquals(Arrays.asList("foo", "bar", "baz", "qux"), actual.getOrderedNames());
		assertTrue(actual.getIssues().isEmpty());
	}

	@Test
	public void testUnresolvedTagIsReportedOnce() {
		ExportOrdering actual = order(
				Arrays.asList(Arrays.asList("foo", "missing"), Arrays.asList("missing")),
				"foo");
		assertEquals(Arrays.asList("foo"), actual.getOrderedNames());
		assertThat(actual.getIssues().size(), is(1));
		assertThat(((UnresolvedDocTagIssue) actual.getIssues().get(0)).getTag(), is("missing"));
	}

	@Test
	public void testRepeatedTagKeepsFirstPosition() {
		ExportOrdering actual = order(
				Arrays.asList(Arrays.asList("b", "a"), Arrays.asList("b")),
				"a", "b", "c");
		assertEquals(Arrays.asList("b", "a", "c"), actual.getOrderedNames());
	}

	@Test
	public void testNoTags() {
		ExportOrdering actual = order(Collections.emptyList(), "z", "y", "(+)");
		assertEquals(Arrays.asList("z", "y", "(+)"), actual.getOrderedNames());
	}
}
