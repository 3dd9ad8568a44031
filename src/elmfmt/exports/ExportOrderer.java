package elmfmt.exports;

import java.util.List;

/**
 * Decides the order in which a module header lists its exposed names.
 */
public interface ExportOrderer {

	/**
	 * @param tagGroups the names of each {@code @doc} line of the module comment, in document order
	 * @param declaredNames the names of the explicit exposing clause, in declaration order
	 * @return a permutation of {@code declaredNames}, with any diagnostics
	 */
	ExportOrdering order(List<List<String>> tagGroups, List<String> declaredNames);

}
