package ai.envlens.analyzer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.treesitter.TSNode;
import org.treesitter.TSQueryCursor;
import org.treesitter.TSQueryMatch;

/** Runs one query category over a tree and returns each match as capture name to node. */
public final class QueryRunner {
    private QueryRunner() {}

    public static List<Map<String, TSNode>> matches(LanguageProfile profile, QueryCategory category, TSNode root) {
        var query = profile.query(category);
        if (query.isEmpty()) {
            return List.of();
        }
        var tsQuery = query.get();
        var results = new ArrayList<Map<String, TSNode>>();
        var cursor = new TSQueryCursor();
        cursor.exec(tsQuery, root);
        var match = new TSQueryMatch();
        while (cursor.nextMatch(match)) {
            var captures = new HashMap<String, TSNode>();
            for (var capture : match.getCaptures()) {
                captures.putIfAbsent(tsQuery.getCaptureNameForId(capture.getIndex()), capture.getNode());
            }
            results.add(captures);
        }
        return results;
    }
}
