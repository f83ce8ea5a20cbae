package ch.so.arp.kbdb.search;

import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Renders ranked results as plain text for the calling agent. The output only
 * depends on the input list.
 */
public final class ResultFormatter {

    static final String NO_RESULTS = "No relevant information found in the knowledge base.";

    public String format(List<SearchResult> results) {
        if (results == null || results.isEmpty()) {
            return NO_RESULTS;
        }
        StringJoiner joiner = new StringJoiner("\n");
        int rank = 0;
        for (SearchResult result : results) {
            rank++;
            joiner.add(formatResult(rank, result));
        }
        return joiner.toString();
    }

    private String formatResult(int rank, SearchResult result) {
        String header = String.format(Locale.ROOT, "--- Result %d | %s | document %d | chunk %d | score %.4f ---",
                rank, result.documentName(), result.documentId(), result.chunkIndex(), result.score());
        return header + "\n"
                + "--- Document Start ---\n"
                + "Content: " + result.content() + "\n"
                + "--- Document End ---\n";
    }
}
