package ch.so.arp.kbdb.search;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Callable search tools, one per registered modality and named
 * {@code search_<modality>}. This is the only place where failures are turned
 * into text: every call returns a string, and a failed call returns a string
 * starting with {@value #FAILURE_PREFIX}.
 */
public class SearchTools {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchTools.class);

    static final String TOOL_PREFIX = "search_";
    static final String FAILURE_PREFIX = "Search failed: ";

    private final RetrievalService retrievalService;
    private final ResultFormatter formatter;
    private final List<ToolDescriptor> tools;

    public SearchTools(ModalityRegistry registry, RetrievalService retrievalService, ResultFormatter formatter) {
        this.retrievalService = Objects.requireNonNull(retrievalService, "retrievalService");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.tools = Objects.requireNonNull(registry, "registry").all().stream()
                .map(modality -> new ToolDescriptor(toolName(modality.name()), modality.description(),
                        modality.name()))
                .toList();
    }

    public static String toolName(String modalityName) {
        return TOOL_PREFIX + modalityName;
    }

    public List<ToolDescriptor> tools() {
        return tools;
    }

    /**
     * Invoke a tool by its public name, e.g. {@code search_semantic}.
     */
    public String invoke(String toolName, String query, Integer topK) {
        if (toolName == null || !toolName.startsWith(TOOL_PREFIX)) {
            LOGGER.warn("Rejected call to unknown tool '{}'", toolName);
            return FAILURE_PREFIX + "Unknown tool '" + toolName + "'";
        }
        return search(toolName.substring(TOOL_PREFIX.length()), query, topK);
    }

    /**
     * Run a search for a modality and render the outcome.
     *
     * @return the formatted results or a failure message
     */
    public String search(String modalityName, String query, Integer topK) {
        try {
            List<SearchResult> results = retrievalService.search(modalityName, query, topK);
            return formatter.format(results);
        } catch (Exception ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            LOGGER.error("Search in modality '{}' for query '{}' failed: {}", modalityName, query, reason, ex);
            return FAILURE_PREFIX + reason;
        }
    }
}
