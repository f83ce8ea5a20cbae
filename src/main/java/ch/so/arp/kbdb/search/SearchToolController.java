package ch.so.arp.kbdb.search;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint publishing the search tools. Tool calls always answer with
 * plain text, failures included.
 */
@RestController
@RequestMapping(path = "/api/tools")
public class SearchToolController {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchToolController.class);

    private final SearchTools searchTools;

    public SearchToolController(SearchTools searchTools) {
        this.searchTools = searchTools;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ToolDescriptor> tools() {
        return searchTools.tools();
    }

    @PostMapping(path = "/{toolName}", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_PLAIN_VALUE)
    public String invoke(@PathVariable String toolName, @RequestBody ToolRequest request) {
        LOGGER.debug("Tool call {} with top_k={}", toolName, request.topK());
        return searchTools.invoke(toolName, request.query(), request.topK());
    }

    /**
     * A body that does not bind to {@link ToolRequest} is answered like any
     * other failed tool call.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<String> unreadableRequest(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        String reason = cause instanceof JsonProcessingException
                ? ((JsonProcessingException) cause).getOriginalMessage()
                : cause.getMessage();
        LOGGER.warn("Rejected malformed tool request: {}", reason, ex);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(SearchTools.FAILURE_PREFIX + "Malformed tool request: " + reason);
    }
}
