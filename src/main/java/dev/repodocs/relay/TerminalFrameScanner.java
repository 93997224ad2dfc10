package dev.repodocs.relay;

import dev.repodocs.domain.enums.FrameKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * One-shot, end-of-stream scan for the payload of the first "done" frame.
 *
 * <p>This is not a general event-stream parser. The server never reacts to progress
 * frames, so it reads the accumulated text once, after upstream has closed, and stops at
 * the first qualifying data line.
 *
 * <p>A blank line clears the tracked kind, except when the tracked kind is "done": the
 * kind survives a boundary that precedes its data line. With the framing the generation
 * service emits (data on the line right after the event line) this never changes the
 * result. Do not normalize it away without confirming upstream framing.
 */
public class TerminalFrameScanner {

    private static final Logger log = LoggerFactory.getLogger(TerminalFrameScanner.class);

    private static final String EVENT_PREFIX = "event: ";
    private static final String DATA_PREFIX = "data: ";
    private static final String DONE = FrameKind.DONE.wireName();

    private final ObjectMapper objectMapper;

    public TerminalFrameScanner(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the parsed payload of the first "done" frame whose data is valid JSON,
     *         or empty when there is nothing to persist
     */
    public Optional<JsonNode> findTerminalPayload(String text) {
        String kind = "";
        for (String line : text.split("\r?\n", -1)) {
            if (line.startsWith(EVENT_PREFIX)) {
                kind = line.substring(EVENT_PREFIX.length()).trim();
            } else if (line.startsWith(DATA_PREFIX)) {
                if (!DONE.equals(kind)) continue;
                Optional<JsonNode> payload = parse(line.substring(DATA_PREFIX.length()).trim());
                if (payload.isPresent()) return payload;
            } else if (line.isEmpty() && !DONE.equals(kind)) {
                kind = "";
            }
        }
        return Optional.empty();
    }

    private Optional<JsonNode> parse(String data) {
        try {
            JsonNode node = objectMapper.readTree(data);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JacksonException e) {
            log.debug("Skipping unparseable done payload: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
