package ai.contract.segmenter.writer;

import ai.contract.segmenter.segment.Clause;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Serializes clauses as a JSON array of flat records.
 */
public class ClauseJsonWriter implements ClauseWriter {

    private static final DefaultPrettyPrinter PRETTY_PRINTER = new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"));

    private final ObjectMapper objectMapper;

    public ClauseJsonWriter() {
        this(new ObjectMapper());
    }

    public ClauseJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String render(List<Clause> clauses) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Clause clause : clauses) {
            ObjectNode node = array.addObject();
            node.put("clause_id", clause.clauseId());
            node.put("section_id", clause.sectionId());
            node.put("section_heading", clause.sectionHeading().orElse(null));
            node.put("local_index", clause.localIndex());
            node.put("label", clause.label().orElse(null));
            node.put("text", clause.text());
        }
        try {
            return objectMapper.writer(PRETTY_PRINTER).writeValueAsString(array) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize clauses", ex);
        }
    }

    @Override
    public String fileExtension() {
        return "json";
    }
}
