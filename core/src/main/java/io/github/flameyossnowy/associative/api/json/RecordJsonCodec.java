package io.github.flameyossnowy.associative.api.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.json.JsonLocation;
import io.github.flameyossnowy.associative.api.exceptions.json.RecordJsonException;
import io.github.flameyossnowy.associative.api.meta.KindModel;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Jackson-backed rendering of records for reports, and parsing of attribute
 * objects for seeding a store.
 * <p>
 * A record renders as {@code {"id": 1, "title": "Cat", ...}}, attributes in schema order.
 */
public class RecordJsonCodec {
    private static final TypeReference<List<Map<String, Object>>> ATTRIBUTE_LIST = new TypeReference<>() {};

    private final Logger logger = LoggerFactory.getLogger(RecordJsonCodec.class);
    private final ObjectMapper mapper;

    public RecordJsonCodec() {
        this(new ObjectMapper());
    }

    public RecordJsonCodec(@NotNull ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static RecordJsonCodec pretty() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return new RecordJsonCodec(mapper);
    }

    public @NotNull ObjectNode toTree(@NotNull DataRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put(KindModel.ID, record.id());
        for (Map.Entry<String, Object> entry : record.attributes().entrySet()) {
            node.set(entry.getKey(), mapper.valueToTree(entry.getValue()));
        }
        return node;
    }

    public @NotNull String write(@NotNull DataRecord record) {
        return writeTree(toTree(record));
    }

    public @NotNull String write(@NotNull Collection<DataRecord> records) {
        ArrayNode array = mapper.createArrayNode();
        for (DataRecord record : records) {
            array.add(toTree(record));
        }
        return writeTree(array);
    }

    /**
     * Parses a JSON array of attribute objects, one object per record to insert.
     */
    public @NotNull List<Map<String, Object>> readAttributes(@NotNull String json) {
        try {
            List<Map<String, Object>> rows = mapper.readValue(json, ATTRIBUTE_LIST);
            logger.debug("Read {} attribute rows from JSON", rows.size());
            return rows;
        } catch (JsonProcessingException e) {
            throw new RecordJsonException(e.getOriginalMessage(), e, JsonLocation.from(e.getLocation()));
        }
    }

    private String writeTree(Object tree) {
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new RecordJsonException(e.getOriginalMessage(), e, JsonLocation.from(e.getLocation()));
        }
    }
}
