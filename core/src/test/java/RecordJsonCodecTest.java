import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.json.RecordJsonException;
import io.github.flameyossnowy.associative.api.json.RecordJsonCodec;
import io.github.flameyossnowy.associative.api.meta.AttributeType;
import io.github.flameyossnowy.associative.api.meta.KindModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordJsonCodecTest {
    final KindModel playlists = KindModel.builder("playlists")
        .attribute("name", AttributeType.STRING)
        .optional("public", AttributeType.BOOLEAN)
        .build();

    final RecordJsonCodec codec = new RecordJsonCodec();

    @Test
    void writesIdentityFirstThenAttributesInSchemaOrder() {
        DataRecord record = new DataRecord(playlists, 3, playlists.validateInsert(Map.of("name", "Animals", "public", true)));

        assertEquals("{\"id\":3,\"name\":\"Animals\",\"public\":true}", codec.write(record));
    }

    @Test
    void prettyCodecIndentsOutput() {
        DataRecord record = new DataRecord(playlists, 1, playlists.validateInsert(Map.of("name", "Fruits")));

        String json = RecordJsonCodec.pretty().write(record);

        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"name\" : \"Fruits\""));
    }

    @Test
    void readsAttributeRows() {
        List<Map<String, Object>> rows = codec.readAttributes("[{\"name\": \"Animals\"}, {\"name\": \"Fruits\", \"public\": false}]");

        assertEquals(2, rows.size());
        assertEquals("Fruits", rows.get(1).get("name"));
        assertEquals(false, rows.get(1).get("public"));
    }

    @Test
    void malformedInputCarriesItsLocation() {
        RecordJsonException e = assertThrows(RecordJsonException.class, () -> codec.readAttributes("{\"name\": 1}"));

        assertNotNull(e.getLocation());
        assertNotNull(e.getCause());
    }
}
