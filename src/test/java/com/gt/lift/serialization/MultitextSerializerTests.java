package com.gt.lift.serialization;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.lift.model.Field;
import com.gt.lift.model.Multitext;
import com.gt.lift.model.Trait;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MultitextSerializerTests {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void testSerializeKeepsOrder() throws Exception {
        Multitext multitext = Multitext.of("seh", "nyumba", "en", "house");

        assertEquals("{\"seh\":\"nyumba\",\"en\":\"house\"}", objectMapper.writeValueAsString(multitext));
        assertEquals("{}", objectMapper.writeValueAsString(Multitext.EMPTY));
    }

    @Test
    public void testSerializeInsideRecord() throws Exception {
        Field field = new Field("literal-meaning", Multitext.of("en", "dwelling"), List.of(new Trait("source", "speaker")));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(field));

        assertEquals("literal-meaning", json.get("type").asText());
        assertEquals("dwelling", json.get("content").get("en").asText());
        assertEquals("speaker", json.get("traits").get(0).get("value").asText());
    }

    @Test
    public void testDeserialize() throws Exception {
        Multitext multitext = objectMapper.readValue("{\"pt\":\"casa\",\"en\":\"house\"}", Multitext.class);

        assertEquals(Multitext.of("pt", "casa", "en", "house"), multitext);
        assertEquals("casa", multitext.first());
        assertSame(Multitext.EMPTY, objectMapper.readValue("{}", Multitext.class));
        assertSame(Multitext.EMPTY, objectMapper.readValue("null", Multitext.class));
    }

    @Test
    public void testDeserializeInvalidForms() {
        assertThrows(JsonMappingException.class, () -> objectMapper.readValue("{\"en\":null}", Multitext.class));
        assertThrows(JsonMappingException.class, () -> objectMapper.readValue("{\" \":\"blank\"}", Multitext.class));
    }
}
