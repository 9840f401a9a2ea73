package com.gt.lift.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.gt.lift.model.Multitext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;

@Component
public class MultitextDeserializer extends JsonDeserializer<Multitext> {

    private static final TypeReference<LinkedHashMap<String, String>> FORMS_TYPE = new TypeReference<>() { };

    @Override
    public Multitext deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        LinkedHashMap<String, String> forms = jsonParser.readValueAs(FORMS_TYPE);
        try {
            return Multitext.of(forms);
        } catch (IllegalArgumentException ex) {
            throw JsonMappingException.from(jsonParser, ex.getMessage(), ex);
        }
    }

    @Override
    public Multitext getNullValue(DeserializationContext deserializationContext) {
        return Multitext.EMPTY;
    }
}
