package com.gt.lift.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.lift.model.Multitext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

// {"en": "cat", "fr": "chat"}, in insertion order
@Component
public class MultitextSerializer extends JsonSerializer<Multitext> {
    @Override
    public void serialize(Multitext multitext, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeStartObject();
        for (Map.Entry<String, String> form : multitext.asMap().entrySet()) {
            jsonGenerator.writeStringField(form.getKey(), form.getValue());
        }
        jsonGenerator.writeEndObject();
    }

    @Override
    public boolean isEmpty(SerializerProvider provider, Multitext multitext) {
        return multitext == null || multitext.isEmpty();
    }
}
