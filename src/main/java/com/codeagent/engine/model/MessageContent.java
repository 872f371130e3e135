package com.codeagent.engine.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.IOException;
import java.util.List;

/**
 * Message body: either plain text or an ordered list of {@link ContentBlock}s.
 * On the wire it is untagged, a JSON string or a JSON array.
 */
@EqualsAndHashCode
@ToString
@JsonSerialize(using = MessageContent.Serializer.class)
@JsonDeserialize(using = MessageContent.Deserializer.class)
public final class MessageContent {

    private final String text;
    private final List<ContentBlock> blocks;

    private MessageContent(String text, List<ContentBlock> blocks) {
        this.text = text;
        this.blocks = blocks;
    }

    public static MessageContent text(String text) {
        return new MessageContent(text != null ? text : "", null);
    }

    public static MessageContent blocks(List<ContentBlock> blocks) {
        return new MessageContent(null, List.copyOf(blocks));
    }

    public boolean isText() {
        return blocks == null;
    }

    /** Plain text, or null for block content. */
    public String text() {
        return text;
    }

    /** Blocks, or an empty list for plain text. */
    public List<ContentBlock> blocks() {
        return blocks != null ? blocks : List.of();
    }

    static class Serializer extends JsonSerializer<MessageContent> {
        @Override
        public void serialize(MessageContent value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            if (value.isText()) {
                gen.writeString(value.text);
                return;
            }
            JavaType listType = provider.getTypeFactory()
                    .constructCollectionType(List.class, ContentBlock.class);
            provider.findTypedValueSerializer(listType, true, null)
                    .serialize(value.blocks, gen, provider);
        }
    }

    static class Deserializer extends JsonDeserializer<MessageContent> {
        @Override
        public MessageContent deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                return MessageContent.text(p.getText());
            }
            if (p.currentToken() == JsonToken.START_ARRAY) {
                JavaType listType = ctxt.getTypeFactory()
                        .constructCollectionType(List.class, ContentBlock.class);
                List<ContentBlock> blocks = ctxt.readValue(p, listType);
                return MessageContent.blocks(blocks);
            }
            return (MessageContent) ctxt.handleUnexpectedToken(MessageContent.class, p);
        }
    }
}
