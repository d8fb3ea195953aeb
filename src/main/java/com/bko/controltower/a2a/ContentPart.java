package com.bko.controltower.a2a;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Base64;

/**
 * One part of an outbound message: either text or an inline binary file.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ContentPart.TextPart.class, name = "text"),
        @JsonSubTypes.Type(value = ContentPart.FilePart.class, name = "file")
})
public sealed interface ContentPart permits ContentPart.TextPart, ContentPart.FilePart {

    static ContentPart text(String text) {
        return new TextPart(text);
    }

    static ContentPart file(byte[] bytes, String mimeType) {
        return new FilePart(new FileContent(Base64.getEncoder().encodeToString(bytes), mimeType));
    }

    @JsonTypeName("text")
    record TextPart(String text) implements ContentPart {
    }

    @JsonTypeName("file")
    record FilePart(FileContent file) implements ContentPart {
    }

    /**
     * @param bytes base64 encoded content
     */
    record FileContent(String bytes, String mimeType) {
    }
}
