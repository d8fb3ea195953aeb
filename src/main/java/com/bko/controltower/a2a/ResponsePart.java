package com.bko.controltower.a2a;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * A part inside a response envelope. Some agents wrap the part one level deep, so the text is
 * either on the part itself or on its {@code root} wrapper.
 */
public record ResponsePart(@Nullable String text, @Nullable ResponsePart root) {

    public static ResponsePart ofText(String text) {
        return new ResponsePart(text, null);
    }

    public static ResponsePart wrapped(String text) {
        return new ResponsePart(null, ofText(text));
    }

    @Nullable
    public String resolvedText() {
        if (StringUtils.hasLength(text)) {
            return text;
        }
        return root != null ? root.resolvedText() : null;
    }
}
