package com.wpanther.ticketbulkops.dto.zendesk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One macro action. The value may be a string, a number or an array depending on the field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MacroAction {

    private String field;

    private JsonNode value;

    /**
     * Value rendered as plain text, arrays joined with a space
     */
    public String valueAsText() {
        if (value == null || value.isNull()) {
            return "";
        }
        if (value.isArray()) {
            StringBuilder text = new StringBuilder();
            value.forEach(element -> {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(element.asText());
            });
            return text.toString();
        }
        return value.asText();
    }
}
