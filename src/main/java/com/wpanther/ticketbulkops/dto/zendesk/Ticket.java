package com.wpanther.ticketbulkops.dto.zendesk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ticket as returned by the Zendesk tickets API
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Ticket {

    private Long id;

    private String subject;

    private String status;

    private String priority;

    private List<String> tags;

    // Only sent on update, asks Zendesk to apply these macros to the ticket
    @JsonProperty("macro_ids")
    private List<Long> macroIds;
}
