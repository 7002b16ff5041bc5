package com.wpanther.ticketbulkops.dto;

import com.wpanther.ticketbulkops.operation.FormField;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Operation metadata together with the form a caller has to fill in
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OperationDetailResponse {

    private OperationSummaryResponse operation;

    private List<FormField> fields;
}
