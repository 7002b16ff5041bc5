package com.wpanther.ticketbulkops.operation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldOption {

    private String value;

    private String label;
}
