package com.wpanther.ticketbulkops.operation;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Rendered export ready to be sent as a download
 */
@Getter
@AllArgsConstructor
public class ExportedFile {

    private final byte[] content;

    private final String mimeType;

    private final String filename;
}
