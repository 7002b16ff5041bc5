package com.wpanther.ticketbulkops.controller;

import com.wpanther.ticketbulkops.operation.ExportedFile;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

final class ExportResponses {

    private ExportResponses() {
    }

    static ResponseEntity<byte[]> download(ExportedFile file) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(file.getMimeType()));
        headers.setContentDisposition(ContentDisposition.attachment().filename(file.getFilename()).build());
        headers.setContentLength(file.getContent().length);
        return ResponseEntity.ok().headers(headers).body(file.getContent());
    }
}
