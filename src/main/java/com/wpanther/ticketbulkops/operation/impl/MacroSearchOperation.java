package com.wpanther.ticketbulkops.operation.impl;

import com.wpanther.ticketbulkops.client.TicketStoreClient;
import com.wpanther.ticketbulkops.client.TicketStoreClientProvider;
import com.wpanther.ticketbulkops.dto.zendesk.Macro;
import com.wpanther.ticketbulkops.dto.zendesk.MacroAction;
import com.wpanther.ticketbulkops.exception.UnsupportedExportFormatException;
import com.wpanther.ticketbulkops.operation.BulkOperation;
import com.wpanther.ticketbulkops.operation.ExportedFile;
import com.wpanther.ticketbulkops.operation.FormField;
import com.wpanther.ticketbulkops.operation.FormInputs;
import com.wpanther.ticketbulkops.operation.OperationDescriptor;
import com.wpanther.ticketbulkops.operation.OperationResult;
import com.wpanther.ticketbulkops.operation.ValidationResult;
import com.wpanther.ticketbulkops.util.ResultExportUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.wpanther.ticketbulkops.util.ResultExportUtil.list;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.map;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.string;

/**
 * Read-only search for macros whose actions mention a piece of text
 */
@Component
@Slf4j
public class MacroSearchOperation implements BulkOperation {

    public static final String SLUG = "macro-search";

    static final String FIELD_SEARCH_TERM = "search_term";

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.builder()
            .name("Search Macros")
            .slug(SLUG)
            .description("Find macros that contain a substring in any of their actions")
            .category("Macros")
            .exportFormat(ResultExportUtil.FORMAT_CSV)
            .exportFormat(ResultExportUtil.FORMAT_JSON)
            .build();

    private final TicketStoreClientProvider clientProvider;
    private final ResultExportUtil exportUtil;

    public MacroSearchOperation(TicketStoreClientProvider clientProvider, ResultExportUtil exportUtil) {
        this.clientProvider = clientProvider;
        this.exportUtil = exportUtil;
    }

    @Override
    public OperationDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public List<FormField> formSchema() {
        return List.of(FormField.builder()
                .name(FIELD_SEARCH_TERM)
                .label("Search Term")
                .type(FormField.TYPE_TEXT)
                .required(true)
                .placeholder("Enter text to search for...")
                .helpText("This will search within all macro actions. Case-insensitive.")
                .build());
    }

    @Override
    public ValidationResult validate(Map<String, String> input) {
        String term = FormInputs.text(input, FIELD_SEARCH_TERM);
        if (term.isEmpty()) {
            return ValidationResult.invalid("Search term is required");
        }
        if (term.length() < 2) {
            return ValidationResult.invalid("Search term must be at least 2 characters");
        }
        return ValidationResult.ok();
    }

    @Override
    public OperationResult execute(Map<String, String> input) {
        ValidationResult validation = validate(input);
        if (!validation.isValid()) {
            return OperationResult.failure(validation.getError());
        }
        String term = FormInputs.text(input, FIELD_SEARCH_TERM);

        try {
            TicketStoreClient client = clientProvider.requireClient();
            List<Map<String, Object>> macros = search(client, term);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put(FIELD_SEARCH_TERM, term);
            data.put("count", macros.size());
            data.put("macros", macros);
            return OperationResult.success("Found " + macros.size() + " macro(s) matching \"" + term + "\"", data);

        } catch (RuntimeException e) {
            log.error("Macro search for '{}' failed", term, e);
            return OperationResult.failure("Search failed: " + e.getMessage());
        }
    }

    @Override
    public ExportedFile export(OperationResult result, String format) {
        Map<String, Object> data = result.getData();
        List<?> macros = list(data, "macros");
        String term = string(data, FIELD_SEARCH_TERM, "macros");
        String filename = "macro_search_" + term.replaceAll("[^A-Za-z0-9_-]", "_");

        if (ResultExportUtil.FORMAT_JSON.equals(format)) {
            Map<String, Object> document = new LinkedHashMap<>();
            document.put(FIELD_SEARCH_TERM, term);
            document.put("count", macros.size());
            document.put("macros", macros);
            return exportUtil.json(document, filename + ".json");
        }
        if (!ResultExportUtil.FORMAT_CSV.equals(format)) {
            throw new UnsupportedExportFormatException(format);
        }

        return exportUtil.csv(printer -> {
            printer.printRecord("Macro ID", "Title", "Active", "Matching Actions", "URL");
            for (Object row : macros) {
                Map<String, Object> macro = map(row);
                List<String> actions = new ArrayList<>();
                for (Object action : list(macro, "matching_actions")) {
                    Map<String, Object> fields = map(action);
                    actions.add(fields.get("field") + ": " + fields.get("value"));
                }
                printer.printRecord(macro.get("id"), macro.get("title"),
                        Boolean.TRUE.equals(macro.get("active")) ? "Yes" : "No",
                        String.join("; ", actions), macro.get("url"));
            }
        }, filename + ".csv");
    }

    /**
     * Macros with at least one action whose field or value contains the term, ignoring case
     */
    List<Map<String, Object>> search(TicketStoreClient client, String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        List<Map<String, Object>> results = new ArrayList<>();

        for (Macro macro : client.getMacros()) {
            if (macro.getActions() == null) {
                continue;
            }
            List<Map<String, Object>> matching = new ArrayList<>();
            for (MacroAction action : macro.getActions()) {
                String field = action.getField() != null ? action.getField() : "unknown";
                String value = action.valueAsText();
                if (field.toLowerCase(Locale.ROOT).contains(needle) || value.toLowerCase(Locale.ROOT).contains(needle)) {
                    Map<String, Object> match = new LinkedHashMap<>();
                    match.put("field", field);
                    match.put("value", value);
                    matching.add(match);
                }
            }
            if (!matching.isEmpty()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", macro.getId());
                entry.put("title", macro.getTitle());
                entry.put("active", macro.isActive());
                entry.put("matching_actions", matching);
                entry.put("url", "https://" + client.getSubdomain() + ".zendesk.com/admin/macros/" + macro.getId());
                results.add(entry);
            }
        }
        return results;
    }
}
