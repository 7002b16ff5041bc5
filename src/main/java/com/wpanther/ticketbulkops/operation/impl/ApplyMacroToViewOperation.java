package com.wpanther.ticketbulkops.operation.impl;

import com.wpanther.ticketbulkops.batch.TicketMutation;
import com.wpanther.ticketbulkops.batch.TicketMutations;
import com.wpanther.ticketbulkops.client.TicketStoreClient;
import com.wpanther.ticketbulkops.client.TicketStoreClientProvider;
import com.wpanther.ticketbulkops.dto.zendesk.Macro;
import com.wpanther.ticketbulkops.dto.zendesk.Ticket;
import com.wpanther.ticketbulkops.exception.UnsupportedExportFormatException;
import com.wpanther.ticketbulkops.operation.BulkOperation;
import com.wpanther.ticketbulkops.operation.ExportedFile;
import com.wpanther.ticketbulkops.operation.FieldOption;
import com.wpanther.ticketbulkops.operation.FormField;
import com.wpanther.ticketbulkops.operation.FormInputs;
import com.wpanther.ticketbulkops.operation.OperationDescriptor;
import com.wpanther.ticketbulkops.operation.OperationResult;
import com.wpanther.ticketbulkops.operation.ValidationResult;
import com.wpanther.ticketbulkops.util.ResultExportUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.wpanther.ticketbulkops.util.ResultExportUtil.flag;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.list;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.map;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.string;

/**
 * Applies one macro to every ticket of a view. Restricted to administrators.
 */
@Component
@Slf4j
public class ApplyMacroToViewOperation implements BulkOperation {

    public static final String SLUG = "apply-macro-to-view";

    static final String FIELD_MACRO_ID = "macro_id";

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.builder()
            .name("Apply Macro to View")
            .slug(SLUG)
            .description("Apply a macro to all tickets in a view")
            .category("Macros")
            .adminOnly(true)
            .supportsAsync(true)
            .exportFormat(ResultExportUtil.FORMAT_CSV)
            .exportFormat(ResultExportUtil.FORMAT_JSON)
            .build();

    private final ViewBatchRunner runner;
    private final TicketStoreClientProvider clientProvider;
    private final ResultExportUtil exportUtil;

    public ApplyMacroToViewOperation(ViewBatchRunner runner, TicketStoreClientProvider clientProvider,
                                     ResultExportUtil exportUtil) {
        this.runner = runner;
        this.clientProvider = clientProvider;
        this.exportUtil = exportUtil;
    }

    @Override
    public OperationDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public List<FormField> formSchema() {
        return List.of(
                FormField.builder()
                        .name(FIELD_MACRO_ID)
                        .label("Select Macro")
                        .type(FormField.TYPE_SELECT)
                        .required(true)
                        .options(macroOptions())
                        .helpText("Choose the macro to apply")
                        .build(),
                FormField.builder()
                        .name(FormInputs.VIEW_ID)
                        .label("Select View")
                        .type(FormField.TYPE_SELECT)
                        .required(true)
                        .options(runner.viewOptions())
                        .helpText("Choose the view containing tickets to update")
                        .build(),
                FormField.builder()
                        .name(FormInputs.TICKET_LIMIT)
                        .label("Ticket Limit")
                        .type(FormField.TYPE_NUMBER)
                        .required(true)
                        .placeholder("100")
                        .helpText("Maximum number of tickets to process (max 50,000). "
                                + "Jobs over 500 tickets run in the background.")
                        .build(),
                FormField.builder()
                        .name(FormInputs.DRY_RUN)
                        .label("Dry Run (preview only, no changes)")
                        .type(FormField.TYPE_CHECKBOX)
                        .required(false)
                        .helpText("Preview which tickets would be affected without making changes")
                        .build());
    }

    @Override
    public ValidationResult validate(Map<String, String> input) {
        String error = FormInputs.checkIdSelection(input, FIELD_MACRO_ID, "Please select a macro",
                "Unable to load macros. Please check your Zendesk configuration.");
        if (error == null) {
            error = FormInputs.checkIdSelection(input, FormInputs.VIEW_ID, "Please select a view",
                    "Unable to load views. Please check your Zendesk configuration.");
        }
        if (error == null) {
            error = FormInputs.checkTicketLimit(input, itemCeiling(true),
                    "Ticket limit cannot exceed 50,000. Please process in smaller batches.");
        }
        return error == null ? ValidationResult.ok() : ValidationResult.invalid(error);
    }

    @Override
    public OperationResult execute(Map<String, String> input) {
        ValidationResult validation = validate(input);
        if (!validation.isValid()) {
            return OperationResult.failure(validation.getError());
        }
        long viewId = Long.parseLong(FormInputs.text(input, FormInputs.VIEW_ID));
        return runner.runInline(viewId, FormInputs.requestedItems(input), FormInputs.isDryRun(input),
                new MacroApplication(Long.parseLong(FormInputs.text(input, FIELD_MACRO_ID))));
    }

    @Override
    public OperationResult executeAsync(Map<String, String> input, String externalId, String ownerId) {
        ValidationResult validation = validate(input);
        if (!validation.isValid()) {
            return OperationResult.failure(validation.getError());
        }
        long viewId = Long.parseLong(FormInputs.text(input, FormInputs.VIEW_ID));
        return runner.startJob(SLUG, viewId, FormInputs.requestedItems(input),
                new MacroApplication(Long.parseLong(FormInputs.text(input, FIELD_MACRO_ID))),
                externalId, ownerId);
    }

    @Override
    public ExportedFile export(OperationResult result, String format) {
        Map<String, Object> data = result.getData();
        String filename = "apply_macro_" + string(data, "view_id", "unknown");

        if (ResultExportUtil.FORMAT_JSON.equals(format)) {
            return exportUtil.json(data, filename + ".json");
        }
        if (!ResultExportUtil.FORMAT_CSV.equals(format)) {
            throw new UnsupportedExportFormatException(format);
        }

        boolean dryRun = flag(data, "dry_run");
        return exportUtil.csv(printer -> {
            printer.printRecord("Apply Macro Report");
            printer.printRecord("Macro", string(data, "macro_name", "N/A"));
            printer.printRecord("View", string(data, "view_name", "N/A"));
            printer.printRecord("Dry Run", dryRun ? "Yes" : "No");
            printer.printRecord("Total Tickets", string(data, "total_tickets", "0"));
            if (!dryRun) {
                printer.printRecord("Successful", string(data, "successful", "0"));
                printer.printRecord("Failed", string(data, "failed", "0"));
            }
            printer.println();

            if (dryRun) {
                printer.printRecord("Ticket ID", "Subject", "Status", "Priority");
                for (Object row : list(data, "tickets")) {
                    Map<String, Object> ticket = map(row);
                    printer.printRecord(ticket.get("id"), ticket.get("subject"), ticket.get("status"),
                            ticket.get("priority"));
                }
            } else {
                printer.printRecord("Ticket ID", "Result");
                for (Object id : list(data, "successful_tickets")) {
                    printer.printRecord(id, "Success");
                }
                for (Object id : list(data, "failed_tickets")) {
                    printer.printRecord(id, "Failed");
                }
                List<?> errors = list(data, "errors");
                if (!errors.isEmpty()) {
                    printer.println();
                    printer.printRecord("Errors");
                    for (Object error : errors) {
                        printer.printRecord(error);
                    }
                }
            }
        }, filename + ".csv");
    }

    // Only active macros can be applied
    private List<FieldOption> macroOptions() {
        try {
            return clientProvider.requireClient().getMacros().stream()
                    .filter(Macro::isActive)
                    .map(macro -> new FieldOption(String.valueOf(macro.getId()), macro.getTitle()))
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.warn("Could not load macros: {}", e.getMessage());
            return List.of(new FieldOption(FormInputs.ERROR_OPTION, "Error loading macros: " + e.getMessage()));
        }
    }

    private static final class MacroApplication implements ViewBatchAction {

        private final long macroId;
        private String macroName = "Unknown Macro";

        MacroApplication(long macroId) {
            this.macroId = macroId;
        }

        @Override
        public Map<String, Object> describe(TicketStoreClient client) {
            macroName = client.getMacros().stream()
                    .filter(macro -> macro.getId() != null && macro.getId() == macroId)
                    .map(Macro::getTitle)
                    .findFirst()
                    .orElse("Unknown Macro");

            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(FIELD_MACRO_ID, macroId);
            fields.put("macro_name", macroName);
            return fields;
        }

        @Override
        public TicketMutation mutation(TicketStoreClient client) {
            return TicketMutations.applyMacro(client, macroId);
        }

        @Override
        public Map<String, Object> preview(Ticket ticket) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", ticket.getId());
            row.put("subject", ticket.getSubject());
            row.put("status", ticket.getStatus());
            row.put("priority", ticket.getPriority());
            return row;
        }

        @Override
        public String successMessage(int updated, String viewName) {
            return "Successfully applied macro \"" + macroName + "\" to " + updated
                    + " ticket(s) in view \"" + viewName + "\".";
        }

        @Override
        public String partialMessage(int updated, int failed) {
            return "Applied macro to " + updated + " ticket(s). " + failed + " ticket(s) failed.";
        }
    }
}
