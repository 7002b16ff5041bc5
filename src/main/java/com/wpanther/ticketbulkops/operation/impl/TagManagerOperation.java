package com.wpanther.ticketbulkops.operation.impl;

import com.wpanther.ticketbulkops.batch.TicketMutation;
import com.wpanther.ticketbulkops.batch.TicketMutations;
import com.wpanther.ticketbulkops.client.TicketStoreClient;
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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.wpanther.ticketbulkops.util.ResultExportUtil.flag;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.joined;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.list;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.map;
import static com.wpanther.ticketbulkops.util.ResultExportUtil.string;

/**
 * Adds or removes tags on every ticket of a view
 */
@Component
public class TagManagerOperation implements BulkOperation {

    public static final String SLUG = "tag-manager";

    static final String FIELD_OPERATION = "operation";
    static final String FIELD_TAGS = "tags";

    private static final OperationDescriptor DESCRIPTOR = OperationDescriptor.builder()
            .name("Tag Manager")
            .slug(SLUG)
            .description("Add or remove tags from all tickets in a view")
            .category("Tags")
            .supportsAsync(true)
            .exportFormat(ResultExportUtil.FORMAT_CSV)
            .exportFormat(ResultExportUtil.FORMAT_JSON)
            .build();

    private final ViewBatchRunner runner;
    private final ResultExportUtil exportUtil;

    public TagManagerOperation(ViewBatchRunner runner, ResultExportUtil exportUtil) {
        this.runner = runner;
        this.exportUtil = exportUtil;
    }

    @Override
    public OperationDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public List<FormField> formSchema() {
        List<FieldOption> operations = new ArrayList<>();
        for (TagAction action : TagAction.values()) {
            operations.add(new FieldOption(action.getValue(), action.getLabel()));
        }

        return List.of(
                FormField.builder()
                        .name(FormInputs.VIEW_ID)
                        .label("Select View")
                        .type(FormField.TYPE_SELECT)
                        .required(true)
                        .options(runner.viewOptions())
                        .helpText("Choose the view containing tickets to modify")
                        .build(),
                FormField.builder()
                        .name(FIELD_OPERATION)
                        .label("Operation")
                        .type(FormField.TYPE_SELECT)
                        .required(true)
                        .options(operations)
                        .build(),
                FormField.builder()
                        .name(FIELD_TAGS)
                        .label("Tags")
                        .type(FormField.TYPE_TEXT)
                        .required(true)
                        .placeholder("tag1, tag2, tag3")
                        .helpText("Enter tags separated by commas")
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
        String error = FormInputs.checkIdSelection(input, FormInputs.VIEW_ID, "Please select a view",
                "Unable to load views. Please check your Zendesk configuration.");
        if (error != null) {
            return ValidationResult.invalid(error);
        }
        if (TagAction.fromValue(input.get(FIELD_OPERATION)).isEmpty()) {
            return ValidationResult.invalid("Please select a valid operation (add or remove)");
        }
        if (FormInputs.parseTags(input.get(FIELD_TAGS)).isEmpty()) {
            return ValidationResult.invalid("Please enter at least one tag");
        }
        error = FormInputs.checkTicketLimit(input, itemCeiling(true),
                "Ticket limit cannot exceed 50,000. Please process in smaller batches.");
        if (error != null) {
            return ValidationResult.invalid(error);
        }
        return ValidationResult.ok();
    }

    @Override
    public OperationResult execute(Map<String, String> input) {
        ValidationResult validation = validate(input);
        if (!validation.isValid()) {
            return OperationResult.failure(validation.getError());
        }
        long viewId = Long.parseLong(FormInputs.text(input, FormInputs.VIEW_ID));
        return runner.runInline(viewId, FormInputs.requestedItems(input), FormInputs.isDryRun(input),
                new TagChange(input));
    }

    @Override
    public OperationResult executeAsync(Map<String, String> input, String externalId, String ownerId) {
        ValidationResult validation = validate(input);
        if (!validation.isValid()) {
            return OperationResult.failure(validation.getError());
        }
        long viewId = Long.parseLong(FormInputs.text(input, FormInputs.VIEW_ID));
        return runner.startJob(SLUG, viewId, FormInputs.requestedItems(input), new TagChange(input),
                externalId, ownerId);
    }

    @Override
    public ExportedFile export(OperationResult result, String format) {
        Map<String, Object> data = result.getData();
        String filename = "tag_manager_" + string(data, "view_id", "unknown");

        if (ResultExportUtil.FORMAT_JSON.equals(format)) {
            return exportUtil.json(data, filename + ".json");
        }
        if (!ResultExportUtil.FORMAT_CSV.equals(format)) {
            throw new UnsupportedExportFormatException(format);
        }

        boolean dryRun = flag(data, "dry_run");
        return exportUtil.csv(printer -> {
            printer.printRecord("Tag Manager Report");
            printer.printRecord("View", string(data, "view_name", "N/A"));
            printer.printRecord("Operation", string(data, FIELD_OPERATION, "N/A"));
            printer.printRecord("Tags", joined(data.get(FIELD_TAGS)));
            printer.printRecord("Dry Run", dryRun ? "Yes" : "No");
            printer.printRecord("Total Tickets", string(data, "total_tickets", "0"));
            if (!dryRun) {
                printer.printRecord("Successful", string(data, "successful", "0"));
                printer.printRecord("Failed", string(data, "failed", "0"));
            }
            printer.println();

            if (dryRun) {
                printer.printRecord("Ticket ID", "Subject", "Status", "Current Tags");
                for (Object row : list(data, "tickets")) {
                    Map<String, Object> ticket = map(row);
                    printer.printRecord(ticket.get("id"), ticket.get("subject"), ticket.get("status"),
                            joined(ticket.get("current_tags")));
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

    /**
     * Tag change parsed from a validated form
     */
    private static final class TagChange implements ViewBatchAction {

        private final TagAction action;
        private final List<String> tags;

        TagChange(Map<String, String> input) {
            this.action = TagAction.fromValue(input.get(FIELD_OPERATION))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown tag operation"));
            this.tags = FormInputs.parseTags(input.get(FIELD_TAGS));
        }

        @Override
        public Map<String, Object> describe(TicketStoreClient client) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(FIELD_OPERATION, action.getValue());
            fields.put(FIELD_TAGS, tags);
            return fields;
        }

        @Override
        public TicketMutation mutation(TicketStoreClient client) {
            return action == TagAction.ADD
                    ? TicketMutations.addTags(client, tags)
                    : TicketMutations.removeTags(client, tags);
        }

        @Override
        public Map<String, Object> preview(Ticket ticket) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", ticket.getId());
            row.put("subject", ticket.getSubject());
            row.put("status", ticket.getStatus());
            row.put("current_tags", ticket.getTags() != null ? ticket.getTags() : List.of());
            return row;
        }

        @Override
        public String successMessage(int updated, String viewName) {
            return "Successfully " + action.getPastTense() + " tags " + action.getPreposition() + " "
                    + updated + " ticket(s) in view \"" + viewName + "\".";
        }

        @Override
        public String partialMessage(int updated, int failed) {
            String verb = action.getPastTense();
            return Character.toUpperCase(verb.charAt(0)) + verb.substring(1) + " tags "
                    + action.getPreposition() + " " + updated + " ticket(s). " + failed + " ticket(s) failed.";
        }
    }
}
