package com.wpanther.ticketbulkops.operation.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.ticketbulkops.batch.BatchExecutor;
import com.wpanther.ticketbulkops.client.TicketStoreClient;
import com.wpanther.ticketbulkops.client.TicketStoreClientProvider;
import com.wpanther.ticketbulkops.dto.zendesk.Ticket;
import com.wpanther.ticketbulkops.dto.zendesk.View;
import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.exception.RemoteApiException;
import com.wpanther.ticketbulkops.exception.TaskSubmissionException;
import com.wpanther.ticketbulkops.exception.TicketStoreConfigurationException;
import com.wpanther.ticketbulkops.exception.UnsupportedExportFormatException;
import com.wpanther.ticketbulkops.operation.ExportedFile;
import com.wpanther.ticketbulkops.operation.FormField;
import com.wpanther.ticketbulkops.operation.OperationResult;
import com.wpanther.ticketbulkops.service.BulkJobWorker;
import com.wpanther.ticketbulkops.service.JobService;
import com.wpanther.ticketbulkops.util.ResultExportUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TagManagerOperation
 */
@ExtendWith(MockitoExtension.class)
class TagManagerOperationTest {

    @Mock
    private TicketStoreClientProvider clientProvider;

    @Mock
    private TicketStoreClient client;

    @Mock
    private JobService jobService;

    @Mock
    private BulkJobWorker worker;

    private final List<Duration> sleeps = new ArrayList<>();

    private TagManagerOperation operation;

    @BeforeEach
    void setUp() {
        ViewBatchRunner runner = new ViewBatchRunner(clientProvider, new BatchExecutor(sleeps::add), jobService, worker);
        ReflectionTestUtils.setField(runner, "itemDelayMs", 0L);
        operation = new TagManagerOperation(runner, new ResultExportUtil(new ObjectMapper()));
    }

    @Test
    void testDescriptor() {
        assertThat(operation.slug()).isEqualTo("tag-manager");
        assertThat(operation.descriptor().getCategory()).isEqualTo("Tags");
        assertThat(operation.descriptor().isAdminOnly()).isFalse();
        assertThat(operation.supportsAsync()).isTrue();
        assertThat(operation.exportFormats()).containsExactlyInAnyOrder("csv", "json");
    }

    @Test
    void testValidate_Messages() {
        assertThat(operation.validate(Map.of()).getError()).isEqualTo("Please select a view");
        assertThat(operation.validate(Map.of("view_id", "error")).getError())
                .isEqualTo("Unable to load views. Please check your Zendesk configuration.");
        assertThat(operation.validate(Map.of("view_id", "10", "operation", "rename")).getError())
                .isEqualTo("Please select a valid operation (add or remove)");
        assertThat(operation.validate(Map.of("view_id", "10", "operation", "add", "tags", " , ")).getError())
                .isEqualTo("Please enter at least one tag");
        assertThat(operation.validate(input("add", "urgent", "50001")).getError())
                .isEqualTo("Ticket limit cannot exceed 50,000. Please process in smaller batches.");
        assertThat(operation.validate(input("remove", "urgent", "50000")).isValid()).isTrue();
    }

    @Test
    void testFormSchema_ViewLoadFailureBecomesErrorOption() {
        // Arrange
        when(clientProvider.requireClient()).thenThrow(new TicketStoreConfigurationException("Zendesk client not configured"));

        // Act
        List<FormField> fields = operation.formSchema();

        // Assert
        FormField viewField = fields.get(0);
        assertThat(viewField.getName()).isEqualTo("view_id");
        assertThat(viewField.getOptions()).hasSize(1);
        assertThat(viewField.getOptions().get(0).getValue()).isEqualTo("error");
        assertThat(fields).extracting(FormField::getName)
                .containsExactly("view_id", "operation", "tags", "ticket_limit", "dry_run");
    }

    @Test
    void testExecute_DryRunNeverMutates() {
        // Arrange
        stubView(ticket(1L, "vip"), ticket(2L), ticket(3L));
        Map<String, String> input = input("add", "urgent", "3");
        input.put("dry_run", "on");

        // Act
        OperationResult result = operation.execute(input);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage())
                .isEqualTo("DRY RUN: Found 3 ticket(s) in view \"Support\". No changes were made.");
        assertThat(result.getData()).containsEntry("dry_run", true).containsEntry("total_tickets", 3);
        assertThat((List<?>) result.getData().get("tickets")).hasSize(3);
        verify(client, never()).getTicket(anyLong());
        verify(client, never()).updateTicket(any());
    }

    @Test
    void testExecute_AddsTagsToEveryTicket() {
        // Arrange
        stubView(ticket(1L), ticket(2L), ticket(3L));
        when(client.getTicket(anyLong())).thenAnswer(invocation -> ticket(invocation.<Long>getArgument(0)));

        // Act
        OperationResult result = operation.execute(input("add", "urgent", "3"));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Successfully added tags to 3 ticket(s) in view \"Support\".");
        assertThat(result.getData())
                .containsEntry("successful", 3)
                .containsEntry("failed", 0)
                .containsEntry("operation", "add")
                .containsEntry("tags", List.of("urgent"));
    }

    @Test
    void testExecute_PartialFailure() {
        // Arrange
        stubView(ticket(1L), ticket(2L));
        when(client.getTicket(anyLong())).thenAnswer(invocation -> ticket(invocation.<Long>getArgument(0), "urgent"));
        when(client.updateTicket(any(Ticket.class))).thenAnswer(invocation -> {
            Ticket update = invocation.getArgument(0);
            if (update.getId() == 2L) {
                throw new RemoteApiException(422, "Zendesk API returned HTTP 422: closed");
            }
            return update;
        });

        // Act
        OperationResult result = operation.execute(input("remove", "urgent", "2"));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Removed tags from 1 ticket(s). 1 ticket(s) failed.");
        assertThat(result.getData()).containsEntry("failed_tickets", List.of(2L));
    }

    @Test
    void testExecute_EmptyView() {
        // Arrange
        when(clientProvider.requireClient()).thenReturn(client);
        when(client.getViewTickets(10L, 5)).thenReturn(List.of());

        // Act
        OperationResult result = operation.execute(input("add", "urgent", "5"));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("No tickets found in the selected view.");
        assertThat(result.getData()).containsEntry("total_tickets", 0).containsEntry("processed", 0);
    }

    @Test
    void testExecute_ClientNotConfigured() {
        // Arrange
        when(clientProvider.requireClient()).thenThrow(new TicketStoreConfigurationException("Zendesk client not configured"));

        // Act
        OperationResult result = operation.execute(input("add", "urgent", "5"));

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Error: Zendesk client not configured");
    }

    @Test
    void testExecute_InvalidInputReportedNotThrown() {
        OperationResult result = operation.execute(Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Please select a view");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testExecuteAsync_SubmitsJobWithTicketSnapshot() {
        // Arrange
        stubView(ticket(1L), ticket(2L), ticket(3L));
        Job job = Job.create("ext-1", "tag-manager", 3, "owner-1");
        ReflectionTestUtils.setField(job, "id", 77L);
        when(jobService.submitJob(eq("ext-1"), eq("tag-manager"), eq(3), eq("owner-1"), any(Runnable.class)))
                .thenReturn(job);

        // Act
        OperationResult result = operation.executeAsync(input("add", "urgent", "3"), "ext-1", "owner-1");

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.hasJob()).isTrue();
        assertThat(result.getJobId()).isEqualTo("ext-1");
        assertThat(result.getJobDbId()).isEqualTo(77L);
        assertThat(result.getMessage()).isEqualTo("Job started. Processing 3 tickets in the background...");

        ArgumentCaptor<Runnable> work = ArgumentCaptor.forClass(Runnable.class);
        verify(jobService).submitJob(eq("ext-1"), eq("tag-manager"), eq(3), eq("owner-1"), work.capture());
        work.getValue().run();

        ArgumentCaptor<Map<String, Object>> context = ArgumentCaptor.forClass(Map.class);
        verify(worker).run(eq("ext-1"), eq(List.of(1L, 2L, 3L)), any(), context.capture());
        assertThat(context.getValue())
                .containsEntry("view_name", "Support")
                .containsEntry("operation", "add")
                .containsEntry("tags", List.of("urgent"))
                .containsEntry("dry_run", false);
        verify(client, never()).updateTicket(any());
    }

    @Test
    void testExecuteAsync_QueueRefusalReportedAsFailure() {
        // Arrange
        stubView(ticket(1L));
        when(jobService.submitJob(eq("ext-2"), eq("tag-manager"), eq(1), eq("owner-1"), any(Runnable.class)))
                .thenThrow(new TaskSubmissionException("Task queue is full, try again later", null));

        // Act
        OperationResult result = operation.executeAsync(input("add", "urgent", "1"), "ext-2", "owner-1");

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.hasJob()).isFalse();
        assertThat(result.getMessage()).contains("Task queue is full");
    }

    @Test
    void testExport_CsvOfCompletedRun() {
        // Arrange
        Map<String, Object> data = new HashMap<>();
        data.put("view_id", 10L);
        data.put("view_name", "Support");
        data.put("operation", "add");
        data.put("tags", List.of("urgent"));
        data.put("dry_run", false);
        data.put("total_tickets", 2);
        data.put("successful", 1);
        data.put("failed", 1);
        data.put("successful_tickets", List.of(1L));
        data.put("failed_tickets", List.of(2L));
        data.put("errors", List.of("Ticket 2: closed"));

        // Act
        ExportedFile file = operation.export(OperationResult.success("done", data), "csv");

        // Assert
        String csv = new String(file.getContent(), StandardCharsets.UTF_8);
        assertThat(file.getFilename()).isEqualTo("tag_manager_10.csv");
        assertThat(file.getMimeType()).isEqualTo("text/csv");
        assertThat(csv).contains("Tag Manager Report", "View,Support", "Tags,urgent", "Dry Run,No",
                "Ticket ID,Result", "1,Success", "2,Failed", "Ticket 2: closed");
    }

    @Test
    void testExport_CsvOfDryRun() {
        // Arrange
        Map<String, Object> row = new HashMap<>();
        row.put("id", 1L);
        row.put("subject", "Printer broken");
        row.put("status", "open");
        row.put("current_tags", List.of("vip"));
        Map<String, Object> data = new HashMap<>();
        data.put("view_id", 10L);
        data.put("dry_run", true);
        data.put("tickets", List.of(row));

        // Act
        ExportedFile file = operation.export(OperationResult.success("preview", data), "csv");

        // Assert
        String csv = new String(file.getContent(), StandardCharsets.UTF_8);
        assertThat(csv).contains("Dry Run,Yes", "Ticket ID,Subject,Status,Current Tags", "1,Printer broken,open,vip");
        assertThat(csv).doesNotContain("Successful");
    }

    @Test
    void testExport_Json() {
        // Arrange
        Map<String, Object> data = Map.of("view_id", 10L, "successful", 3);

        // Act
        ExportedFile file = operation.export(OperationResult.success("done", data), "json");

        // Assert
        assertThat(file.getFilename()).isEqualTo("tag_manager_10.json");
        assertThat(file.getMimeType()).isEqualTo("application/json");
        assertThat(new String(file.getContent(), StandardCharsets.UTF_8)).contains("\"successful\" : 3");
    }

    @Test
    void testExport_UnsupportedFormat() {
        OperationResult result = OperationResult.success("done", Map.of("view_id", 10L));

        assertThatThrownBy(() -> operation.export(result, "xml"))
                .isInstanceOf(UnsupportedExportFormatException.class);
    }

    private void stubView(Ticket... tickets) {
        when(clientProvider.requireClient()).thenReturn(client);
        when(client.getViewTickets(10L, tickets.length)).thenReturn(List.of(tickets));
        when(client.getViews()).thenReturn(List.of(new View(10L, "Support", true), new View(11L, "Billing", true)));
    }

    private static Map<String, String> input(String action, String tags, String limit) {
        Map<String, String> input = new HashMap<>();
        input.put("view_id", "10");
        input.put("operation", action);
        input.put("tags", tags);
        input.put("ticket_limit", limit);
        return input;
    }

    private static Ticket ticket(long id, String... tags) {
        return Ticket.builder().id(id).subject("Ticket " + id).status("open").tags(List.of(tags)).build();
    }
}
