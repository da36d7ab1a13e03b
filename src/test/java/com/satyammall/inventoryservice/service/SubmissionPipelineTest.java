package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.exception.InsufficientStockException;
import com.satyammall.inventoryservice.exception.MissingFieldException;
import com.satyammall.inventoryservice.model.Attachment;
import com.satyammall.inventoryservice.model.CommonFields;
import com.satyammall.inventoryservice.model.InventoryItem;
import com.satyammall.inventoryservice.model.InventorySnapshot;
import com.satyammall.inventoryservice.model.LineItem;
import com.satyammall.inventoryservice.model.OperationKind;
import com.satyammall.inventoryservice.model.ProgressSignal;
import com.satyammall.inventoryservice.model.SubmissionForm;
import com.satyammall.inventoryservice.model.SubmissionOutcome;
import com.satyammall.inventoryservice.model.SubmissionResult;
import com.satyammall.inventoryservice.model.TransactionRequest;
import com.satyammall.inventoryservice.model.UploadResult;
import com.satyammall.inventoryservice.repository.AttachmentStore;
import com.satyammall.inventoryservice.repository.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubmissionPipelineTest {

    @Mock
    private InventoryService inventoryService;
    @Mock
    private TransactionRepository transactionRepository;
    @Mock
    private AttachmentStore attachmentStore;

    private SubmissionPipeline pipeline;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        pipeline = new SubmissionPipeline(inventoryService, new StockValidator(), transactionRepository, attachmentStore);
        listener = new RecordingListener();
    }

    @Test
    void allItemsRecordedResetsTheForm() {
        SubmissionForm form = receiveForm("Soap", "Towel", "Bucket");
        when(transactionRepository.submit(any())).thenReturn(true);

        SubmissionResult result = pipeline.submit(form, listener);

        assertThat(result.getOutcome()).isEqualTo(SubmissionOutcome.SUCCESS);
        assertThat(result.getMessage()).isEqualTo("All 3 item(s) recorded successfully!");
        assertThat(form.getItems()).hasSize(1);
        assertThat(form.getItems().get(0).isBlank()).isTrue();
        assertThat(form.getCommonFields()).isEqualTo(CommonFields.blank());
        assertThat(listener.recorded).containsExactly(result);
        assertThat(listener.progress).extracting(ProgressSignal::getCurrent).containsExactly(1, 2, 3);
        assertThat(listener.progress).extracting(ProgressSignal::getTotal).containsOnly(3);
        verify(transactionRepository, times(3)).submit(any());
        assertThat(form.isInFlight()).isFalse();
    }

    @Test
    void partialFailureKeepsOnlyTheFailedRows() {
        SubmissionForm form = receiveForm("A", "B", "C");
        failFor("B");

        SubmissionResult result = pipeline.submit(form, listener);

        assertThat(result.getOutcome()).isEqualTo(SubmissionOutcome.PARTIAL);
        assertThat(result.getMessage()).isEqualTo("2 item(s) saved, but failed: B");
        assertThat(result.getFailedItems()).containsExactly("B");
        assertThat(form.getItems()).extracting(LineItem::getItemName).containsExactly("B");
        assertThat(form.getCommonFields().getLocation()).isEqualTo("Ground Floor");
        assertThat(listener.recorded).hasSize(1);
        assertThat(listener.progress).hasSize(3);
    }

    @Test
    void totalFailureLeavesTheFormAlone() {
        SubmissionForm form = receiveForm("A", "B");
        List<LineItem> before = new ArrayList<>(form.getItems());
        when(transactionRepository.submit(any())).thenReturn(false);

        SubmissionResult result = pipeline.submit(form, listener);

        assertThat(result.getOutcome()).isEqualTo(SubmissionOutcome.FAILURE);
        assertThat(result.getMessage()).isEqualTo("Failed to record transactions. Check connection.");
        assertThat(form.getItems()).containsExactlyElementsOf(before);
        assertThat(form.getCommonFields().getPersonName()).isEqualTo("Asha");
        assertThat(listener.recorded).isEmpty();
        assertThat(listener.progress).hasSize(2);
    }

    @Test
    void insufficientStockSendsNothing() {
        when(inventoryService.getSnapshot()).thenReturn(InventorySnapshot.of(List.of(
                new InventoryItem("Bolt", new BigDecimal("5"), "pcs"))));
        SubmissionForm form = new SubmissionForm(OperationKind.ISSUE);
        form.replaceItems(List.of(new LineItem(0, "Bolt", "10", "pcs")));
        form.setCommonFields(new CommonFields("Floor 1", "Ravi", ""));

        assertThatThrownBy(() -> pipeline.submit(form, listener))
                .isInstanceOf(InsufficientStockException.class);

        verifyNoInteractions(transactionRepository, attachmentStore);
        assertThat(listener.progress).isEmpty();
        assertThat(form.isInFlight()).isFalse();
        assertThat(form.getItems()).extracting(LineItem::getItemName).containsExactly("Bolt");
    }

    @Test
    void missingFieldRejectsTheBatchBeforeUpload() {
        SubmissionForm form = receiveForm("Soap");
        form.addItem("Towel", "", "pcs");
        form.attach(invoice());

        assertThatThrownBy(() -> pipeline.submit(form, listener))
                .isInstanceOf(MissingFieldException.class);

        verifyNoInteractions(transactionRepository, attachmentStore);
    }

    @Test
    void attachmentUrlGoesOnTheFirstRecordOnly() {
        SubmissionForm form = receiveForm("A", "B");
        form.attach(invoice());
        when(attachmentStore.upload(any(), anyString())).thenReturn(UploadResult.uploaded("https://files/inv.pdf"));
        when(transactionRepository.submit(any())).thenReturn(true);

        SubmissionResult result = pipeline.submit(form, listener);

        verify(attachmentStore).upload(any(Attachment.class), eq("A_B"));
        ArgumentCaptor<TransactionRequest> sent = ArgumentCaptor.forClass(TransactionRequest.class);
        verify(transactionRepository, times(2)).submit(sent.capture());
        assertThat(sent.getAllValues()).extracting(TransactionRequest::getFileUrl)
                .containsExactly("https://files/inv.pdf", "");
        assertThat(result.getUploadWarning()).isNull();
        assertThat(form.getAttachment()).isNull();
    }

    @Test
    void failedUploadIsOnlyAWarning() {
        SubmissionForm form = receiveForm("A", "B");
        form.attach(invoice());
        when(attachmentStore.upload(any(), anyString())).thenReturn(UploadResult.failed(null));
        when(transactionRepository.submit(any())).thenReturn(true);

        SubmissionResult result = pipeline.submit(form, listener);

        assertThat(result.getOutcome()).isEqualTo(SubmissionOutcome.SUCCESS);
        assertThat(result.getUploadWarning()).isEqualTo(SubmissionPipeline.UPLOAD_FAILED_MESSAGE);
        ArgumentCaptor<TransactionRequest> sent = ArgumentCaptor.forClass(TransactionRequest.class);
        verify(transactionRepository, times(2)).submit(sent.capture());
        assertThat(sent.getAllValues()).extracting(TransactionRequest::getFileUrl).containsOnly("");
    }

    @Test
    void storeErrorTextIsPassedThrough() {
        SubmissionForm form = receiveForm("A");
        form.attach(invoice());
        when(attachmentStore.upload(any(), anyString())).thenReturn(UploadResult.failed("File upload failed: quota"));
        when(transactionRepository.submit(any())).thenReturn(true);

        SubmissionResult result = pipeline.submit(form, listener);

        assertThat(result.getUploadWarning()).isEqualTo("File upload failed: quota");
    }

    @Test
    void throwingStoreIsTreatedAsAFailedUpload() {
        SubmissionForm form = receiveForm("A");
        form.attach(invoice());
        when(attachmentStore.upload(any(), anyString())).thenThrow(new IllegalStateException("bucket gone"));
        when(transactionRepository.submit(any())).thenReturn(true);

        SubmissionResult result = pipeline.submit(form, listener);

        assertThat(result.getOutcome()).isEqualTo(SubmissionOutcome.SUCCESS);
        assertThat(result.getUploadWarning()).isEqualTo(SubmissionPipeline.UPLOAD_FAILED_MESSAGE);
    }

    @Test
    void issueBatchesNeverUpload() {
        when(inventoryService.getSnapshot()).thenReturn(InventorySnapshot.of(List.of(
                new InventoryItem("Bolt", new BigDecimal("50"), "pcs"))));
        when(transactionRepository.submit(any())).thenReturn(true);
        SubmissionForm form = new SubmissionForm(OperationKind.ISSUE);
        form.replaceItems(List.of(new LineItem(0, "Bolt", "1", "pcs")));
        form.attach(invoice());

        pipeline.submit(form, listener);

        verify(attachmentStore, never()).upload(any(), anyString());
    }

    @Test
    void throwingSinkCountsAsAFailedItem() {
        SubmissionForm form = receiveForm("A", "B");
        when(transactionRepository.submit(any())).thenAnswer(invocation -> {
            TransactionRequest request = invocation.getArgument(0);
            if (request.getItemName().equals("A")) {
                throw new IllegalStateException("timeout");
            }
            return true;
        });

        SubmissionResult result = pipeline.submit(form, listener);

        assertThat(result.getOutcome()).isEqualTo(SubmissionOutcome.PARTIAL);
        assertThat(result.getFailedItems()).containsExactly("A");
        assertThat(listener.progress).hasSize(2);
    }

    @Test
    void issueUnitsComeFromTheInventory() {
        when(inventoryService.getSnapshot()).thenReturn(InventorySnapshot.of(List.of(
                new InventoryItem("Paint", new BigDecimal("10"), "L"))));
        when(transactionRepository.submit(any())).thenReturn(true);
        SubmissionForm form = new SubmissionForm(OperationKind.ISSUE);
        form.replaceItems(List.of(new LineItem(0, "Paint", "2.5", "pcs")));
        form.setCommonFields(new CommonFields("Floor 2", "Ravi", "touch-up"));

        pipeline.submit(form, listener);

        ArgumentCaptor<TransactionRequest> sent = ArgumentCaptor.forClass(TransactionRequest.class);
        verify(transactionRepository).submit(sent.capture());
        TransactionRequest request = sent.getValue();
        assertThat(request.getUnit()).isEqualTo("L");
        assertThat(request.getQuantity()).isEqualByComparingTo("2.5");
        assertThat(request.getType()).isEqualTo(OperationKind.ISSUE);
        assertThat(request.getLocation()).isEqualTo("Floor 2");
        assertThat(request.getNotes()).isEqualTo("touch-up");
    }

    @Test
    void secondBatchOnABusyFormIsRejected() {
        SubmissionForm form = receiveForm("A");
        form.beginBatch();

        assertThatThrownBy(() -> pipeline.submit(form, listener))
                .isInstanceOf(IllegalStateException.class);

        assertThat(form.isInFlight()).isTrue();
        verifyNoInteractions(transactionRepository);
    }

    @Test
    void duplicateNamesKeepOnlyTheRowThatFailed() {
        SubmissionForm form = receiveForm("A", "A");
        when(transactionRepository.submit(any())).thenReturn(true, false);

        pipeline.submit(form, listener);

        assertThat(form.getItems()).hasSize(1);
        // ids 2 and 3 were allocated for the two rows; the second one failed
        assertThat(form.getItems().get(0).getId()).isEqualTo(3);
    }

    private void failFor(String... names) {
        Set<String> failing = Set.of(names);
        when(transactionRepository.submit(any()))
                .thenAnswer(invocation -> !failing.contains(((TransactionRequest) invocation.getArgument(0)).getItemName()));
    }

    private static SubmissionForm receiveForm(String... names) {
        SubmissionForm form = new SubmissionForm(OperationKind.RECEIVE);
        List<LineItem> rows = new ArrayList<>();
        for (String name : names) {
            rows.add(new LineItem(0, name, "4", "pcs"));
        }
        form.replaceItems(rows);
        form.setCommonFields(new CommonFields("Ground Floor", "Asha", ""));
        return form;
    }

    private static Attachment invoice() {
        return new Attachment("invoice.pdf", "application/pdf", new byte[]{1, 2, 3});
    }

    private static class RecordingListener implements SubmissionListener {
        final List<ProgressSignal> progress = new ArrayList<>();
        final List<SubmissionResult> recorded = new ArrayList<>();

        @Override
        public void onProgress(ProgressSignal signal) {
            progress.add(signal);
        }

        @Override
        public void onRecorded(SubmissionResult result) {
            recorded.add(result);
        }
    }
}
