package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.model.Attachment;
import com.satyammall.inventoryservice.model.CommonFields;
import com.satyammall.inventoryservice.model.InventorySnapshot;
import com.satyammall.inventoryservice.model.LineItem;
import com.satyammall.inventoryservice.model.ProgressSignal;
import com.satyammall.inventoryservice.model.SubmissionForm;
import com.satyammall.inventoryservice.model.SubmissionOutcome;
import com.satyammall.inventoryservice.model.SubmissionResult;
import com.satyammall.inventoryservice.model.TransactionRequest;
import com.satyammall.inventoryservice.model.UploadResult;
import com.satyammall.inventoryservice.repository.AttachmentStore;
import com.satyammall.inventoryservice.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Sends the lines of a form to the transaction log one by one.
 * <p>
 * Validation is all-or-nothing: a bad line rejects the batch before anything is uploaded or
 * submitted. Submission is best-effort: every line is attempted in order, each write finishing
 * before the next begins, and the failed lines stay on the form so they can be sent again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionPipeline {

    static final String UPLOAD_FAILED_MESSAGE = "File upload failed. Transaction will continue without file.";

    private final InventoryService inventoryService;
    private final StockValidator stockValidator;
    private final TransactionRepository transactionRepository;
    private final AttachmentStore attachmentStore;

    public SubmissionResult submit(SubmissionForm form, SubmissionListener listener) {
        form.beginBatch();
        try {
            return runBatch(form, listener);
        } finally {
            form.endBatch();
        }
    }

    private SubmissionResult runBatch(SubmissionForm form, SubmissionListener listener) {
        InventorySnapshot snapshot = form.isIssue() ? inventoryService.getSnapshot() : InventorySnapshot.empty();
        form.syncUnits(snapshot);

        List<LineItem> items = new ArrayList<>(form.getItems());
        stockValidator.validate(form.getType(), items, snapshot);

        log.info("Submitting {} batch of {} item(s)", form.getType().getDisplayName(), items.size());

        String uploadWarning = null;
        String fileUrl = "";
        if (!form.isIssue() && form.getAttachment() != null) {
            UploadResult upload = uploadAttachment(form.getAttachment(), items);
            if (upload.isSuccess() && upload.getFileUrl() != null && !upload.getFileUrl().isEmpty()) {
                fileUrl = upload.getFileUrl();
            } else {
                uploadWarning = upload.getError() != null ? upload.getError() : UPLOAD_FAILED_MESSAGE;
                log.warn("Continuing {} batch without attachment: {}", form.getType().getDisplayName(), uploadWarning);
            }
        }

        CommonFields common = form.getCommonFields();
        int successCount = 0;
        List<LineItem> failed = new ArrayList<>();

        for (int i = 0; i < items.size(); i++) {
            LineItem item = items.get(i);
            TransactionRequest request = TransactionRequest.builder()
                    .type(form.getType())
                    .itemName(item.getItemName())
                    .quantity(StockValidator.parseQuantity(item.getQuantity()))
                    .unit(item.getUnit())
                    .location(common.getLocation())
                    .personName(common.getPersonName())
                    .notes(common.getNotes())
                    // the attachment belongs to the batch, so only the first record carries it
                    .fileUrl(i == 0 ? fileUrl : "")
                    .build();

            if (send(request)) {
                successCount++;
            } else {
                failed.add(item);
            }
            listener.onProgress(new ProgressSignal(i + 1, items.size()));
            log.debug("Submitted item {} of {}", i + 1, items.size());
        }

        SubmissionResult result = classify(form, successCount, failed, uploadWarning, fileUrl);
        log.info("{} batch finished: {} ({} saved, {} failed)", form.getType().getDisplayName(),
                result.getOutcome(), successCount, failed.size());
        if (result.anySucceeded()) {
            listener.onRecorded(result);
        }
        return result;
    }

    private UploadResult uploadAttachment(Attachment attachment, List<LineItem> items) {
        String nameHint = items.stream().map(LineItem::getItemName).collect(Collectors.joining("_"));
        try {
            return attachmentStore.upload(attachment, nameHint);
        } catch (RuntimeException e) {
            log.warn("Attachment store rejected {}", attachment.getFileName(), e);
            return UploadResult.failed(null);
        }
    }

    private boolean send(TransactionRequest request) {
        try {
            return transactionRepository.submit(request);
        } catch (RuntimeException e) {
            log.warn("Submission of {} failed", request.getItemName(), e);
            return false;
        }
    }

    private SubmissionResult classify(SubmissionForm form, int successCount, List<LineItem> failed,
                                      String uploadWarning, String fileUrl) {
        List<String> failedNames = failed.stream().map(LineItem::getItemName).collect(Collectors.toList());
        SubmissionResult.SubmissionResultBuilder result = SubmissionResult.builder()
                .successCount(successCount)
                .failedItems(failedNames)
                .uploadWarning(uploadWarning)
                .fileUrl(fileUrl);

        if (failed.isEmpty()) {
            form.resetAfterSuccess();
            return result.outcome(SubmissionOutcome.SUCCESS)
                    .message("All " + successCount + " item(s) recorded successfully!")
                    .build();
        }
        if (successCount > 0) {
            form.retainFailed(failed);
            return result.outcome(SubmissionOutcome.PARTIAL)
                    .message(successCount + " item(s) saved, but failed: " + String.join(", ", failedNames))
                    .build();
        }
        return result.outcome(SubmissionOutcome.FAILURE)
                .message("Failed to record transactions. Check connection.")
                .build();
    }
}
