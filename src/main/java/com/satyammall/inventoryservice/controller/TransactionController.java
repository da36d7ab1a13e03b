package com.satyammall.inventoryservice.controller;

import com.satyammall.inventoryservice.dto.request.TransactionBatchRequest;
import com.satyammall.inventoryservice.dto.response.SubmissionResponse;
import com.satyammall.inventoryservice.model.Attachment;
import com.satyammall.inventoryservice.model.OperationKind;
import com.satyammall.inventoryservice.model.SubmissionForm;
import com.satyammall.inventoryservice.service.TransactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/inventory/transactions")
@RequiredArgsConstructor
@Tag(name = "Stock Movements", description = "Issue stock to locations and receive stock from suppliers")
public class TransactionController {

    private final TransactionService transactionService;

    @Operation(
            summary = "Record an issue or receive batch",
            description = "Validates every line against the inventory, then records the lines one by one. "
                    + "Lines that fail to save are returned in 'items' so they can be sent again.",
            responses = {
                    @ApiResponse(responseCode = "201", description = "All lines recorded"),
                    @ApiResponse(responseCode = "200", description = "Some lines recorded"),
                    @ApiResponse(responseCode = "502", description = "No line could be recorded"),
                    @ApiResponse(responseCode = "400", description = "Missing field or invalid quantity"),
                    @ApiResponse(responseCode = "404", description = "Unknown item"),
                    @ApiResponse(responseCode = "409", description = "Insufficient stock")
            }
    )
    @PostMapping(value = "/{type}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SubmissionResponse> submit(@PathVariable String type,
                                                     @Valid @RequestBody TransactionBatchRequest request) {
        SubmissionForm form = request.toForm(OperationKind.fromDisplayName(type));
        return respond(transactionService.record(form));
    }

    /**
     * Same as {@link #submit} with an invoice or photo. Only receive batches take an attachment.
     */
    @PostMapping(value = "/{type}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmissionResponse> submitWithAttachment(
            @PathVariable String type,
            @Valid @RequestPart("batch") TransactionBatchRequest request,
            @RequestPart(value = "attachment", required = false) MultipartFile attachment) throws IOException {

        OperationKind kind = OperationKind.fromDisplayName(type);
        SubmissionForm form = request.toForm(kind);
        if (attachment != null && !attachment.isEmpty()) {
            if (kind != OperationKind.RECEIVE) {
                throw new IllegalArgumentException("Attachments are only accepted for receive operations.");
            }
            form.attach(new Attachment(attachment.getOriginalFilename(), attachment.getContentType(), attachment.getBytes()));
        }
        return respond(transactionService.record(form));
    }

    private ResponseEntity<SubmissionResponse> respond(SubmissionResponse response) {
        HttpStatus status = switch (response.getOutcome()) {
            case SUCCESS -> HttpStatus.CREATED;
            case PARTIAL -> HttpStatus.OK;
            case FAILURE -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(response);
    }
}
