package com.satyammall.inventoryservice.dto.request;

import com.satyammall.inventoryservice.model.CommonFields;
import com.satyammall.inventoryservice.model.LineItem;
import com.satyammall.inventoryservice.model.OperationKind;
import com.satyammall.inventoryservice.model.SubmissionForm;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

@Data
public class TransactionBatchRequest {

    @Valid
    @NotEmpty(message = "At least one item is required.")
    private List<@NotNull(message = "Item entries cannot be null.") LineItemRequest> items;

    @NotBlank(message = "Location is required.")
    private String location;

    @NotBlank(message = "Receiver or supplier name is required.")
    private String personName;

    private String notes;

    public SubmissionForm toForm(OperationKind type) {
        SubmissionForm form = new SubmissionForm(type);
        form.replaceItems(items.stream()
                .map(item -> new LineItem(0, item.getItemName(), item.getQuantity(), item.getUnit()))
                .collect(Collectors.toList()));
        form.setCommonFields(new CommonFields(location, personName, notes == null ? "" : notes));
        return form;
    }
}
