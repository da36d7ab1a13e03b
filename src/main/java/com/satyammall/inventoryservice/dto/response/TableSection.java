package com.satyammall.inventoryservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class TableSection {
    private String title;
    private List<String> headers;
    private List<List<String>> rows;
}
