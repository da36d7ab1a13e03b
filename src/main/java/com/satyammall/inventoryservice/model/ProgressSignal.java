package com.satyammall.inventoryservice.model;

import lombok.Value;

/**
 * Emitted once per submitted line, after its outcome is known. {@code current} is 1-based.
 */
@Value
public class ProgressSignal {
    int current;
    int total;
}
