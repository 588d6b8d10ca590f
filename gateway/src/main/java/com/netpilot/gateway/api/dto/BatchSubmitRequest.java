package com.netpilot.gateway.api.dto;

import com.netpilot.gateway.job.BatchOperation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/** Request body for POST /tools/batch. */
public record BatchSubmitRequest(@NotNull List<@NotNull @Valid Entry> operations) {

    public record Entry(@NotBlank String tool, Map<String, Object> arguments) {

        public BatchOperation toOperation() {
            return new BatchOperation(tool, arguments);
        }
    }
}
