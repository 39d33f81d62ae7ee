package com.vcc.llmgateway.service;

import com.vcc.llmgateway.model.CompletionCommand;
import com.vcc.llmgateway.model.Identity;
import com.vcc.llmgateway.model.TenantConfig;

/**
 * A request that passed identity and quota checks and may be dispatched.
 */
public record Admission(
        TenantConfig tenant,
        Identity identity,
        CompletionCommand command,
        BudgetReservation reservation
) {
}
