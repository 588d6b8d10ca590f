package com.netpilot.gateway.dispatch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netpilot.gateway.confirmation.Preview;
import com.netpilot.gateway.operation.OperationException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structured outcome of a dispatch. Exactly one of three shapes:
 * <pre>
 *   success:      { success: true,  data }
 *   failure:      { success: false, error, error_type }
 *   confirmation: { success: false, requires_confirmation: true, action, resource_type,
 *                   resource_id?, resource_name?, preview: {current, proposed}, message, warnings? }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResult(
        boolean success,
        Object data,
        String error,
        @JsonProperty("error_type")            String errorType,
        @JsonProperty("requires_confirmation") Boolean requiresConfirmation,
        String action,
        @JsonProperty("resource_type")         String resourceType,
        @JsonProperty("resource_id")           String resourceId,
        @JsonProperty("resource_name")         String resourceName,
        PreviewBody preview,
        String message,
        List<String> warnings) {

    public record PreviewBody(Map<String, Object> current, Map<String, Object> proposed) {}

    public static DispatchResult success(Object data) {
        return new DispatchResult(true, data, null, null, null,
                null, null, null, null, null, null, null);
    }

    public static DispatchResult failure(OperationException e) {
        return failure(e.getKind().name().toLowerCase(Locale.ROOT), e.getMessage());
    }

    public static DispatchResult failure(String errorType, String error) {
        return new DispatchResult(false, null, error, errorType, null,
                null, null, null, null, null, null, null);
    }

    public static DispatchResult confirmationRequired(Preview p) {
        return new DispatchResult(false, null, null, null, true,
                p.action(), p.resourceType(), p.resourceId(), p.resourceName(),
                new PreviewBody(p.current(), p.proposed()), p.message(),
                p.warnings().isEmpty() ? null : p.warnings());
    }

    @JsonIgnore
    public boolean isConfirmationRequired() {
        return Boolean.TRUE.equals(requiresConfirmation);
    }

    /**
     * What a batch job keeps on {@code done}: the data of a success, or this
     * whole response when the call is waiting for confirmation.
     */
    @JsonIgnore
    public Object payload() {
        return isConfirmationRequired() ? this : data;
    }
}
