package com.netpilot.gateway.confirmation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * {@code gateway.confirmation.*}
 *
 * @param autoConfirm  treat every mutating call as confirmed. Removes the
 *                     preview step entirely; meant for unattended automation
 *                     where a human has already approved the workflow.
 * @param overrideKey  flat key consulted first for the same switch, parsed as
 *                     true/1/yes/on
 */
@ConfigurationProperties("gateway.confirmation")
public record ConfirmationProperties(
        @DefaultValue("false") boolean autoConfirm,
        @DefaultValue("GATEWAY_AUTO_CONFIRM") String overrideKey) {}
