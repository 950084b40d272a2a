/**
 * Ambient observability for the Keystone client core: trace handles bridged to SLF4J MDC,
 * OpenTelemetry spans, Micrometer counters fed from event buses, and credential redaction for
 * log output.
 */
package com.keystone.observability;
