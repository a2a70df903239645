package com.al.hl7fhirconverter.model.ir;

import lombok.Builder;
import lombok.Value;

/**
 * Decoded MSH segment.
 */
@Value
@Builder
public class MessageHeaderRecord {
    String sendingApplication;
    String sendingFacility;
    String timestamp;
    String messageType;
    String triggerEvent;
    String controlId;
    String version;
}
