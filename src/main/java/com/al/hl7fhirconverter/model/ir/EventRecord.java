package com.al.hl7fhirconverter.model.ir;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EventRecord {
    String eventType;
    String recordedTime;
    String occurredTime;
}
