package com.al.hl7fhirconverter.model.ir;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrderRecord {
    String placerOrderNumber;
    String fillerOrderNumber;
    String testCode;
    String testName;
    String specimenTime;
    String resultTime;
    String orderingProvider;
}
