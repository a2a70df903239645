package com.al.hl7fhirconverter.controller;

import com.al.hl7fhirconverter.dto.ConversionError;
import com.al.hl7fhirconverter.dto.ConversionResponse;
import com.al.hl7fhirconverter.dto.ConversionResult;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.service.Hl7ToFhirService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/convert")
@Tag(name = "Conversion")
public class ConverterController {

    private final Hl7ToFhirService hl7ToFhirService;

    @Autowired
    public ConverterController(Hl7ToFhirService hl7ToFhirService) {
        this.hl7ToFhirService = hl7ToFhirService;
    }

    @Operation(summary = "Convert an HL7 v2 message to a FHIR R4 collection Bundle")
    @PostMapping(value = "/v2-to-fhir", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> convertToFhir(@RequestBody String hl7Message) {
        return ResponseEntity.ok(hl7ToFhirService.convertHl7ToFhir(hl7Message));
    }

    @Operation(summary = "Convert and return the decoded message, Bundle, violations and summary")
    @PostMapping(value = "/v2-to-fhir/detailed", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConversionResponse> convertDetailed(@RequestBody String hl7Message) {
        ConversionResult result = hl7ToFhirService.convert(hl7Message);
        return ResponseEntity.ok(new ConversionResponse(
                result.getParsed(),
                hl7ToFhirService.encode(result.getBundle(), false),
                result.getViolations(),
                result.getSummary()));
    }

    @Operation(summary = "Decode an HL7 v2 message without converting it")
    @PostMapping(value = "/parse", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ParsedMessage> parse(@RequestBody String hl7Message) {
        return ResponseEntity.ok(hl7ToFhirService.parse(hl7Message));
    }

    @Operation(summary = "Run structural validation and report the result as an OperationOutcome")
    @PostMapping(value = "/validate", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> validate(@RequestBody String hl7Message) {
        List<ConversionError> violations = hl7ToFhirService.validate(hl7Message);
        log.info("Validation found {} violation(s)", violations.size());
        return ResponseEntity.ok(hl7ToFhirService.encodeOperationOutcome(violations));
    }
}
