package com.al.hl7fhirconverter.service.converter;

import com.al.hl7fhirconverter.exception.Hl7ConversionException;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.model.ir.PatientRecord;
import com.al.hl7fhirconverter.util.DateTimeUtil;
import com.al.hl7fhirconverter.util.MappingConstants;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.DateType;
import org.hl7.fhir.r4.model.Enumerations;
import org.hl7.fhir.r4.model.HumanName;
import org.hl7.fhir.r4.model.Identifier;
import org.hl7.fhir.r4.model.Patient;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

@Slf4j
@Component
public class PatientConverter implements SegmentConverter<Patient> {

    @Override
    public List<Patient> convert(ParsedMessage message, ConversionContext context) {
        PatientRecord pid = message.getPatient();
        if (pid == null) {
            throw Hl7ConversionException.missingPatient();
        }
        log.debug("Processing PID for patient id {} in message {}", context.getPatientId(),
                context.getMessageControlId());

        Patient patient = new Patient();
        patient.setId(context.getPatientId());

        // PID-3 MRN
        if (pid.getMrn() != null) {
            Identifier identifier = patient.addIdentifier()
                    .setSystem(MappingConstants.SYSTEM_MRN)
                    .setValue(pid.getMrn());
            if (MappingConstants.IDENT_MR.equals(pid.getIdentifierType())) {
                identifier.getType().addCoding()
                        .setSystem(MappingConstants.SYSTEM_V2_IDENTIFIER_TYPE)
                        .setCode(MappingConstants.IDENT_MR);
                identifier.setUse(Identifier.IdentifierUse.OFFICIAL);
            }
        }

        // PID-5 family^given
        if (pid.getFamilyName() != null || pid.getGivenName() != null) {
            HumanName name = patient.addName().setFamily(pid.getFamilyName());
            if (pid.getGivenName() != null) {
                name.addGiven(pid.getGivenName());
            }
        }

        // PID-8: only F is female, every other code falls back to male
        patient.setGender("F".equals(pid.getSex())
                ? Enumerations.AdministrativeGender.FEMALE
                : Enumerations.AdministrativeGender.MALE);

        // PID-7
        if (pid.getBirthDate() != null) {
            try {
                LocalDate birthDate = DateTimeUtil.parseHl7Date(pid.getBirthDate());
                patient.setBirthDateElement(new DateType(birthDate.toString()));
            } catch (DateTimeException e) {
                log.debug("Omitting birth date, '{}' is not a calendar date", pid.getBirthDate());
            }
        }

        return Collections.singletonList(patient);
    }
}
