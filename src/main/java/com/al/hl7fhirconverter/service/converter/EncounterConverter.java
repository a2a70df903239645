package com.al.hl7fhirconverter.service.converter;

import com.al.hl7fhirconverter.model.ir.EncounterRecord;
import com.al.hl7fhirconverter.model.ir.EventRecord;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.util.DateTimeUtil;
import com.al.hl7fhirconverter.util.MappingConstants;
import com.al.hl7fhirconverter.util.ResourceId;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.DateTimeType;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.Period;
import org.hl7.fhir.r4.model.Reference;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

@Slf4j
@Component
public class EncounterConverter implements SegmentConverter<Encounter> {

    @Override
    public List<Encounter> convert(ParsedMessage message, ConversionContext context) {
        EncounterRecord pv1 = message.getEncounter();
        if (pv1 == null) {
            return Collections.emptyList();
        }

        Encounter encounter = new Encounter();
        String encounterId = ResourceId.sessionLocal(MappingConstants.PREFIX_ENCOUNTER).getValue();
        encounter.setId(encounterId);
        context.setEncounterId(encounterId);

        encounter.setSubject(new Reference(context.patientReference()));
        encounter.setStatus(pv1.isDischarged()
                ? Encounter.EncounterStatus.FINISHED
                : Encounter.EncounterStatus.INPROGRESS);

        // PV1-2 Patient Class
        encounter.setClass_(new Coding()
                .setSystem(MappingConstants.SYSTEM_V3_ACT_CODE)
                .setCode(mapPatientClass(pv1.getPatientClass())));

        // PV1-18 Visit Number
        if (pv1.getVisitNumber() != null) {
            encounter.addIdentifier()
                    .setSystem(MappingConstants.SYSTEM_VISIT_NUMBER)
                    .setValue(pv1.getVisitNumber());
        }

        // PV1-10 Hospital Service
        if (pv1.getHospitalService() != null) {
            encounter.setServiceType(new CodeableConcept().addCoding(new Coding()
                    .setSystem(MappingConstants.SYSTEM_V2_HOSPITAL_SERVICE)
                    .setCode(pv1.getHospitalService())));
        }

        Period period = new Period();
        DateTimeType start = toDateTime(pv1.getAdmitTime());
        if (start != null) {
            period.setStartElement(start);
        }
        DateTimeType end = toDateTime(pv1.getDischargeTime());
        if (end != null) {
            period.setEndElement(end);
        }
        if (!period.isEmpty()) {
            encounter.setPeriod(period);
        }

        // PV1-3 Assigned Location, display only
        if (pv1.getLocation() != null) {
            encounter.addLocation().setLocation(new Reference().setDisplay(pv1.getLocation()));
        }

        // PV1-7 Attending Doctor, display only
        if (pv1.getAttendingDoctor() != null) {
            encounter.addParticipant().setIndividual(new Reference().setDisplay(pv1.getAttendingDoctor()));
        }

        // EVN-1 Event Type
        EventRecord evn = message.getEvent();
        if (evn != null && evn.getEventType() != null) {
            encounter.addType(new CodeableConcept().addCoding(new Coding()
                    .setSystem(MappingConstants.SYSTEM_V2_EVENT_TYPE)
                    .setCode(evn.getEventType())));
        }

        return Collections.singletonList(encounter);
    }

    static String mapPatientClass(String patientClass) {
        if (patientClass == null) {
            return MappingConstants.CLASS_AMBULATORY;
        }
        switch (patientClass) {
            case "I":
                return MappingConstants.CLASS_INPATIENT;
            case "E":
                return MappingConstants.CLASS_EMERGENCY;
            case "O":
            default:
                return MappingConstants.CLASS_AMBULATORY;
        }
    }

    private DateTimeType toDateTime(String hl7Timestamp) {
        if (hl7Timestamp == null) {
            return null;
        }
        String iso = DateTimeUtil.hl7TimestampToIso(hl7Timestamp);
        if (iso == null) {
            log.debug("PV1 value '{}' is not a timestamp, leaving period bound empty", hl7Timestamp);
            return null;
        }
        return new DateTimeType(iso);
    }
}
