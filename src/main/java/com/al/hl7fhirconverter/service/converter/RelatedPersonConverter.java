package com.al.hl7fhirconverter.service.converter;

import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.model.ir.RelatedPersonRecord;
import com.al.hl7fhirconverter.util.MappingConstants;
import com.al.hl7fhirconverter.util.ResourceId;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.ContactPoint;
import org.hl7.fhir.r4.model.HumanName;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.RelatedPerson;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * NK1 (next of kin) to RelatedPerson.
 */
@Slf4j
@Component
public class RelatedPersonConverter implements SegmentConverter<RelatedPerson> {

    @Override
    public List<RelatedPerson> convert(ParsedMessage message, ConversionContext context) {
        List<RelatedPerson> relatedPersons = new ArrayList<>();

        for (RelatedPersonRecord nk1 : message.getRelatedPersons()) {
            RelatedPerson relatedPerson = new RelatedPerson();
            relatedPerson.setId(ResourceId.sessionLocal(MappingConstants.PREFIX_RELATED_PERSON).getValue());
            relatedPerson.setPatient(new Reference(context.patientReference()));

            // NK1-2 Name
            if (nk1.hasStructuredName()) {
                HumanName name = relatedPerson.addName().setFamily(nk1.getFamilyName());
                if (nk1.getGivenName() != null) {
                    name.addGiven(nk1.getGivenName());
                }
            } else if (nk1.getRawName() != null) {
                relatedPerson.addName().setText(nk1.getRawName());
            }

            // NK1-3 Relationship
            if (nk1.getRelationshipCode() != null || nk1.getRelationshipText() != null) {
                CodeableConcept relationship = new CodeableConcept();
                if (nk1.getRelationshipCode() != null) {
                    relationship.addCoding()
                            .setSystem(MappingConstants.SYSTEM_V2_RELATIONSHIP)
                            .setCode(nk1.getRelationshipCode())
                            .setDisplay(nk1.getRelationshipText());
                }
                if (nk1.getRelationshipText() != null) {
                    relationship.setText(nk1.getRelationshipText());
                }
                relatedPerson.addRelationship(relationship);
            }

            // NK1-5 Phone
            if (nk1.getPhone() != null) {
                relatedPerson.addTelecom()
                        .setSystem(ContactPoint.ContactPointSystem.PHONE)
                        .setValue(nk1.getPhone());
            }

            relatedPersons.add(relatedPerson);
        }

        log.debug("Converted {} NK1 segment(s)", relatedPersons.size());
        return relatedPersons;
    }
}
