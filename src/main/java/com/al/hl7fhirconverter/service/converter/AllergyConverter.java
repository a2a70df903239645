package com.al.hl7fhirconverter.service.converter;

import com.al.hl7fhirconverter.model.ir.AllergyRecord;
import com.al.hl7fhirconverter.model.ir.ParsedMessage;
import com.al.hl7fhirconverter.util.MappingConstants;
import com.al.hl7fhirconverter.util.ResourceId;
import lombok.extern.slf4j.Slf4j;
import org.hl7.fhir.r4.model.AllergyIntolerance;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Reference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class AllergyConverter implements SegmentConverter<AllergyIntolerance> {

    @Override
    public List<AllergyIntolerance> convert(ParsedMessage message, ConversionContext context) {
        List<AllergyIntolerance> allergies = new ArrayList<>();

        for (AllergyRecord al1 : message.getAllergies()) {
            AllergyIntolerance allergy = new AllergyIntolerance();
            allergy.setId(ResourceId.sessionLocal(MappingConstants.PREFIX_ALLERGY).getValue());
            allergy.setPatient(new Reference(context.patientReference()));

            allergy.setVerificationStatus(new CodeableConcept().addCoding(
                    new Coding().setSystem(MappingConstants.SYSTEM_ALLERGY_VER_STATUS)
                            .setCode(MappingConstants.CODE_CONFIRMED)));
            allergy.setClinicalStatus(new CodeableConcept().addCoding(
                    new Coding().setSystem(MappingConstants.SYSTEM_ALLERGY_CLINICAL)
                            .setCode(MappingConstants.CODE_ACTIVE)));

            // AL1-2 Allergen Type
            AllergyIntolerance.AllergyIntoleranceCategory category = mapCategory(al1.getAllergenType());
            if (category != null) {
                allergy.addCategory(category);
            }

            // AL1-3 Allergen, text only
            if (al1.getDescription() != null) {
                allergy.setCode(new CodeableConcept().setText(al1.getDescription()));
            }

            AllergyIntolerance.AllergyIntoleranceReactionComponent reaction = new AllergyIntolerance.AllergyIntoleranceReactionComponent();
            boolean hasReaction = false;

            // AL1-4 Severity -> criticality and reaction severity
            String severity = al1.getSeverity();
            if (severity != null) {
                allergy.setCriticality(MappingConstants.SEVERITY_SEVERE.equals(severity)
                        ? AllergyIntolerance.AllergyIntoleranceCriticality.HIGH
                        : AllergyIntolerance.AllergyIntoleranceCriticality.LOW);

                AllergyIntolerance.AllergyIntoleranceSeverity reactionSeverity = mapSeverity(severity);
                if (reactionSeverity != null) {
                    reaction.setSeverity(reactionSeverity);
                    hasReaction = true;
                }
            }

            // AL1-5 Reaction
            if (al1.getReaction() != null) {
                reaction.addManifestation(new CodeableConcept().setText(al1.getReaction()));
                hasReaction = true;
            }

            if (hasReaction) {
                allergy.addReaction(reaction);
            }

            allergies.add(allergy);
        }

        return allergies;
    }

    static AllergyIntolerance.AllergyIntoleranceCategory mapCategory(String allergenType) {
        if (allergenType == null) {
            return null;
        }
        switch (allergenType) {
            case MappingConstants.ALLERGY_TYPE_DRUG:
            case MappingConstants.ALLERGY_TYPE_MISC:
                return AllergyIntolerance.AllergyIntoleranceCategory.MEDICATION;
            case MappingConstants.ALLERGY_TYPE_FOOD:
                return AllergyIntolerance.AllergyIntoleranceCategory.FOOD;
            case MappingConstants.ALLERGY_TYPE_ENV:
            case MappingConstants.ALLERGY_TYPE_ANIMAL:
                return AllergyIntolerance.AllergyIntoleranceCategory.ENVIRONMENT;
            default:
                log.debug("Unmapped AL1-2 allergen type {}", allergenType);
                return null;
        }
    }

    private static AllergyIntolerance.AllergyIntoleranceSeverity mapSeverity(String severity) {
        switch (severity) {
            case MappingConstants.SEVERITY_SEVERE:
                return AllergyIntolerance.AllergyIntoleranceSeverity.SEVERE;
            case MappingConstants.SEVERITY_MODERATE:
                return AllergyIntolerance.AllergyIntoleranceSeverity.MODERATE;
            case MappingConstants.SEVERITY_MILD:
                return AllergyIntolerance.AllergyIntoleranceSeverity.MILD;
            default:
                return null;
        }
    }
}
