package com.al.hl7fhirconverter.util;

/**
 * Centralized mapping constants for HL7 v2 to FHIR R4 conversion.
 *
 * <p>
 * System URLs, codes and resource id prefixes used by the converters. Reference
 * them via static imports or class name.
 */
public final class MappingConstants {

    private MappingConstants() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // ========================================================================
    // Identifier and Terminology Systems
    // ========================================================================

    /** Local medical record number namespace */
    public static final String SYSTEM_MRN = "http://hospital.example.org/mrn";

    /** Local visit number namespace */
    public static final String SYSTEM_VISIT_NUMBER = "http://hospital.example.org/visit";

    /** LOINC (Logical Observation Identifiers Names and Codes) system URL */
    public static final String SYSTEM_LOINC = "http://loinc.org";

    /** HL7 v3 Act Code system (encounter class) */
    public static final String SYSTEM_V3_ACT_CODE = "http://terminology.hl7.org/CodeSystem/v3-ActCode";

    /** HL7 v2 Table 0203 - Identifier Type */
    public static final String SYSTEM_V2_IDENTIFIER_TYPE = "http://terminology.hl7.org/CodeSystem/v2-0203";

    /** HL7 v2 Table 0003 - Event Type */
    public static final String SYSTEM_V2_EVENT_TYPE = "http://terminology.hl7.org/CodeSystem/v2-0003";

    /** HL7 v2 Table 0069 - Hospital Service */
    public static final String SYSTEM_V2_HOSPITAL_SERVICE = "http://terminology.hl7.org/CodeSystem/v2-0069";

    /** HL7 v2 Table 0063 - Relationship */
    public static final String SYSTEM_V2_RELATIONSHIP = "http://terminology.hl7.org/CodeSystem/v2-0063";

    /** FHIR Observation Interpretation system */
    public static final String SYSTEM_OBSERVATION_INTERPRETATION = "http://terminology.hl7.org/CodeSystem/v3-ObservationInterpretation";

    /** FHIR AllergyIntolerance Verification Status codes */
    public static final String SYSTEM_ALLERGY_VER_STATUS = "http://terminology.hl7.org/CodeSystem/allergyintolerance-verification";

    /** FHIR AllergyIntolerance Clinical Status codes */
    public static final String SYSTEM_ALLERGY_CLINICAL = "http://terminology.hl7.org/CodeSystem/allergyintolerance-clinical";

    // ========================================================================
    // Status Codes
    // ========================================================================

    public static final String CODE_CONFIRMED = "confirmed";

    public static final String CODE_ACTIVE = "active";

    // ========================================================================
    // Encounter Class Codes (v3-ActCode)
    // ========================================================================

    public static final String CLASS_INPATIENT = "IMP";

    public static final String CLASS_AMBULATORY = "AMB";

    public static final String CLASS_EMERGENCY = "EMER";

    // ========================================================================
    // HL7 v2 Allergen Type Codes (Table 0127)
    // ========================================================================

    /** Drug Allergy (DA) */
    public static final String ALLERGY_TYPE_DRUG = "DA";

    /** Miscellaneous Allergy (MA), mapped as medication */
    public static final String ALLERGY_TYPE_MISC = "MA";

    /** Food Allergy (FA) */
    public static final String ALLERGY_TYPE_FOOD = "FA";

    /** Environmental Allergy (EA) */
    public static final String ALLERGY_TYPE_ENV = "EA";

    /** Animal Allergy (AA), mapped as environment */
    public static final String ALLERGY_TYPE_ANIMAL = "AA";

    // ========================================================================
    // HL7 v2 Allergy Severity Codes (Table 0128)
    // ========================================================================

    public static final String SEVERITY_SEVERE = "SV";

    public static final String SEVERITY_MODERATE = "MO";

    public static final String SEVERITY_MILD = "MI";

    // ========================================================================
    // HL7 v2 Identifier Type Codes
    // ========================================================================

    /** Medical Record Number (MR) */
    public static final String IDENT_MR = "MR";

    // ========================================================================
    // Resource id prefixes
    // ========================================================================

    public static final String PREFIX_PATIENT = "patient";
    public static final String PREFIX_ENCOUNTER = "enc";
    public static final String PREFIX_OBSERVATION = "obs";
    public static final String PREFIX_RELATED_PERSON = "rp";
    public static final String PREFIX_ALLERGY = "allergy";
}
