package com.al.hl7fhirconverter.util;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResourceIdTest {

    @Test
    public void testPatientIdIsDerivedFromMrn() {
        ResourceId id = ResourceId.forPatient("MRN123");

        assertEquals("patient-e1973c37-cd6e-5a2f-bc74-12eabfee2ebd", id.getValue());
        assertEquals(ResourceId.Kind.CONTENT_DERIVED, id.getKind());
        assertTrue(id.isStable());
        assertEquals(id, ResourceId.forPatient("MRN123"), "Same MRN gives the same id");
        assertNotEquals(id, ResourceId.forPatient("MRN456"));
    }

    @Test
    public void testNameBasedUuidIsVersionFive() {
        UUID uuid = ResourceId.nameBasedUuid(UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8"), "MRN456");

        assertEquals(5, uuid.version());
        assertEquals(2, uuid.variant());
        assertEquals("c3e866c9-c9c8-509c-802b-a3ce98a51431", uuid.toString());
    }

    @Test
    public void testMissingMrnGivesSessionLocalId() {
        ResourceId first = ResourceId.forPatient(null);
        ResourceId second = ResourceId.forPatient(null);
        ResourceId blank = ResourceId.forPatient("  ");

        assertTrue(first.getValue().startsWith("patient-"));
        assertEquals(ResourceId.Kind.SESSION_LOCAL, first.getKind());
        assertFalse(first.isStable(), "No MRN means no stable identity");
        assertFalse(blank.isStable());
        assertNotEquals(first, second, "MRN-less patients must not share an id");
        assertNotEquals(first, blank);
    }

    @Test
    public void testSessionLocalIdsAreUnique() {
        ResourceId first = ResourceId.sessionLocal("obs");
        ResourceId second = ResourceId.sessionLocal("obs");

        assertTrue(first.getValue().startsWith("obs-"));
        assertFalse(first.isStable());
        assertNotEquals(first, second);
    }
}
