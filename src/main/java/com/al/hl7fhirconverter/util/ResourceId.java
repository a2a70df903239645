package com.al.hl7fhirconverter.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import java.util.UUID;

/**
 * Logical id of a generated FHIR resource.
 *
 * <p>
 * {@link Kind#CONTENT_DERIVED} ids are a pure function of source content (the
 * patient MRN) and are stable across runs. {@link Kind#SESSION_LOCAL} ids are
 * random and only meaningful inside the bundle they were generated for.
 */
public final class ResourceId {

    public enum Kind {
        CONTENT_DERIVED,
        SESSION_LOCAL
    }

    /** RFC 4122 DNS namespace. */
    private static final UUID NAMESPACE_DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    private final String value;
    private final Kind kind;

    private ResourceId(String value, Kind kind) {
        this.value = value;
        this.kind = kind;
    }

    public static ResourceId contentDerived(String prefix, String content) {
        return new ResourceId(prefix + "-" + nameBasedUuid(NAMESPACE_DNS, content), Kind.CONTENT_DERIVED);
    }

    public static ResourceId sessionLocal(String prefix) {
        return new ResourceId(prefix + "-" + UUID.randomUUID(), Kind.SESSION_LOCAL);
    }

    /**
     * Patient ids derive from the MRN. A patient without an MRN gets a
     * session-local id so unrelated MRN-less patients never share one.
     */
    public static ResourceId forPatient(String mrn) {
        if (mrn == null || mrn.isBlank()) {
            return sessionLocal(MappingConstants.PREFIX_PATIENT);
        }
        return contentDerived(MappingConstants.PREFIX_PATIENT, mrn);
    }

    /**
     * Version 5 (SHA-1) name-based UUID.
     */
    static UUID nameBasedUuid(UUID namespace, String name) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            ByteBuffer ns = ByteBuffer.allocate(16);
            ns.putLong(namespace.getMostSignificantBits());
            ns.putLong(namespace.getLeastSignificantBits());
            digest.update(ns.array());
            byte[] hash = digest.digest(name.getBytes(StandardCharsets.UTF_8));

            hash[6] &= 0x0f;
            hash[6] |= 0x50;
            hash[8] &= 0x3f;
            hash[8] |= (byte) 0x80;

            ByteBuffer bits = ByteBuffer.wrap(hash, 0, 16);
            return new UUID(bits.getLong(), bits.getLong());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    public String getValue() {
        return value;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isStable() {
        return kind == Kind.CONTENT_DERIVED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceId)) {
            return false;
        }
        ResourceId other = (ResourceId) o;
        return value.equals(other.value) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, kind);
    }

    @Override
    public String toString() {
        return value;
    }
}
