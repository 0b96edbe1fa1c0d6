package com.al.radiologyfiller.util;

/**
 * Code systems and identifier namespaces used by the FHIR projection.
 */
public final class MappingConstants {

    private MappingConstants() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    // ========================================================================
    // Code systems
    // ========================================================================

    /** HL7 v2 table 0203, identifier type */
    public static final String SYSTEM_V2_IDENTIFIER_TYPE = "http://terminology.hl7.org/CodeSystem/v2-0203";

    /** DICOM controlled terminology, used for modality codes */
    public static final String SYSTEM_DICOM_DCM = "http://dicom.nema.org/resources/ontology/DCM";

    /** Identifier system of DICOM UIDs */
    public static final String SYSTEM_DICOM_UID = "urn:dicom:uid";

    /** Identifier system of the internal procedure request id */
    public static final String SYSTEM_PROCEDURE_REQUEST = "urn:radiology:procedure-request";

    /** Identifier system of accession numbers issued or accepted by this filler */
    public static final String SYSTEM_ACCESSION = "urn:radiology:accession";

    public static final String OID_PREFIX = "urn:oid:";

    // ========================================================================
    // Identifier type codes (v2-0203)
    // ========================================================================

    public static final String ID_TYPE_PLACER = "PLAC";
    public static final String ID_TYPE_FILLER = "FILL";
    public static final String ID_TYPE_ACCESSION = "ACSN";
    public static final String ID_TYPE_RPID = "RPID";

    // ========================================================================
    // Resource references
    // ========================================================================

    public static final String PATIENT_REFERENCE_PREFIX = "Patient/";
    public static final String SERVICE_REQUEST_REFERENCE_PREFIX = "ServiceRequest/";
}
