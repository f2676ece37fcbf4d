package com.mk.fx.qa.dicom.load.catalog;

/** Attributes extracted by {@link DicomHeaderReader}; any of them may be {@code null}. */
record DicomHeader(
    String transferSyntaxUid,
    String sopClassUid,
    String sopInstanceUid,
    String modality,
    String patientId,
    String studyInstanceUid) {

  static final class Builder {
    private String transferSyntaxUid;
    private String sopClassUid;
    private String sopInstanceUid;
    private String modality;
    private String patientId;
    private String studyInstanceUid;

    Builder transferSyntaxUid(String value) {
      this.transferSyntaxUid = value;
      return this;
    }

    Builder sopClassUid(String value) {
      this.sopClassUid = value;
      return this;
    }

    Builder sopInstanceUid(String value) {
      this.sopInstanceUid = value;
      return this;
    }

    Builder modality(String value) {
      this.modality = value;
      return this;
    }

    Builder patientId(String value) {
      this.patientId = value;
      return this;
    }

    Builder studyInstanceUid(String value) {
      this.studyInstanceUid = value;
      return this;
    }

    DicomHeader build() {
      return new DicomHeader(
          transferSyntaxUid, sopClassUid, sopInstanceUid, modality, patientId, studyInstanceUid);
    }
  }
}
