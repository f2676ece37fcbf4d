package com.mk.fx.qa.dicom.load.catalog;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;

/**
 * Reads the handful of identifying attributes the catalog needs from a DICOM file without
 * touching bulk data.
 *
 * <p>Handles Part 10 files (preamble, {@code DICM} magic, explicit VR file meta group) with an
 * explicit or implicit VR little endian dataset, and raw implicit VR datasets without a preamble.
 * Parsing stops at the first tag past Study Instance UID, so pixel data is never read. Datasets in
 * other transfer syntaxes yield a header carrying only the transfer syntax.
 */
final class DicomHeaderReader {

  static final int PREAMBLE_LENGTH = 128;
  private static final byte[] MAGIC = {'D', 'I', 'C', 'M'};

  static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
  static final String EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1";
  private static final String DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1.99";
  private static final String EXPLICIT_VR_BIG_ENDIAN = "1.2.840.10008.1.2.2";

  private static final int META_GROUP = 0x0002;
  private static final int TRANSFER_SYNTAX_UID = 0x00020010;
  private static final int SOP_CLASS_UID = 0x00080016;
  private static final int SOP_INSTANCE_UID = 0x00080018;
  private static final int MODALITY = 0x00080060;
  private static final int PATIENT_ID = 0x00100020;
  private static final int STUDY_INSTANCE_UID = 0x0020000D;

  private static final int ITEM = 0xFFFEE000;
  private static final int ITEM_DELIMITATION = 0xFFFEE00D;
  private static final int SEQUENCE_DELIMITATION = 0xFFFEE0DD;
  private static final int UNDEFINED_LENGTH = 0xFFFFFFFF;

  private static final int MAX_VALUE_LENGTH = 1024;

  // VRs whose explicit encoding carries two reserved bytes and a 32-bit length.
  private static final Set<String> LONG_FORM_VRS =
      Set.of("OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV");

  /** Returns true if the file carries the Part 10 {@code DICM} magic after the preamble. */
  boolean hasPart10Magic(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      byte[] head = in.readNBytes(PREAMBLE_LENGTH + MAGIC.length);
      return head.length == PREAMBLE_LENGTH + MAGIC.length
          && Arrays.equals(head, PREAMBLE_LENGTH, head.length, MAGIC, 0, MAGIC.length);
    }
  }

  DicomHeader read(Path file) throws IOException {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
      in.mark(PREAMBLE_LENGTH + MAGIC.length);
      byte[] head = in.readNBytes(PREAMBLE_LENGTH + MAGIC.length);
      boolean part10 =
          head.length == PREAMBLE_LENGTH + MAGIC.length
              && Arrays.equals(head, PREAMBLE_LENGTH, head.length, MAGIC, 0, MAGIC.length);
      if (!part10) {
        in.reset();
      }

      var header = new DicomHeader.Builder();
      String transferSyntax = readMetaGroup(in, header);
      if (transferSyntax == null) {
        if (part10) {
          throw new IOException("File meta group carries no transfer syntax: " + file);
        }
        transferSyntax = IMPLICIT_VR_LITTLE_ENDIAN;
      }
      header.transferSyntaxUid(transferSyntax);

      if (transferSyntax.equals(EXPLICIT_VR_BIG_ENDIAN)
          || transferSyntax.equals(DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN)) {
        return header.build();
      }
      boolean explicitVr = !transferSyntax.equals(IMPLICIT_VR_LITTLE_ENDIAN);
      if (!part10) {
        requirePlausibleRawDataset(in, file);
      }
      readDataset(in, explicitVr, header);
      return header.build();
    }
  }

  /** Reads group 0002 (always explicit VR little endian) and returns its transfer syntax. */
  private String readMetaGroup(InputStream in, DicomHeader.Builder header) throws IOException {
    String transferSyntax = null;
    while (true) {
      in.mark(4);
      int tag;
      try {
        tag = readTag(in);
      } catch (EOFException eof) {
        return transferSyntax;
      }
      if ((tag >>> 16) != META_GROUP) {
        in.reset();
        return transferSyntax;
      }
      String vr = readVr(in);
      long length = readLength(in, vr);
      if (tag == TRANSFER_SYNTAX_UID) {
        transferSyntax = readString(in, length);
      } else {
        skip(in, length);
      }
    }
  }

  private void requirePlausibleRawDataset(InputStream in, Path file) throws IOException {
    in.mark(2);
    int group = readUInt16(in);
    in.reset();
    if (group != 0x0008) {
      throw new IOException("Not a DICOM file (no preamble, first group " + hex(group) + "): " + file);
    }
  }

  private void readDataset(InputStream in, boolean explicitVr, DicomHeader.Builder header)
      throws IOException {
    try {
      while (true) {
        int tag = readTag(in);
        if (Integer.compareUnsigned(tag, STUDY_INSTANCE_UID) > 0) {
          return;
        }
        String vr = explicitVr ? readVr(in) : null;
        long length = explicitVr ? readLength(in, vr) : readUInt32(in);
        if (length == Integer.toUnsignedLong(UNDEFINED_LENGTH)) {
          skipUndefinedSequence(in, explicitVr);
          continue;
        }
        switch (tag) {
          case SOP_CLASS_UID -> header.sopClassUid(readString(in, length));
          case SOP_INSTANCE_UID -> header.sopInstanceUid(readString(in, length));
          case MODALITY -> header.modality(readString(in, length));
          case PATIENT_ID -> header.patientId(readString(in, length));
          case STUDY_INSTANCE_UID -> {
            header.studyInstanceUid(readString(in, length));
            return;
          }
          default -> skip(in, length);
        }
      }
    } catch (EOFException eof) {
      // dataset ended before Study Instance UID; keep what was found
      return;
    }
  }

  private void skipUndefinedSequence(InputStream in, boolean explicitVr) throws IOException {
    while (true) {
      int tag = readTag(in);
      long length = readUInt32(in);
      if (tag == SEQUENCE_DELIMITATION) {
        return;
      }
      if (tag != ITEM) {
        throw new IOException("Malformed sequence: expected item, found " + hex(tag));
      }
      if (length == Integer.toUnsignedLong(UNDEFINED_LENGTH)) {
        skipUndefinedItem(in, explicitVr);
      } else {
        skip(in, length);
      }
    }
  }

  private void skipUndefinedItem(InputStream in, boolean explicitVr) throws IOException {
    while (true) {
      int tag = readTag(in);
      if (tag == ITEM_DELIMITATION) {
        readUInt32(in);
        return;
      }
      String vr = explicitVr ? readVr(in) : null;
      long length = explicitVr ? readLength(in, vr) : readUInt32(in);
      if (length == Integer.toUnsignedLong(UNDEFINED_LENGTH)) {
        skipUndefinedSequence(in, explicitVr);
      } else {
        skip(in, length);
      }
    }
  }

  private static int readTag(InputStream in) throws IOException {
    int group = readUInt16(in);
    int element = readUInt16(in);
    return (group << 16) | element;
  }

  private static String readVr(InputStream in) throws IOException {
    byte[] vr = in.readNBytes(2);
    if (vr.length < 2) {
      throw new EOFException();
    }
    return new String(vr, StandardCharsets.US_ASCII);
  }

  private static long readLength(InputStream in, String vr) throws IOException {
    if (LONG_FORM_VRS.contains(vr)) {
      readUInt16(in);
      return readUInt32(in);
    }
    return readUInt16(in);
  }

  private static String readString(InputStream in, long length) throws IOException {
    if (length > MAX_VALUE_LENGTH) {
      skip(in, length);
      return null;
    }
    byte[] value = in.readNBytes((int) length);
    if (value.length < length) {
      throw new EOFException();
    }
    var text = new String(value, StandardCharsets.US_ASCII);
    int end = text.length();
    while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\0')) {
      end--;
    }
    var trimmed = text.substring(0, end).trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static void skip(InputStream in, long length) throws IOException {
    in.skipNBytes(length);
  }

  private static int readUInt16(InputStream in) throws IOException {
    int b0 = in.read();
    int b1 = in.read();
    if ((b0 | b1) < 0) {
      throw new EOFException();
    }
    return b0 | (b1 << 8);
  }

  private static long readUInt32(InputStream in) throws IOException {
    long low = readUInt16(in);
    long high = readUInt16(in);
    return low | (high << 16);
  }

  private static String hex(int value) {
    return String.format("%08X", value);
  }
}
