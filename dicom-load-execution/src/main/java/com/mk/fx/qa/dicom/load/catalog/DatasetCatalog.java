package com.mk.fx.qa.dicom.load.catalog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Discovers DICOM payloads below a root directory and offers the classification and sampling
 * queries scenarios are built from.
 *
 * <p>Discovery is a read-only walk: files are never opened for writing and only their headers are
 * read. All results are ordered by path so that identical trees and seeds give identical payload
 * sequences across runs.
 */
@Slf4j
public class DatasetCatalog {

  private static final Set<String> EXTENSIONS = Set.of(".dcm", ".dicom");

  private final SizeThresholds thresholds;
  private final DicomHeaderReader headerReader = new DicomHeaderReader();

  public DatasetCatalog() {
    this(SizeThresholds.defaults());
  }

  public DatasetCatalog(SizeThresholds thresholds) {
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
  }

  public SizeThresholds thresholds() {
    return thresholds;
  }

  /**
   * Recursively scans {@code root} for DICOM files.
   *
   * <p>A file qualifies if its name ends in {@code .dcm} or {@code .dicom} or if it carries the
   * Part 10 magic. Qualifying files whose header cannot be parsed are logged and skipped.
   *
   * @param root directory to scan
   * @return descriptors ordered by path
   * @throws CatalogException if root is not a readable directory or holds no usable file
   */
  public Set<PayloadDescriptor> discover(Path root) {
    Objects.requireNonNull(root, "root");
    if (!Files.isDirectory(root)) {
      throw new CatalogException("Dataset root does not exist or is not a directory: " + root);
    }

    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    } catch (IOException | UncheckedIOException ex) {
      throw new CatalogException("Failed to scan dataset root " + root, ex);
    }

    Set<PayloadDescriptor> descriptors = new LinkedHashSet<>();
    int skipped = 0;
    for (Path file : files) {
      try {
        if (!isCandidate(file)) {
          continue;
        }
        descriptors.add(describe(file));
      } catch (IOException ex) {
        skipped++;
        log.warn("Skipping unreadable DICOM file {}: {}", file, ex.getMessage());
      }
    }

    if (descriptors.isEmpty()) {
      throw new CatalogException("No DICOM files found under " + root);
    }
    log.info(
        "Discovered {} DICOM payloads under {} ({} skipped, {} files scanned)",
        descriptors.size(),
        root,
        skipped,
        files.size());
    return Collections.unmodifiableSet(descriptors);
  }

  /**
   * Groups descriptors by size bucket and by modality. Every descriptor appears in exactly one
   * size category and one modality category; lists are ordered by path.
   */
  public Map<PayloadCategory, List<PayloadDescriptor>> classify(
      Collection<PayloadDescriptor> descriptors) {
    Objects.requireNonNull(descriptors, "descriptors");
    Map<PayloadCategory, List<PayloadDescriptor>> groups = new TreeMap<>();
    for (PayloadDescriptor descriptor : sortedByPath(descriptors)) {
      groups
          .computeIfAbsent(
              PayloadCategory.size(thresholds.bucketOf(descriptor.sizeBytes())),
              k -> new ArrayList<>())
          .add(descriptor);
      groups
          .computeIfAbsent(
              PayloadCategory.modality(descriptor.modalityOrUnknown()), k -> new ArrayList<>())
          .add(descriptor);
    }
    Map<PayloadCategory, List<PayloadDescriptor>> result = new TreeMap<>();
    groups.forEach((category, members) -> result.put(category, List.copyOf(members)));
    return Collections.unmodifiableMap(result);
  }

  /**
   * Draws {@code count} descriptors in a seeded, reproducible order.
   *
   * @throws InsufficientDataException if fewer than {@code count} descriptors are available
   */
  public List<PayloadDescriptor> sample(
      Collection<PayloadDescriptor> descriptors, int count, long seed) {
    Objects.requireNonNull(descriptors, "descriptors");
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0, was " + count);
    }
    if (count > descriptors.size()) {
      throw new InsufficientDataException(
          String.format(
              Locale.ROOT,
              "Requested %d payloads but only %d are available",
              count,
              descriptors.size()),
          count,
          descriptors.size());
    }
    List<PayloadDescriptor> shuffled = sortedByPath(descriptors);
    Collections.shuffle(shuffled, new Random(seed));
    return List.copyOf(shuffled.subList(0, count));
  }

  /**
   * Discovers payloads under {@code root} and narrows them according to {@code selection}.
   *
   * @throws CatalogException if discovery fails
   * @throws InsufficientDataException if the category is empty or the sample is too large
   */
  public List<PayloadDescriptor> select(Path root, PayloadSelection selection) {
    Objects.requireNonNull(selection, "selection");
    List<PayloadDescriptor> candidates = sortedByPath(discover(root));

    if (selection.category() != null) {
      var category = PayloadCategory.parse(selection.category());
      candidates = classify(candidates).getOrDefault(category, List.of());
      if (candidates.isEmpty()) {
        throw new InsufficientDataException(
            "No payloads in category " + category + " under " + root, 1, 0);
      }
    }
    if (selection.sampleSize() != null) {
      candidates = sample(candidates, selection.sampleSize(), selection.seed());
    }
    log.info("Selected {} payloads from {} using {}", candidates.size(), root, selection);
    return List.copyOf(candidates);
  }

  private boolean isCandidate(Path file) throws IOException {
    var name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    for (String extension : EXTENSIONS) {
      if (name.endsWith(extension)) {
        return true;
      }
    }
    return headerReader.hasPart10Magic(file);
  }

  private PayloadDescriptor describe(Path file) throws IOException {
    long size = Files.size(file);
    DicomHeader header = headerReader.read(file);
    return new PayloadDescriptor(
        file,
        size,
        header.modality(),
        header.sopClassUid(),
        header.sopInstanceUid(),
        header.patientId(),
        header.studyInstanceUid());
  }

  private static List<PayloadDescriptor> sortedByPath(Collection<PayloadDescriptor> descriptors) {
    List<PayloadDescriptor> sorted = new ArrayList<>(descriptors);
    sorted.sort(PayloadDescriptor.BY_PATH);
    return sorted;
  }
}
