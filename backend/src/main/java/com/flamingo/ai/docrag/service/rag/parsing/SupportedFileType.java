package com.flamingo.ai.docrag.service.rag.parsing;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/** File extensions accepted for upload, with their display labels. */
public enum SupportedFileType {
  PDF(".pdf", "PDF"),
  DOCX(".docx", "Word Document"),
  PPTX(".pptx", "PowerPoint"),
  XLSX(".xlsx", "Excel"),
  MARKDOWN(".md", "Markdown"),
  HTML(".html", "HTML"),
  HTM(".htm", "HTML"),
  CSV(".csv", "CSV"),
  TXT(".txt", "Text");

  private final String extension;
  private final String label;

  SupportedFileType(String extension, String label) {
    this.extension = extension;
    this.label = label;
  }

  public String getExtension() {
    return extension;
  }

  public String getLabel() {
    return label;
  }

  /** Resolves a file name by its extension, case-insensitively. */
  public static Optional<SupportedFileType> fromFileName(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0) {
      return Optional.empty();
    }
    String ext = fileName.substring(dot).toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.extension.equals(ext)).findFirst();
  }

  public static String describeSupported() {
    return Arrays.stream(values())
        .map(SupportedFileType::getExtension)
        .collect(Collectors.joining(", "));
  }
}
