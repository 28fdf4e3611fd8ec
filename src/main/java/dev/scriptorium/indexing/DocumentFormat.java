package dev.scriptorium.indexing;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Document formats the backend can extract, with the parser and splitter each one needs.
 *
 * <p>Plain text and PDF are split recursively on paragraph, line and word boundaries; Markdown
 * uses the heading-aware splitter.
 */
public enum DocumentFormat {
  TXT("txt", "simpleFile", "RagSplitter_RecursiveCharacterTextSplitter", true),
  MD("md", "markdown", "RagSplitter_MarkdownSplitter", false),
  PDF("pdf", "simplePdf", "RagSplitter_RecursiveCharacterTextSplitter", true);

  private static final String RECURSIVE_SEPARATORS = "[\"\\n\\n\",\"\\n\",\" \"]";

  private final String extension;
  private final String parserType;
  private final String splitter;
  private final boolean recursiveSplit;

  DocumentFormat(String extension, String parserType, String splitter, boolean recursiveSplit) {
    this.extension = extension;
    this.parserType = parserType;
    this.splitter = splitter;
    this.recursiveSplit = recursiveSplit;
  }

  public String extension() {
    return extension;
  }

  /** Looks up a format by file extension, ignoring case and a leading dot. */
  public static Optional<DocumentFormat> fromExtension(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith(".")) {
      normalized = normalized.substring(1);
    }
    for (DocumentFormat format : values()) {
      if (format.extension.equals(normalized)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /** Environment passed to the extractor container for this format. */
  Map<String, String> extractorEnv(int chunkSize, int chunkOverlap) {
    Map<String, String> env = new LinkedHashMap<>();
    env.put("PARSER_TYPE", parserType);
    env.put("SPLITTER", splitter);
    env.put("CHUNK_SIZE", Integer.toString(chunkSize));
    env.put("CHUNK_OVERLAP", Integer.toString(chunkOverlap));
    if (recursiveSplit) {
      env.put("SEPARATORS", RECURSIVE_SEPARATORS);
      env.put("IS_SEPARATOR_REGEX", "false");
      env.put("KEEP_SEPARATOR", "KeepSeparator_None");
    }
    return env;
  }
}
