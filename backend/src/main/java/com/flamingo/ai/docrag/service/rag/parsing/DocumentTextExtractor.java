package com.flamingo.ai.docrag.service.rag.parsing;

import com.flamingo.ai.docrag.exception.ValidationException;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * Extracts plain text from uploaded files with Apache Tika's {@link AutoDetectParser}.
 *
 * <p>The result is normalized before chunking: line endings become {@code \n}, runs of three or
 * more newlines collapse to a blank line, and surrounding whitespace is stripped.
 */
@Component
@Slf4j
public class DocumentTextExtractor {

  private static final Pattern LINE_ENDINGS = Pattern.compile("\\r\\n?");
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

  private final AutoDetectParser parser = new AutoDetectParser();

  /**
   * Extracts and normalizes the text of a file.
   *
   * @param inputStream the file content
   * @param fileName the original file name, used as a type hint
   * @return the normalized text, possibly empty
   * @throws ValidationException if the file cannot be parsed
   */
  @Timed(value = "document.extract", description = "Time to extract document text")
  public String extract(InputStream inputStream, String fileName) {
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    if (fileName != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    }
    try {
      parser.parse(inputStream, handler, metadata, new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      log.error("Text extraction failed for {}: {}", fileName, e.getMessage());
      throw new ValidationException("Could not read file " + fileName + ": " + e.getMessage());
    }

    String text = normalize(handler.toString());
    log.debug(
        "Extracted {} chars from {} (detected type {})",
        text.length(),
        fileName,
        metadata.get(Metadata.CONTENT_TYPE));
    return text;
  }

  static String normalize(String raw) {
    String text = LINE_ENDINGS.matcher(raw).replaceAll("\n");
    text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
    return text.strip();
  }
}
