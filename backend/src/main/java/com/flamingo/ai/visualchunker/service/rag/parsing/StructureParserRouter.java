package com.flamingo.ai.visualchunker.service.rag.parsing;

import com.flamingo.ai.visualchunker.exception.StructureParseException;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentStructure;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentType;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a {@link DocumentType} to the {@link StructureParser} that supports it.
 *
 * <p>Parsing never fails: when the selected parser throws, the content is re-parsed by {@link
 * FlatTextStructureParser} and the fallback is counted in {@code chunking.structure.fallbacks}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructureParserRouter {

  private final List<StructureParser> parsers;
  private final FlatTextStructureParser flatTextParser;
  private final MeterRegistry meterRegistry;

  /**
   * Parses content with the parser registered for {@code documentType}.
   *
   * @param content full extracted text
   * @param documentType declared type; {@code null} is treated as {@link DocumentType#FLAT}
   * @return detected structure
   */
  public DocumentStructure parse(String content, DocumentType documentType) {
    DocumentType type = documentType != null ? documentType : DocumentType.FLAT;
    StructureParser parser = route(type);
    try {
      return parser.parse(content);
    } catch (StructureParseException e) {
      log.warn(
          "{} could not parse {} content, falling back to flat paragraphs: {}",
          parser.getClass().getSimpleName(),
          e.getDocumentType(),
          e.getMessage());
      return fallback(content, type);
    } catch (RuntimeException e) {
      log.warn(
          "{} failed unexpectedly on {} content, falling back to flat paragraphs",
          parser.getClass().getSimpleName(),
          type,
          e);
      return fallback(content, type);
    }
  }

  private StructureParser route(DocumentType type) {
    return parsers.stream().filter(p -> p.supports(type)).findFirst().orElse(flatTextParser);
  }

  private DocumentStructure fallback(String content, DocumentType type) {
    meterRegistry.counter("chunking.structure.fallbacks", "type", type.name()).increment();
    return flatTextParser.parse(content);
  }
}
