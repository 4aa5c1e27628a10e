package com.flamingo.ai.visualchunker.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.visualchunker.config.ChunkingProperties;
import com.flamingo.ai.visualchunker.exception.ChunkingPipelineException;
import com.flamingo.ai.visualchunker.service.rag.chunking.AdaptiveSizeOptimizer;
import com.flamingo.ai.visualchunker.service.rag.chunking.ChunkSplitter;
import com.flamingo.ai.visualchunker.service.rag.chunking.MetadataAggregator;
import com.flamingo.ai.visualchunker.service.rag.chunking.SemanticBoundaryOptimizer;
import com.flamingo.ai.visualchunker.service.rag.model.BoundingBox;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.ChunkingResult;
import com.flamingo.ai.visualchunker.service.rag.model.DocumentType;
import com.flamingo.ai.visualchunker.service.rag.model.FinalChunk;
import com.flamingo.ai.visualchunker.service.rag.model.SourceDocument;
import com.flamingo.ai.visualchunker.service.rag.model.VisualElement;
import com.flamingo.ai.visualchunker.service.rag.model.VisualType;
import com.flamingo.ai.visualchunker.service.rag.parsing.FlatTextStructureParser;
import com.flamingo.ai.visualchunker.service.rag.parsing.MarkupStructureParser;
import com.flamingo.ai.visualchunker.service.rag.parsing.PaginatedStructureParser;
import com.flamingo.ai.visualchunker.service.rag.parsing.ParagraphStructureParser;
import com.flamingo.ai.visualchunker.service.rag.parsing.StructureParserRouter;
import com.flamingo.ai.visualchunker.service.rag.visual.PageProximityMatcher;
import com.flamingo.ai.visualchunker.service.rag.visual.SpatialProximityMatcher;
import com.flamingo.ai.visualchunker.service.rag.visual.TextualRelevanceMatcher;
import com.flamingo.ai.visualchunker.service.rag.visual.VisualContextEnhancer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("VisualContextChunkingService Tests")
class VisualContextChunkingServiceTest {

  private static final String QUARTERLY_REPORT =
      String.join(
          "\f",
          "Quarterly report for the third quarter. Key highlights follow.",
          "Revenue grew by twelve percent compared to last year.",
          "Operating costs remained flat across all regions.",
          "The Revenue Waterfall shows how each segment contributed.",
          "Headcount numbers are listed in the appendix.");

  private SimpleMeterRegistry meterRegistry;
  private ChunkingProperties properties;
  private ChunkSplitter chunkSplitter;
  private VisualContextChunkingService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    properties = new ChunkingProperties();
    chunkSplitter = new ChunkSplitter();
    service = createService(chunkSplitter);
  }

  private VisualContextChunkingService createService(ChunkSplitter splitter) {
    FlatTextStructureParser flatParser = new FlatTextStructureParser();
    StructureParserRouter router =
        new StructureParserRouter(
            List.of(
                new PaginatedStructureParser(),
                new MarkupStructureParser(),
                new ParagraphStructureParser(),
                flatParser),
            flatParser,
            meterRegistry);
    VisualContextEnhancer enhancer =
        new VisualContextEnhancer(
            List.of(
                new PageProximityMatcher(),
                new SpatialProximityMatcher(),
                new TextualRelevanceMatcher()),
            meterRegistry);
    return new VisualContextChunkingService(
        router,
        splitter,
        enhancer,
        new SemanticBoundaryOptimizer(),
        new AdaptiveSizeOptimizer(),
        new MetadataAggregator(),
        properties,
        meterRegistry);
  }

  /** 100 characters, one sentence. */
  private static String units(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> String.format("Sentence %02d ", i) + "alpha ".repeat(14) + "ok. ")
        .collect(Collectors.joining());
  }

  private static List<VisualElement> loadVisuals() throws IOException {
    try (InputStream in =
        VisualContextChunkingServiceTest.class.getResourceAsStream(
            "/fixtures/quarterly-report-visuals.json")) {
      return new ObjectMapper().readValue(in, new TypeReference<List<VisualElement>>() {});
    }
  }

  @Nested
  @DisplayName("Plain text documents")
  class PlainText {

    @Test
    void shouldChunkFlatText_intoOverlappingChunks() {
      String content = units(25);

      ChunkingResult result =
          service.chunkDocument(
              new SourceDocument("notes.txt", content, DocumentType.FLAT), List.of());

      assertThat(result.chunks()).hasSize(3);
      assertThat(result.chunks()).extracting(FinalChunk::startIndex).containsExactly(0, 849, 1649);
      assertThat(result.metadata().totalChunks()).isEqualTo(3);
      assertThat(result.metadata().averageChunkSize()).isEqualTo(933);
      assertThat(result.metadata().visualContextChunks()).isZero();
      assertThat(result.metadata().pageDistribution()).isEmpty();
      assertThat(result.chunks()).allMatch(c -> c.length() <= 1000);
    }

    @Test
    void shouldCoverTheWholeDocument_withoutGaps() {
      String content = units(25);

      List<FinalChunk> chunks =
          service.chunkDocument(SourceDocument.of("notes.txt", content, "txt"), null).chunks();

      assertThat(chunks.get(0).startIndex()).isZero();
      assertThat(chunks.get(chunks.size() - 1).endIndex()).isEqualTo(content.strip().length());
      for (int i = 1; i < chunks.size(); i++) {
        assertThat(chunks.get(i).startIndex()).isLessThanOrEqualTo(chunks.get(i - 1).endIndex());
      }
    }

    @Test
    void shouldProduceIdenticalChunks_forIdenticalInput() {
      SourceDocument document = new SourceDocument("notes.txt", units(25), DocumentType.FLAT);

      List<FinalChunk> first = service.chunkDocument(document, List.of()).chunks();
      List<FinalChunk> second = service.chunkDocument(document, List.of()).chunks();

      assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldReturnNoChunks_forEmptyContent() {
      ChunkingResult result =
          service.chunkDocument(new SourceDocument("empty.txt", "", DocumentType.FLAT), null);

      assertThat(result.chunks()).isEmpty();
      assertThat(result.metadata().averageChunkSize()).isZero();
    }

    @Test
    void shouldUseConfiguredDefaults_whenNoOptionsGiven() {
      properties.setMaxChunkSize(400);
      properties.setMinChunkSize(100);
      properties.setOverlapSize(50);

      ChunkingResult result =
          service.chunkDocument(
              new SourceDocument("notes.txt", units(25), DocumentType.FLAT), List.of());

      assertThat(result.chunks()).hasSizeGreaterThan(5);
      assertThat(result.chunks()).allMatch(c -> c.length() <= 400 * 1.2);
    }
  }

  @Nested
  @DisplayName("Paginated documents")
  class Paginated {

    @Test
    void shouldKeepChunksWithinPages() {
      String content = units(15) + "\f" + units(15);

      ChunkingResult result =
          service.chunkDocument(SourceDocument.of("report.pdf", content, "pdf"), List.of());

      assertThat(result.chunks()).extracting(FinalChunk::pageNumber).containsExactly(1, 1, 2, 2);
      assertThat(result.metadata().pageDistribution()).containsExactly(entry(1, 2), entry(2, 2));
      assertThat(result.chunks()).allMatch(c -> c.endIndex() <= 1500 || c.startIndex() > 1500);
    }

    @Test
    void shouldAttachVisualsFromFixture_byPageAndText() throws IOException {
      List<VisualElement> visuals = loadVisuals();

      ChunkingResult result =
          service.chunkDocument(
              new SourceDocument("q3-report.pdf", QUARTERLY_REPORT, DocumentType.PAGINATED),
              visuals);

      assertThat(result.chunks()).extracting(FinalChunk::pageNumber).containsExactly(1, 2, 3, 4, 5);
      assertThat(result.chunks())
          .extracting(FinalChunk::visualReferences)
          .containsExactly(
              List.of("chart-1"),
              List.of("chart-1"),
              List.of("chart-1"),
              List.of("table-1", "image-1"),
              List.of("table-1"));
      assertThat(result.metadata().visualContextChunks()).isEqualTo(5);
      assertThat(result.metadata().pageDistribution()).hasSize(5);
      // every page chunk is short, so importance is capped
      assertThat(result.chunks()).allMatch(c -> c.context().importance() <= 0.5);
    }

    @Test
    void shouldNotAttachCentredVisual_toDistantPages() {
      String content =
          IntStream.rangeClosed(1, 5)
              .mapToObj(page -> "Body text of page " + page + ".")
              .collect(Collectors.joining("\f"));
      VisualElement chart =
          new VisualElement(
              "p5-chart", VisualType.CHART, 5, new BoundingBox(200, 350, 200, 150), null, null, 1);

      ChunkingResult result =
          service.chunkDocument(
              new SourceDocument("report.pdf", content, DocumentType.PAGINATED), List.of(chart));

      assertThat(result.chunks()).extracting(FinalChunk::pageNumber).containsExactly(1, 2, 3, 4, 5);
      assertThat(result.chunks())
          .extracting(FinalChunk::visualReferences)
          .containsExactly(
              List.of(), List.of(), List.of(), List.of("p5-chart"), List.of("p5-chart"));
    }

    @Test
    void shouldSkipMalformedVisuals_withoutFailing() throws IOException {
      List<VisualElement> visuals = new ArrayList<>(loadVisuals());
      visuals.add(new VisualElement("broken", VisualType.OTHER, -3, null, null, null, 0.1));
      visuals.add(
          new VisualElement(
              "nan", VisualType.OTHER, null, new BoundingBox(Double.NaN, 0, 1, 1), null, null, 0));

      ChunkingResult result =
          service.chunkDocument(
              new SourceDocument("q3-report.pdf", QUARTERLY_REPORT, DocumentType.PAGINATED),
              visuals);

      assertThat(result.chunks()).hasSize(5);
      assertThat(result.chunks())
          .allSatisfy(c -> assertThat(c.visualReferences()).doesNotContain("broken", "nan"));
      assertThat(meterRegistry.counter("chunking.visuals.skipped").count()).isEqualTo(10.0);
    }

    @Test
    void shouldIgnoreNullVisualEntries() {
      VisualElement image = new VisualElement("v", VisualType.IMAGE, 1, null, null, null, 1);

      ChunkingResult result =
          service.chunkDocument(
              new SourceDocument("q3-report.pdf", QUARTERLY_REPORT, DocumentType.PAGINATED),
              Arrays.asList(null, image));

      assertThat(result.chunks().get(0).visualReferences()).containsExactly("v");
    }
  }

  @Nested
  @DisplayName("Markup documents")
  class Markup {

    @Test
    void shouldChunkPerSection() {
      String html = "<h1>Summary</h1>Revenue is up.<h2>Costs</h2>Costs are flat.";

      ChunkingResult result =
          service.chunkDocument(SourceDocument.of("report.html", html, "text/html"), List.of());

      assertThat(result.chunks())
          .extracting(FinalChunk::sectionTitle)
          .containsExactly("Summary", "Costs");
      assertThat(result.chunks()).allMatch(c -> c.pageNumber() == null);
    }

    @Test
    void shouldFallBackToFlatText_whenMarkupIsMalformed() {
      String html = "<h1>Summary\n\n<p>Revenue is up.</p>";

      ChunkingResult result =
          service.chunkDocument(SourceDocument.of("report.html", html, "html"), List.of());

      assertThat(result.chunks()).isNotEmpty();
      assertThat(result.chunks()).allMatch(c -> c.sectionIndex() == null);
      assertThat(
              meterRegistry.counter("chunking.structure.fallbacks", "type", "MARKUP").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Office documents")
  class Structured {

    @Test
    @DisplayName("should merge a sentence that continues into the next paragraph")
    void shouldMergeSentence_spanningParagraphs() {
      String content = "Revenue grew in every region,\n\nwhich the board welcomed.";

      ChunkingResult result =
          service.chunkDocument(
              new SourceDocument("minutes.docx", content, DocumentType.STRUCTURED), List.of());

      assertThat(result.chunks()).hasSize(1);
      FinalChunk chunk = result.chunks().get(0);
      assertThat(chunk.content())
          .isEqualTo("Revenue grew in every region, which the board welcomed.");
      assertThat(chunk.sectionIndex()).isZero();
      assertThat(chunk.sectionTitle()).isEqualTo("Section 1");
      assertThat(chunk.startIndex()).isZero();
      assertThat(chunk.endIndex()).isEqualTo(content.length());
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    void shouldThrow_whenContentIsMissing() {
      SourceDocument document = new SourceDocument("missing.pdf", null, DocumentType.PAGINATED);

      assertThatThrownBy(() -> service.chunkDocument(document, List.of()))
          .isInstanceOf(ChunkingPipelineException.class)
          .hasMessageContaining("no content");
      assertThat(meterRegistry.counter("chunking.failures").count()).isEqualTo(1.0);
    }

    @Test
    void shouldThrow_whenOptionsAreMissing() {
      SourceDocument document = new SourceDocument("a.txt", "text", DocumentType.FLAT);

      assertThatThrownBy(() -> service.chunkDocument(document, List.of(), null))
          .isInstanceOf(ChunkingPipelineException.class);
    }

    @Test
    void shouldWrapUnexpectedStageFailures() {
      ChunkSplitter failingSplitter = mock(ChunkSplitter.class);
      when(failingSplitter.split(anyString(), any(), any()))
          .thenThrow(new IllegalStateException("boom"));
      VisualContextChunkingService failingService = createService(failingSplitter);
      SourceDocument document = new SourceDocument("a.txt", "Some text.", DocumentType.FLAT);

      assertThatThrownBy(
              () -> failingService.chunkDocument(document, List.of(), ChunkingOptions.defaults()))
          .isInstanceOf(ChunkingPipelineException.class)
          .hasMessageContaining("boom")
          .hasCauseInstanceOf(IllegalStateException.class)
          .satisfies(
              e -> {
                ChunkingPipelineException ex = (ChunkingPipelineException) e;
                assertThat(ex.getDocumentName()).isEqualTo("a.txt");
                assertThat(ex.getUserMessage()).isEqualTo("Failed to chunk document");
              });
      assertThat(meterRegistry.counter("chunking.failures").count()).isEqualTo(1.0);
    }
  }
}
