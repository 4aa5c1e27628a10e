package com.flamingo.ai.visualchunker.service.rag.chunking;

import static com.flamingo.ai.visualchunker.service.rag.chunking.ChunkFixtures.chunk;
import static com.flamingo.ai.visualchunker.service.rag.chunking.ChunkFixtures.withScores;
import static com.flamingo.ai.visualchunker.service.rag.chunking.ChunkFixtures.withVisuals;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.visualchunker.service.rag.model.ChunkingOptions;
import com.flamingo.ai.visualchunker.service.rag.model.FinalChunk;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AdaptiveSizeOptimizer Tests")
class AdaptiveSizeOptimizerTest {

  private AdaptiveSizeOptimizer optimizer;
  private ChunkingOptions options;

  @BeforeEach
  void setUp() {
    optimizer = new AdaptiveSizeOptimizer();
    options = ChunkingOptions.defaults();
  }

  @Test
  @DisplayName("should shrink the optimal size for dense and hard-to-read chunks")
  void shouldShrinkOptimalSize_forDenseAndHardToReadChunks() {
    FinalChunk base = chunk("chunk_0", "text", 0, 4);

    assertThat(optimizer.optimalSize(withScores(base, 0.0, 1.0), options)).isEqualTo(1000);
    assertThat(optimizer.optimalSize(withScores(base, 0.6, 1.0), options)).isEqualTo(800);
    assertThat(optimizer.optimalSize(withScores(base, 0.0, 0.2), options)).isEqualTo(700);
    assertThat(optimizer.optimalSize(withScores(base, 0.6, 0.2), options)).isEqualTo(560);
  }

  @Test
  @DisplayName("should never shrink the optimal size below the minimum chunk size")
  void shouldNotShrinkBelowMinimum() {
    ChunkingOptions highMinimum = options.toBuilder().minChunkSize(700).build();
    FinalChunk dense = withScores(chunk("chunk_0", "text", 0, 4), 0.9, 0.1);

    assertThat(optimizer.optimalSize(dense, highMinimum)).isEqualTo(700);
  }

  @Test
  @DisplayName("should split an oversized visual-dense chunk into sub-chunks")
  void shouldSplitOversizedChunk() {
    String doc = ChunkSplitterTest.units(10) + ChunkSplitterTest.units(13);
    String text = doc.substring(1000).strip();
    FinalChunk dense =
        withScores(
            withVisuals(chunk("chunk_3", text, 1000, 1000 + text.length()), 0.8, "chart-1"),
            0.9,
            1.0);

    List<FinalChunk> result = optimizer.optimize(List.of(dense), doc, options);

    assertThat(result).extracting(FinalChunk::id).containsExactly("chunk_3_0", "chunk_3_1");
    assertThat(result).allMatch(c -> c.length() <= 800);
    assertThat(result).extracting(FinalChunk::startIndex).containsExactly(1000, 1649);
    assertThat(result).extracting(FinalChunk::endIndex).containsExactly(1799, 2299);
    assertThat(result)
        .allSatisfy(
            c -> {
              assertThat(c.visualReferences()).containsExactly("chart-1");
              assertThat(c.context().importance()).isEqualTo(0.8);
              assertThat(c.tokenCountEstimate()).isPositive();
            });
  }

  @Test
  @DisplayName("should keep a chunk within 1.5 times the optimal size")
  void shouldKeepChunk_withinTolerance() {
    String doc = "z".repeat(1100);
    FinalChunk chunk = chunk("chunk_0", doc, 0, 1100);

    assertThat(optimizer.optimize(List.of(chunk), doc, options)).containsExactly(chunk);
  }

  @Test
  @DisplayName("should cap the importance of undersized chunks")
  void shouldCapImportance_ofUndersizedChunks() {
    FinalChunk important = withVisuals(chunk("chunk_0", "Short.", 0, 6), 0.9, "v1");
    FinalChunk minor = withVisuals(chunk("chunk_1", "Tiny.", 7, 12), 0.3);

    List<FinalChunk> result =
        optimizer.optimize(List.of(important, minor), "Short. Tiny.", options);

    assertThat(result).extracting(c -> c.context().importance()).containsExactly(0.5, 0.3);
    assertThat(result).extracting(FinalChunk::content).containsExactly("Short.", "Tiny.");
  }

  @Test
  @DisplayName("should return chunks unchanged when adaptive sizing is disabled")
  void shouldReturnUnchanged_whenDisabled() {
    ChunkingOptions disabled = options.toBuilder().adaptiveChunkSizing(false).build();
    FinalChunk small = withVisuals(chunk("chunk_0", "Short.", 0, 6), 0.9);

    assertThat(optimizer.optimize(List.of(small), "Short.", disabled)).containsExactly(small);
  }

  @Test
  @DisplayName("should cut sub-chunks from the source text of a merged chunk")
  void shouldSplitMergedChunk_atSourceOffsets() {
    String doc = "alpha beta gamma,\n\n    delta epsilon zeta eta.";
    FinalChunk merged =
        withScores(
            chunk("chunk_0", "alpha beta gamma, delta epsilon zeta eta.", 0, doc.length()),
            0.0,
            1.0);
    ChunkingOptions narrow =
        options.toBuilder().maxChunkSize(20).minChunkSize(0).overlapSize(0).build();

    List<FinalChunk> result = optimizer.optimize(List.of(merged), doc, narrow);

    assertThat(result)
        .extracting(FinalChunk::content)
        .containsExactly("alpha beta gamma,", "delta epsilon", "zeta eta.");
    assertThat(result).extracting(FinalChunk::startIndex).containsExactly(0, 20, 36);
    assertThat(result).extracting(FinalChunk::endIndex).containsExactly(20, 36, 46);
    assertThat(result)
        .allSatisfy(
            c ->
                assertThat(c.content())
                    .isEqualTo(doc.substring(c.startIndex(), c.endIndex()).strip()));
  }
}
