package com.flamingo.ai.site2rag.service.enrichment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.site2rag.config.EnrichmentConfig;
import com.flamingo.ai.site2rag.service.enrichment.model.ContentBlock;
import com.flamingo.ai.site2rag.service.enrichment.model.Window;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WindowPlanner Tests")
class WindowPlannerTest {

  private EnrichmentConfig config;
  private WindowPlanner planner;

  @BeforeEach
  void setUp() {
    config = new EnrichmentConfig();
    planner = new WindowPlanner(config);
  }

  @Nested
  @DisplayName("calculateCapacity")
  class CalculateCapacity {

    @Test
    @DisplayName("should clamp large contexts to the maximum window size")
    void shouldClampToMaximum_whenContextIsLarge() {
      assertThat(planner.calculateCapacity("gpt-4o")).isEqualTo(5000);
    }

    @Test
    @DisplayName("should derive capacity from utilization, reserve and words per token")
    void shouldComputeCapacity_whenWithinBounds() {
      // (8192 * 0.8 - 1500) * 0.75 = 3790.2
      assertThat(planner.calculateCapacity("gpt-4")).isEqualTo(3790);
    }

    @Test
    @DisplayName("should use the default context for unknown or missing models")
    void shouldUseDefaultContext_whenModelUnknown() {
      assertThat(planner.calculateCapacity("some-local-model")).isEqualTo(3790);
      assertThat(planner.calculateCapacity(null)).isEqualTo(3790);
    }

    @Test
    @DisplayName("should clamp small contexts to the minimum window size")
    void shouldClampToMinimum_whenContextIsSmall() {
      config.getWindow().setDefaultContextTokens(2000);

      assertThat(planner.calculateCapacity("tiny")).isEqualTo(1000);
    }

    @Test
    @DisplayName("should prefer the longest matching model fragment")
    void shouldPreferLongestFragment_whenSeveralMatch() {
      assertThat(planner.resolveContextTokens("gpt-4-turbo-preview")).isEqualTo(128_000);
      assertThat(planner.resolveContextTokens("GPT-4o-mini")).isEqualTo(128_000);
      assertThat(planner.resolveContextTokens("gpt-4-0613")).isEqualTo(8_192);
    }
  }

  @Nested
  @DisplayName("planWindows")
  class PlanWindows {

    @Test
    @DisplayName("should plan two windows for five 200-word blocks at capacity 800")
    void shouldPlanTwoWindows_whenFiveBlocksExceedCapacity() {
      List<ContentBlock> blocks = TestBlocks.keyed(200, 200, 200, 200, 200);

      List<Window> windows = planner.planWindows(blocks, 800, 0.5);

      assertThat(windows).hasSize(2);
      assertThat(windows.get(0).blocks()).hasSize(4);
      assertThat(windows.get(0).wordCount()).isEqualTo(800);
      // Cumulative words from window 1's start first exceed 400 at the third block
      assertThat(windows.get(1).first().originalIndex()).isEqualTo(2);
      assertThat(windows.get(1).last().originalIndex()).isEqualTo(4);
      assertThat(windows.get(1).wordCount()).isEqualTo(600);
    }

    @Test
    @DisplayName("should return a single window when everything fits")
    void shouldReturnSingleWindow_whenDocumentFits() {
      List<Window> windows = planner.planWindows(TestBlocks.keyed(100, 100, 100), 1000, 0.5);

      assertThat(windows).hasSize(1);
      assertThat(windows.get(0).blocks()).hasSize(3);
      assertThat(windows.get(0).index()).isZero();
    }

    @Test
    @DisplayName("should return no windows for no blocks")
    void shouldReturnEmpty_whenNoBlocks() {
      assertThat(planner.planWindows(List.of(), 800, 0.5)).isEmpty();
    }

    @Test
    @DisplayName("should give an oversized block a window of its own")
    void shouldIsolateOversizedBlock_whenLargerThanCapacity() {
      List<Window> windows = planner.planWindows(TestBlocks.keyed(50, 300, 50), 100, 0.5);

      assertThat(windows).hasSize(3);
      assertThat(windows.get(1).blocks()).hasSize(1);
      assertThat(windows.get(1).wordCount()).isEqualTo(300);
    }

    @Test
    @DisplayName("should cover every block and always advance")
    void shouldCoverAllBlocks_whenManyWindows() {
      List<ContentBlock> blocks =
          TestBlocks.keyed(120, 80, 300, 40, 40, 260, 90, 150, 10, 500, 70, 220, 130);

      List<Window> windows = planner.planWindows(blocks, 600, 0.5);

      Set<String> covered = new LinkedHashSet<>();
      windows.forEach(window -> window.blocks().forEach(block -> covered.add(block.key())));
      assertThat(covered)
          .containsExactlyElementsOf(blocks.stream().map(ContentBlock::key).toList());

      for (int i = 1; i < windows.size(); i++) {
        Window previous = windows.get(i - 1);
        Window current = windows.get(i);
        assertThat(current.first().originalIndex()).isGreaterThan(previous.first().originalIndex());
        assertThat(current.first().originalIndex())
            .isLessThanOrEqualTo(previous.last().originalIndex() + 1);
        assertThat(current.index()).isEqualTo(i);
      }
    }

    @Test
    @DisplayName("should not overlap when the overlap fraction is zero")
    void shouldNotOverlap_whenFractionIsZero() {
      List<Window> windows = planner.planWindows(TestBlocks.keyed(200, 200, 200, 200, 200), 400, 0);

      assertThat(windows).hasSize(3);
      assertThat(windows.get(1).first().originalIndex()).isEqualTo(2);
      assertThat(windows.get(2).first().originalIndex()).isEqualTo(4);
    }

    @Test
    @DisplayName("should reject invalid capacity and overlap")
    void shouldReject_whenArgumentsInvalid() {
      List<ContentBlock> blocks = TestBlocks.keyed(10);

      assertThatThrownBy(() -> planner.planWindows(blocks, 0, 0.5))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> planner.planWindows(blocks, 100, 1.0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
