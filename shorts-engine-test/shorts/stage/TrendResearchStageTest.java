package shorts.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import shorts.generator.GeneratorException;
import shorts.generator.KeywordAnalysis;
import shorts.generator.QualityEvaluation;
import shorts.generator.TextGenerator;
import shorts.generator.TrendAnalysis;
import shorts.generator.TrendItem;
import shorts.generator.TrendSource;
import shorts.model.PipelineState;
import shorts.model.TopicSummary;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("TrendResearchStage Tests")
class TrendResearchStageTest {

    @Mock
    private TextGenerator text;
    @Mock
    private TrendSource news;
    @Mock
    private TrendSource search;

    @BeforeEach
    void setUp() {
        when(news.name()).thenReturn("news");
        when(search.name()).thenReturn("search_trends");
        when(news.fetchTrending()).thenReturn(List.of(new TrendItem("Heatwave", "https://n/1", "Records broken", "news")));
        when(search.fetchTrending()).thenReturn(List.of(new TrendItem("Space tourism", "", "", "search_trends")));
        when(text.generate(anyString(), anyString(), eq(TrendAnalysis.class))).thenAnswer(inv -> analysis());
        when(text.generate(anyString(), anyString(), eq(QualityEvaluation.class)))
                .thenReturn(new QualityEvaluation(0.85, "Solid"));
    }

    private static TrendAnalysis analysis() {
        TrendAnalysis analysis = new TrendAnalysis();
        analysis.setAnalyses(new ArrayList<>(List.of(
                new KeywordAnalysis("Heatwave", "Third week of records.", "society", 0.9, "Cities adapt.", "news"),
                new KeywordAnalysis("Space tourism", "Cheaper seats.", "science", 0.6, "Still pricey.", "search_trends"),
                new KeywordAnalysis("Rocket reuse", "New landing record.", "science", 0.7, "Costs fall.", "news"))));
        analysis.setRecommendedTopic("Heatwave");
        analysis.setRecommendedCategory("society");
        analysis.setReasoning("Broad interest");
        return analysis;
    }

    private PipelineState run(TrendResearchStage stage, Map<String, Object> preferences) {
        PipelineState state = PipelineState.initial("run-1", "owner-1", preferences);
        stage.run(state).getUpdate().applyTo(state);
        return state;
    }

    @Test
    @DisplayName("Builds trend data from the analysis and grades it")
    void buildsTrendData() {
        PipelineState state = run(new TrendResearchStage(text, List.of(news, search), 0.7), Map.of());

        assertThat(state.getTrendData().getKeywords()).containsExactly("Heatwave", "Space tourism", "Rocket reuse");
        assertThat(state.getTrendData().getSelectedTopic()).isEqualTo("Heatwave");
        assertThat(state.getTrendData().getCategory()).isEqualTo("society");
        assertThat(state.getTrendData().getTopicSummaries()).first()
                .extracting(TopicSummary::getSummary)
                .isEqualTo("Third week of records. Cities adapt.");
        assertThat(state.getQuality().isPassed()).isTrue();
        assertThat(state.getQuality().getStageName()).isEqualTo("research");
        verify(text).generate(anyString(), contains("[news] Heatwave: Records broken"), eq(TrendAnalysis.class));
    }

    @Test
    @DisplayName("Preferred categories narrow the topics and re-pick the recommendation")
    void narrowsToCategories() {
        PipelineState state = run(new TrendResearchStage(text, List.of(news, search), 0.7),
                Map.of("categories", List.of("science")));

        assertThat(state.getTrendData().getKeywords()).containsExactly("Space tourism", "Rocket reuse");
        assertThat(state.getTrendData().getSelectedTopic()).isEqualTo("Rocket reuse");
        assertThat(state.getTrendData().getCategory()).isEqualTo("science");
    }

    @Test
    @DisplayName("Categories that match nothing keep every result")
    void unmatchedCategoriesKeepAll() {
        TrendAnalysis analysis = analysis();

        TrendResearchStage.narrowToCategories(analysis, List.of("sports"));

        assertThat(analysis.getAnalyses()).hasSize(3);
        assertThat(analysis.getRecommendedTopic()).isEqualTo("Heatwave");
    }

    @Test
    @DisplayName("One failing source is tolerated")
    void toleratesFailingSource() {
        when(search.fetchTrending()).thenThrow(new GeneratorException("rate limited"));

        PipelineState state = run(new TrendResearchStage(text, List.of(news, search), 0.7), Map.of());

        assertThat(state.getQuality().isPassed()).isTrue();
        verify(text).generate(anyString(), contains("Heatwave"), eq(TrendAnalysis.class));
    }

    @Test
    @DisplayName("No items at all is a crashed attempt with empty trend data")
    void allSourcesEmpty() {
        when(news.fetchTrending()).thenReturn(List.of());
        when(search.fetchTrending()).thenThrow(new GeneratorException("down"));

        PipelineState state = run(new TrendResearchStage(text, List.of(news, search), 0.7), Map.of());

        assertThat(state.getQuality().isPassed()).isFalse();
        assertThat(state.getQuality().getScore()).isZero();
        assertThat(state.getQuality().getFeedback()).isEqualTo("Trend research failed due to an error. Will retry.");
        assertThat(state.getTrendData().getKeywords()).isEmpty();
        assertThat(state.attemptsOf("research")).isEqualTo(1);
        verify(text, never()).generate(anyString(), anyString(), eq(TrendAnalysis.class));
    }

    @Test
    @DisplayName("A low self-grade fails the attempt but keeps the data")
    void lowGradeFails() {
        when(text.generate(anyString(), anyString(), eq(QualityEvaluation.class)))
                .thenReturn(new QualityEvaluation(0.4, "Too thin"));

        PipelineState state = run(new TrendResearchStage(text, List.of(news), 0.7), Map.of());

        assertThat(state.getQuality().isPassed()).isFalse();
        assertThat(state.getQuality().getFeedback()).isEqualTo("Too thin");
        assertThat(state.getTrendData().getKeywords()).isNotEmpty();
    }
}
