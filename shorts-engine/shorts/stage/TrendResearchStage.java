package shorts.stage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.generator.GeneratorException;
import shorts.generator.KeywordAnalysis;
import shorts.generator.QualityEvaluation;
import shorts.generator.TextGenerator;
import shorts.generator.TrendAnalysis;
import shorts.generator.TrendItem;
import shorts.generator.TrendSource;
import shorts.graph.Stage;
import shorts.graph.StateUpdate;
import shorts.model.PipelineState;
import shorts.model.TopicSummary;
import shorts.model.TrendData;

/**
 * Collects trending items from every source in parallel, has the text model
 * explain and rank them, narrows the result to the user's categories, then
 * lets the model grade its own analysis.
 */
public class TrendResearchStage extends QualityStage {

    private static final Logger log = LoggerFactory.getLogger(TrendResearchStage.class);

    static final String ANALYSIS_SYSTEM_PROMPT = """
            You are a trend analyst. Explain why each raw trend item is trending and \
            recommend the topic that best suits a one to three minute podcast short.
            Judge by public interest, how engaging it is as a conversation, whether \
            there is enough context to tell a story, and whether it fits in three minutes.
            Categories: tech, entertainment, society, economy, sports, politics, culture, \
            science, health, education.""";

    static final String QUALITY_SYSTEM_PROMPT = """
            You grade trend analyses for a podcast shorts pipeline. Decide whether the \
            analysis is good enough to write a script from: the topic is really trending, \
            the background is explained, and there is material for one to three minutes.""";

    private final TextGenerator text;
    private final List<TrendSource> sources;
    private final double qualityThreshold;

    public TrendResearchStage(TextGenerator text, List<TrendSource> sources, double qualityThreshold) {
        super(Stage.RESEARCH, "Trend research");
        this.text = text;
        this.sources = List.copyOf(sources);
        this.qualityThreshold = qualityThreshold;
    }

    @Override
    protected Outcome produce(PipelineState state, int attempt) {
        List<TrendItem> items = collect();
        if (items.isEmpty()) {
            throw new GeneratorException("All trend sources returned empty results");
        }

        TrendAnalysis analysis = text.generate(ANALYSIS_SYSTEM_PROMPT, analysisPrompt(items), TrendAnalysis.class);
        log.info("Run {} analysed {} keywords, recommended '{}'",
                state.getRunId(), analysis.getAnalyses().size(), analysis.getRecommendedTopic());

        narrowToCategories(analysis, preferredCategories(state));

        TrendData trends = new TrendData(
                analysis.getAnalyses().stream().map(KeywordAnalysis::getKeyword).collect(Collectors.toList()),
                analysis.getAnalyses().stream().map(TrendResearchStage::summaryOf).collect(Collectors.toList()),
                analysis.getRecommendedTopic(),
                analysis.getRecommendedCategory());

        QualityEvaluation evaluation = text.generate(QUALITY_SYSTEM_PROMPT, qualityPrompt(analysis), QualityEvaluation.class);

        return new Outcome(
                StateUpdate.of(s -> s.setTrendData(trends)),
                assess(evaluation.getScore(), qualityThreshold, evaluation.getFeedback(), attempt));
    }

    @Override
    protected StateUpdate onFailure(PipelineState state) {
        return StateUpdate.of(s -> s.setTrendData(TrendData.empty()));
    }

    private List<TrendItem> collect() {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, sources.size()));
        try {
            List<CompletableFuture<List<TrendItem>>> futures = new ArrayList<>();
            for (TrendSource source : sources) {
                futures.add(CompletableFuture.supplyAsync(source::fetchTrending, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .handle((ignored, error) -> null)
                    .join();

            List<TrendItem> items = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                String name = sources.get(i).name();
                try {
                    List<TrendItem> fetched = futures.get(i).join();
                    log.info("Trend source {} returned {} items", name, fetched.size());
                    items.addAll(fetched);
                } catch (CompletionException e) {
                    log.warn("Trend source {} failed", name, e.getCause());
                }
            }
            return items;
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Keeps only analyses in the preferred categories and re-picks the most
     * relevant one. Leaves the analysis untouched when nothing matches.
     */
    static void narrowToCategories(TrendAnalysis analysis, List<String> categories) {
        if (categories.isEmpty()) {
            return;
        }
        List<KeywordAnalysis> matching = analysis.getAnalyses().stream()
                .filter(a -> categories.contains(a.getCategory()))
                .collect(Collectors.toList());
        if (matching.isEmpty()) {
            log.info("No analysis matched categories {}; keeping all results", categories);
            return;
        }
        KeywordAnalysis best = matching.stream()
                .max(Comparator.comparingDouble(KeywordAnalysis::getRelevanceScore))
                .orElseThrow();
        analysis.setAnalyses(matching);
        analysis.setRecommendedTopic(best.getKeyword());
        analysis.setRecommendedCategory(best.getCategory());
        log.info("Narrowed to {} analyses in {}", matching.size(), categories);
    }

    private static List<String> preferredCategories(PipelineState state) {
        Object value = state.getUserPreferences().get("categories");
        if (!(value instanceof Collection)) {
            return List.of();
        }
        return ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.toList());
    }

    private static TopicSummary summaryOf(KeywordAnalysis analysis) {
        return new TopicSummary(
                analysis.getKeyword(),
                analysis.getWhyTrending() + " " + analysis.getSummary(),
                analysis.getSource(),
                analysis.getRelevanceScore());
    }

    private static String analysisPrompt(List<TrendItem> items) {
        StringBuilder prompt = new StringBuilder("Today's raw trend data. Analyse each keyword and recommend the best topic.\n");
        for (TrendItem item : items) {
            prompt.append("- [").append(item.getSource()).append("] ").append(item.getTitle());
            String content = item.getContent();
            if (content != null && !content.isEmpty()) {
                prompt.append(": ").append(content, 0, Math.min(200, content.length()));
            }
            prompt.append('\n');
        }
        return prompt.toString();
    }

    private static String qualityPrompt(TrendAnalysis analysis) {
        StringBuilder prompt = new StringBuilder()
                .append("Recommended topic: ").append(analysis.getRecommendedTopic()).append('\n')
                .append("Category: ").append(analysis.getRecommendedCategory()).append('\n')
                .append("Reasoning: ").append(analysis.getReasoning()).append('\n')
                .append("Per keyword:\n");
        for (KeywordAnalysis a : analysis.getAnalyses()) {
            prompt.append(String.format("- %s (%s, relevance %.2f): %s%n",
                    a.getKeyword(), a.getCategory(), a.getRelevanceScore(), a.getWhyTrending()));
        }
        return prompt.toString();
    }
}
