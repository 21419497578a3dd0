package shorts;

import java.util.List;

import engine.DurableStore;
import shorts.config.PipelineSettings;
import shorts.gate.AudioChoiceGate;
import shorts.gate.HookPromptGate;
import shorts.gate.ScriptReviewGate;
import shorts.gate.SpeakerSelectionGate;
import shorts.gate.TopicSelectionGate;
import shorts.generator.Studio;
import shorts.graph.QualityGatedRouter;
import shorts.graph.StageNode;
import shorts.graph.WorkflowExecutor;
import shorts.stage.AssemblyStage;
import shorts.stage.MediaProductionStage;
import shorts.stage.ResultUploader;
import shorts.stage.ScriptDraftStage;
import shorts.stage.TrendResearchStage;

/**
 * Wires the podcast shorts graph: one node per stage, the router and the
 * upload hook, over a given store and studio.
 */
public final class ShortsWorkflow {

    private ShortsWorkflow() {
    }

    public static List<StageNode> nodes(PipelineSettings settings, Studio studio) {
        return List.of(
                new TrendResearchStage(studio.text(), studio.trendSources(), settings.getQualityThreshold()),
                new TopicSelectionGate(),
                new SpeakerSelectionGate(settings.getRoster()),
                new ScriptDraftStage(studio.text(), settings.getRoster(), settings.getOutputDir(), settings.getQualityThreshold()),
                new ScriptReviewGate(),
                new AudioChoiceGate(),
                new MediaProductionStage(studio.speech(), studio.images(), studio.media(), studio.text(), settings),
                new HookPromptGate(),
                new AssemblyStage(studio.speech(), studio.video(), studio.transcriber(), studio.media(), settings)
        );
    }

    public static WorkflowExecutor create(PipelineSettings settings, DurableStore store, Studio studio) {
        return new WorkflowExecutor(
                store,
                new QualityGatedRouter(settings.getMaxRetries()),
                nodes(settings, studio),
                new ResultUploader(studio.publisher()));
    }
}
