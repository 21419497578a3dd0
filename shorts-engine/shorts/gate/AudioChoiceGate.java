package shorts.gate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.graph.StateUpdate;
import shorts.model.AudioSource;
import shorts.model.PipelineState;
import shorts.model.Scene;
import shorts.model.ScriptData;

/**
 * Chooses between synthesized narration and recordings supplied per scene.
 */
public class AudioChoiceGate extends HumanGate {

    private static final Logger log = LoggerFactory.getLogger(AudioChoiceGate.class);

    public AudioChoiceGate() {
        super(GateType.AUDIO_CHOICE);
    }

    @Override
    protected Map<String, Object> publish(PipelineState state) {
        log.info("Run {} waiting for audio choice", state.getRunId());

        List<Map<String, Object>> scenes = new ArrayList<>();
        for (Scene scene : scenesOf(state)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("scene_id", scene.getSceneId());
            entry.put("speaker", scene.getSpeaker());
            entry.put("text", scene.getText());
            scenes.add(entry);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("scenes", scenes);
        payload.put("script_file_path", state.getScriptFilePath());
        payload.put("message", "Choose the audio source: tts (synthesized voices) or manual recordings.");
        return payload;
    }

    @Override
    public GateDecision decide(PipelineState state, Map<String, Object> payload) {
        String tag = requireString(state, payload, "audio_source");
        AudioSource source;
        try {
            source = AudioSource.fromTag(tag);
        } catch (IllegalArgumentException e) {
            throw new ResumeRejectedException(state.getRunId(), "audio_source must be tts or manual, got '" + tag + "'");
        }

        Map<String, String> files = null;
        if (source == AudioSource.MANUAL) {
            files = requireStringMap(state, payload, "audio_files");
            Set<String> known = new HashSet<>();
            for (Scene scene : scenesOf(state)) {
                known.add(scene.getSceneId());
            }
            for (String sceneId : files.keySet()) {
                if (!known.contains(sceneId)) {
                    throw new ResumeRejectedException(state.getRunId(), "audio_files names unknown scene '" + sceneId + "'");
                }
            }
        }
        log.info("Run {} audio source: {}", state.getRunId(), source.tag());

        Map<String, String> audioFiles = files;
        StateUpdate update = StateUpdate.of(s -> {
            s.setAudioSource(source);
            s.setAudioFiles(audioFiles == null ? null : new LinkedHashMap<>(audioFiles));
            s.setAudioChoiceApproved(true);
        });
        return new GateDecision(type(), update, "audio_source=" + source.tag());
    }

    private static List<Scene> scenesOf(PipelineState state) {
        ScriptData script = state.getScriptData();
        return script == null ? List.of() : script.getScenes();
    }
}
