package shorts.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * The single aggregate threaded through every stage of a run. Stages read it
 * and hand back partial updates; only the executor applies them.
 */
public class PipelineState {

    // Run configuration, set once at start
    private String runId;
    private String ownerId;
    private Map<String, Object> userPreferences = new LinkedHashMap<>();

    // Research
    private TrendData trendData;

    // Topic selection gate
    private String topicSelected;
    private Boolean topicSelectionApproved;

    // Speaker selection gate
    private SelectedSpeakers selectedSpeakers;
    private Boolean speakerSelectionApproved;
    private Map<String, String> voiceIds = new LinkedHashMap<>();

    // Drafting
    private ScriptData scriptData;
    private String scriptFilePath;

    // Script review gate
    private Boolean humanApproved;
    private String humanFeedback;

    // Audio source gate
    private AudioSource audioSource;
    private Boolean audioChoiceApproved;
    private Map<String, String> audioFiles;

    // Media
    private MediaAssets mediaAssets;
    private String videoResolution;

    // Hook prompt gate
    private String hookVideoPrompt;
    private String hookMode;
    private Boolean hookPromptApproved;

    // Quality control
    private QualityAssessment quality;
    private Map<String, Integer> retryCounts = new TreeMap<>();

    // Outcome
    private EditorOutput editorOutput;
    private String error;

    public PipelineState() {
    }

    public static PipelineState initial(String runId, String ownerId, Map<String, Object> userPreferences) {
        PipelineState state = new PipelineState();
        state.setRunId(runId);
        state.setOwnerId(ownerId);
        if (userPreferences != null) {
            state.setUserPreferences(new LinkedHashMap<>(userPreferences));
            Object resolution = userPreferences.get("video_resolution");
            if (resolution instanceof String) {
                state.setVideoResolution((String) resolution);
            }
        }
        return state;
    }

    public int attemptsOf(String stageName) {
        return retryCounts.getOrDefault(stageName, 0);
    }

    /**
     * Records the attempt number of a stage. Counters never go down.
     */
    public void recordAttempt(String stageName, int attempt) {
        retryCounts.merge(stageName, attempt, Math::max);
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public Map<String, Object> getUserPreferences() {
        return userPreferences;
    }

    public void setUserPreferences(Map<String, Object> userPreferences) {
        this.userPreferences = userPreferences;
    }

    public TrendData getTrendData() {
        return trendData;
    }

    public void setTrendData(TrendData trendData) {
        this.trendData = trendData;
    }

    public String getTopicSelected() {
        return topicSelected;
    }

    public void setTopicSelected(String topicSelected) {
        this.topicSelected = topicSelected;
    }

    public Boolean getTopicSelectionApproved() {
        return topicSelectionApproved;
    }

    public void setTopicSelectionApproved(Boolean topicSelectionApproved) {
        this.topicSelectionApproved = topicSelectionApproved;
    }

    public SelectedSpeakers getSelectedSpeakers() {
        return selectedSpeakers;
    }

    public void setSelectedSpeakers(SelectedSpeakers selectedSpeakers) {
        this.selectedSpeakers = selectedSpeakers;
    }

    public Boolean getSpeakerSelectionApproved() {
        return speakerSelectionApproved;
    }

    public void setSpeakerSelectionApproved(Boolean speakerSelectionApproved) {
        this.speakerSelectionApproved = speakerSelectionApproved;
    }

    public Map<String, String> getVoiceIds() {
        return voiceIds;
    }

    public void setVoiceIds(Map<String, String> voiceIds) {
        this.voiceIds = voiceIds;
    }

    public ScriptData getScriptData() {
        return scriptData;
    }

    public void setScriptData(ScriptData scriptData) {
        this.scriptData = scriptData;
    }

    public String getScriptFilePath() {
        return scriptFilePath;
    }

    public void setScriptFilePath(String scriptFilePath) {
        this.scriptFilePath = scriptFilePath;
    }

    public Boolean getHumanApproved() {
        return humanApproved;
    }

    public void setHumanApproved(Boolean humanApproved) {
        this.humanApproved = humanApproved;
    }

    public String getHumanFeedback() {
        return humanFeedback;
    }

    public void setHumanFeedback(String humanFeedback) {
        this.humanFeedback = humanFeedback;
    }

    public AudioSource getAudioSource() {
        return audioSource;
    }

    public void setAudioSource(AudioSource audioSource) {
        this.audioSource = audioSource;
    }

    public Boolean getAudioChoiceApproved() {
        return audioChoiceApproved;
    }

    public void setAudioChoiceApproved(Boolean audioChoiceApproved) {
        this.audioChoiceApproved = audioChoiceApproved;
    }

    public Map<String, String> getAudioFiles() {
        return audioFiles;
    }

    public void setAudioFiles(Map<String, String> audioFiles) {
        this.audioFiles = audioFiles;
    }

    public MediaAssets getMediaAssets() {
        return mediaAssets;
    }

    public void setMediaAssets(MediaAssets mediaAssets) {
        this.mediaAssets = mediaAssets;
    }

    public String getVideoResolution() {
        return videoResolution;
    }

    public void setVideoResolution(String videoResolution) {
        this.videoResolution = videoResolution;
    }

    public String getHookVideoPrompt() {
        return hookVideoPrompt;
    }

    public void setHookVideoPrompt(String hookVideoPrompt) {
        this.hookVideoPrompt = hookVideoPrompt;
    }

    public String getHookMode() {
        return hookMode;
    }

    public void setHookMode(String hookMode) {
        this.hookMode = hookMode;
    }

    public Boolean getHookPromptApproved() {
        return hookPromptApproved;
    }

    public void setHookPromptApproved(Boolean hookPromptApproved) {
        this.hookPromptApproved = hookPromptApproved;
    }

    public QualityAssessment getQuality() {
        return quality;
    }

    public void setQuality(QualityAssessment quality) {
        this.quality = quality;
    }

    public Map<String, Integer> getRetryCounts() {
        return retryCounts;
    }

    public void setRetryCounts(Map<String, Integer> retryCounts) {
        this.retryCounts = new TreeMap<>(retryCounts);
    }

    public EditorOutput getEditorOutput() {
        return editorOutput;
    }

    public void setEditorOutput(EditorOutput editorOutput) {
        this.editorOutput = editorOutput;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
