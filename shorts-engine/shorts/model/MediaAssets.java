package shorts.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class MediaAssets {

    private String audioPath = ""; // concatenated narration
    private List<AudioSegment> audioSegments = new ArrayList<>();
    private List<ImageAsset> images = new ArrayList<>();
    private List<VideoClip> videoClips = new ArrayList<>();
    private Map<String, String> voiceIds = new LinkedHashMap<>();

    public static MediaAssets empty() {
        return new MediaAssets();
    }

    public Optional<ImageAsset> imageFor(String sceneId) {
        return images.stream().filter(i -> sceneId.equals(i.getSceneId())).findFirst();
    }

    public Optional<VideoClip> clipFor(String sceneId) {
        return videoClips.stream().filter(c -> sceneId.equals(c.getSceneId())).findFirst();
    }

    public String getAudioPath() {
        return audioPath;
    }

    public void setAudioPath(String audioPath) {
        this.audioPath = audioPath;
    }

    public List<AudioSegment> getAudioSegments() {
        return audioSegments;
    }

    public void setAudioSegments(List<AudioSegment> audioSegments) {
        this.audioSegments = audioSegments;
    }

    public List<ImageAsset> getImages() {
        return images;
    }

    public void setImages(List<ImageAsset> images) {
        this.images = images;
    }

    public List<VideoClip> getVideoClips() {
        return videoClips;
    }

    public void setVideoClips(List<VideoClip> videoClips) {
        this.videoClips = videoClips;
    }

    public Map<String, String> getVoiceIds() {
        return voiceIds;
    }

    public void setVoiceIds(Map<String, String> voiceIds) {
        this.voiceIds = voiceIds;
    }
}
