package shorts.timeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.model.AudioSegment;
import shorts.model.ImageAsset;
import shorts.model.MediaAssets;
import shorts.model.VideoClip;

/**
 * Joins per-scene media and caption buckets into a {@link RenderPlan}.
 *
 * <p>Scenes keep the order of the audio segments. A scene without its own image
 * borrows the first image; with no image at all it is left out. The hook scene
 * plays the generated hook video when there is one, and the channel intro, when
 * given, follows the hook without moving the narration timeline.
 */
public class RenderPlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(RenderPlanBuilder.class);

    private final int width;
    private final int height;
    private final int fps;

    private List<AudioSegment> segments = List.of();
    private List<CaptionBucket> buckets = List.of();
    private MediaAssets assets = MediaAssets.empty();
    private String hookVideoPath;
    private String bannerText;
    private String bgmPath;
    private String introAudioPath;
    private String introImagePath;
    private double introDuration;

    public RenderPlanBuilder(int width, int height, int fps) {
        this.width = width;
        this.height = height;
        this.fps = fps;
    }

    public RenderPlanBuilder segments(List<AudioSegment> segments, List<CaptionBucket> buckets) {
        if (segments.size() != buckets.size()) {
            throw new IllegalArgumentException(
                    "Expected one caption bucket per segment: " + segments.size() + " != " + buckets.size());
        }
        this.segments = segments;
        this.buckets = buckets;
        return this;
    }

    public RenderPlanBuilder assets(MediaAssets assets) {
        this.assets = assets;
        return this;
    }

    public RenderPlanBuilder hookVideo(String path) {
        this.hookVideoPath = path;
        return this;
    }

    /**
     * Text of the banner shown above body scenes.
     */
    public RenderPlanBuilder banner(String text) {
        this.bannerText = text;
        return this;
    }

    public RenderPlanBuilder backgroundMusic(String path) {
        this.bgmPath = path;
        return this;
    }

    public RenderPlanBuilder intro(String audioPath, String imagePath, double duration) {
        this.introAudioPath = audioPath;
        this.introImagePath = imagePath;
        this.introDuration = duration;
        return this;
    }

    public RenderPlan build() {
        List<ImageAsset> images = assets.getImages();
        String fallbackImage = images.isEmpty() ? null : images.get(0).getImagePath();

        List<SceneClipPlan> clips = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            AudioSegment segment = segments.get(i);
            CaptionBucket bucket = buckets.get(i);
            String sceneId = segment.getSceneId();

            String image = assets.imageFor(sceneId).map(ImageAsset::getImagePath).orElse(fallbackImage);
            if (image == null || image.isEmpty()) {
                log.warn("Scene {} has no image; left out of the render", sceneId);
                continue;
            }

            boolean hook = "hook".equals(sceneId);
            String video;
            if (hook && hookVideoPath != null) {
                video = hookVideoPath;
            } else {
                video = clipPathOf(sceneId).orElse(null);
            }

            clips.add(new SceneClipPlan(
                    sceneId,
                    segment.getAudioPath(),
                    image,
                    video,
                    bucket.getCaptions(),
                    bucket.getWindowStart(),
                    segment.getDuration(),
                    sceneId.startsWith("body_") ? bannerText : null,
                    false
            ));

            if (hook && introAudioPath != null) {
                clips.add(new SceneClipPlan(
                        "channel_intro",
                        introAudioPath,
                        introImagePath != null ? introImagePath : image,
                        null,
                        List.of(),
                        0.0,
                        introDuration,
                        null,
                        true
                ));
            }
        }
        return new RenderPlan(clips, width, height, fps, bgmPath);
    }

    private Optional<String> clipPathOf(String sceneId) {
        return assets.clipFor(sceneId)
                .filter(VideoClip::hasVideo)
                .map(VideoClip::getVideoPath);
    }
}
