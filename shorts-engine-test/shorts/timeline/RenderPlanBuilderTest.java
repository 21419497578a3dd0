package shorts.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorts.model.AudioSegment;
import shorts.model.ImageAsset;
import shorts.model.MediaAssets;
import shorts.model.VideoClip;

@DisplayName("RenderPlanBuilder Tests")
class RenderPlanBuilderTest {

    private List<AudioSegment> segments;
    private List<CaptionBucket> buckets;
    private MediaAssets assets;

    @BeforeEach
    void setUp() {
        segments = List.of(
                new AudioSegment("hook", "a/hook.mp3", 3.0),
                new AudioSegment("body_1_1", "a/body_1_1.mp3", 4.0),
                new AudioSegment("cta", "a/cta.mp3", 2.0));
        buckets = new SceneTimelineComposer().compose(segments, List.of(
                new Caption(0.2, 2.5, "hook line"),
                new Caption(3.1, 6.0, "body line")));

        assets = MediaAssets.empty();
        assets.setImages(List.of(
                new ImageAsset("hook", "i/hook.png", "hook prompt"),
                new ImageAsset("body_1_1", "i/body.png", "body prompt")));
        assets.setVideoClips(List.of(
                new VideoClip("hook", "", 3.0),
                new VideoClip("body_1_1", "v/body.mp4", 4.0),
                new VideoClip("cta", "", 2.0)));
    }

    @Test
    @DisplayName("Clips follow segment order with their windows and captions")
    void buildsClipsInOrder() {
        RenderPlan plan = new RenderPlanBuilder(1080, 1920, 30)
                .segments(segments, buckets)
                .assets(assets)
                .build();

        assertThat(plan.getClips()).extracting(SceneClipPlan::getSceneId).containsExactly("hook", "body_1_1", "cta");
        assertThat(plan.getClips()).extracting(SceneClipPlan::getSceneStart).containsExactly(0.0, 3.0, 7.0);
        assertThat(plan.getClips().get(0).getCaptions()).extracting(Caption::getText).containsExactly("hook line");
        assertThat(plan.getWidth()).isEqualTo(1080);
        assertThat(plan.getHeight()).isEqualTo(1920);
        assertThat(plan.getFps()).isEqualTo(30);
        assertThat(plan.totalDurationSec()).isEqualTo(9.0);
    }

    @Test
    @DisplayName("A scene without its own image borrows the first image")
    void missingImageFallsBackToFirst() {
        RenderPlan plan = new RenderPlanBuilder(1080, 1920, 30)
                .segments(segments, buckets)
                .assets(assets)
                .build();

        assertThat(plan.getClips().get(2).getImagePath()).isEqualTo("i/hook.png");
    }

    @Test
    @DisplayName("Scenes are left out when there are no images at all")
    void noImagesLeavesScenesOut() {
        assets.setImages(List.of());

        RenderPlan plan = new RenderPlanBuilder(1080, 1920, 30)
                .segments(segments, buckets)
                .assets(assets)
                .build();

        assertThat(plan.getClips()).isEmpty();
    }

    @Test
    @DisplayName("Hook video replaces the hook still; clip paths are used for other scenes")
    void usesHookVideoAndClips() {
        RenderPlan plan = new RenderPlanBuilder(1080, 1920, 30)
                .segments(segments, buckets)
                .assets(assets)
                .hookVideo("v/hook.mp4")
                .build();

        assertThat(plan.getClips().get(0).getVideoPath()).isEqualTo("v/hook.mp4");
        assertThat(plan.getClips().get(1).getVideoPath()).isEqualTo("v/body.mp4");
        assertThat(plan.getClips().get(2).hasVideo()).isFalse();
    }

    @Test
    @DisplayName("Banner text goes on body scenes only")
    void bannerOnBodyScenes() {
        RenderPlan plan = new RenderPlanBuilder(1080, 1920, 30)
                .segments(segments, buckets)
                .assets(assets)
                .banner("Three-day weekends?")
                .build();

        assertThat(plan.getClips()).extracting(SceneClipPlan::getBannerText)
                .containsExactly(null, "Three-day weekends?", null);
    }

    @Test
    @DisplayName("The channel intro follows the hook without captions")
    void introAfterHook() {
        RenderPlan plan = new RenderPlanBuilder(1080, 1920, 30)
                .segments(segments, buckets)
                .assets(assets)
                .intro("a/channel_intro.mp3", "assets/channel_ad.png", 2.5)
                .backgroundMusic("bgm.mp3")
                .build();

        assertThat(plan.getClips()).extracting(SceneClipPlan::getSceneId)
                .containsExactly("hook", "channel_intro", "body_1_1", "cta");
        SceneClipPlan intro = plan.getClips().get(1);
        assertThat(intro.isIntro()).isTrue();
        assertThat(intro.getCaptions()).isEmpty();
        assertThat(intro.getImagePath()).isEqualTo("assets/channel_ad.png");
        assertThat(plan.getClips().get(2).getSceneStart()).isEqualTo(3.0);
        assertThat(plan.getBgmPath()).isEqualTo("bgm.mp3");
    }

    @Test
    @DisplayName("Segments and buckets must pair up")
    void mismatchedBucketsRejected() {
        assertThatThrownBy(() -> new RenderPlanBuilder(1080, 1920, 30).segments(segments, buckets.subList(0, 2)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
