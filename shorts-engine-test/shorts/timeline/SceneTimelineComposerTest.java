package shorts.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorts.model.AudioSegment;

@DisplayName("SceneTimelineComposer Tests")
class SceneTimelineComposerTest {

    private static final List<AudioSegment> SEGMENTS = List.of(
            new AudioSegment("hook", "audio/hook.mp3", 3.0),
            new AudioSegment("body_1_1", "audio/body_1_1.mp3", 4.0),
            new AudioSegment("cta", "audio/cta.mp3", 2.0));

    private final SceneTimelineComposer composer = new SceneTimelineComposer();

    @Test
    @DisplayName("Windows are running sums of the segment durations")
    void windowsFollowDurations() {
        List<CaptionBucket> buckets = composer.compose(SEGMENTS, List.of());

        assertThat(buckets).extracting(CaptionBucket::getSceneId).containsExactly("hook", "body_1_1", "cta");
        assertThat(buckets).extracting(CaptionBucket::getWindowStart).containsExactly(0.0, 3.0, 7.0);
        assertThat(buckets).extracting(CaptionBucket::getWindowEnd).containsExactly(3.0, 7.0, 9.0);
        assertThat(buckets).allMatch(CaptionBucket::isEmpty);
    }

    @Test
    @DisplayName("A caption straddling a boundary goes to the scene holding its midpoint")
    void straddlingCaptionFollowsMidpoint() {
        Caption straddling = new Caption(2.8, 3.3, "straddles the cut");

        List<CaptionBucket> buckets = composer.compose(SEGMENTS, List.of(straddling));

        assertThat(buckets.get(0).getCaptions()).isEmpty();
        assertThat(buckets.get(1).getCaptions()).extracting(Caption::getText).containsExactly("straddles the cut");
        assertThat(buckets.get(2).getCaptions()).isEmpty();
    }

    @Test
    @DisplayName("A caption ending just before the window end is stretched to it")
    void lastCaptionStretchedWithinTolerance() {
        List<CaptionBucket> buckets = composer.compose(SEGMENTS, List.of(
                new Caption(3.2, 5.0, "first"),
                new Caption(5.1, 6.6, "second")));

        List<Caption> body = buckets.get(1).getCaptions();
        assertThat(body).hasSize(2);
        assertThat(body.get(0).getEndSec()).isEqualTo(5.0);
        assertThat(body.get(1).getEndSec()).isEqualTo(7.0);
        assertThat(body.get(1).getStartSec()).isEqualTo(5.1);
    }

    @Test
    @DisplayName("A caption ending well before the window end keeps its end")
    void lastCaptionKeptOutsideTolerance() {
        List<CaptionBucket> buckets = composer.compose(SEGMENTS, List.of(new Caption(3.2, 5.0, "only")));

        assertThat(buckets.get(1).getCaptions().get(0).getEndSec()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Zero tolerance never stretches captions")
    void zeroToleranceKeepsEnds() {
        List<CaptionBucket> buckets = new SceneTimelineComposer(0.0)
                .compose(SEGMENTS, List.of(new Caption(3.2, 6.99, "close")));

        assertThat(buckets.get(1).getCaptions().get(0).getEndSec()).isEqualTo(6.99);
    }

    @Test
    @DisplayName("Captions past the end of the narration are dropped")
    void captionsOutsideTimelineDropped() {
        List<CaptionBucket> buckets = composer.compose(SEGMENTS, List.of(
                new Caption(0.2, 1.0, "kept"),
                new Caption(9.5, 10.0, "too late")));

        assertThat(buckets).flatExtracting(CaptionBucket::getCaptions)
                .extracting(Caption::getText)
                .containsExactly("kept");
    }

    @Test
    @DisplayName("Buckets are sorted and independent of the input order")
    void orderIndependent() {
        List<Caption> captions = new ArrayList<>(List.of(
                new Caption(0.1, 0.9, "a"),
                new Caption(1.0, 2.0, "b"),
                new Caption(3.1, 4.0, "c"),
                new Caption(4.0, 5.5, "d"),
                new Caption(7.2, 8.1, "e")));
        List<CaptionBucket> expected = composer.compose(SEGMENTS, captions);

        Collections.shuffle(captions, new Random(7));
        List<CaptionBucket> shuffled = composer.compose(SEGMENTS, captions);

        for (int i = 0; i < expected.size(); i++) {
            assertThat(shuffled.get(i).getCaptions()).containsExactlyElementsOf(expected.get(i).getCaptions());
        }
        assertThat(expected.get(0).getCaptions()).extracting(Caption::getText).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Negative tolerance is rejected")
    void negativeToleranceRejected() {
        assertThatThrownBy(() -> new SceneTimelineComposer(-0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
