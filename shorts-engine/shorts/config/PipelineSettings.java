package shorts.config;

import java.nio.file.Path;
import java.util.List;

/**
 * Engine configuration as the stages use it. {@link #load()} reads it through
 * {@link ShortsProperties}; tests build it directly.
 */
public class PipelineSettings {

    private final int maxRetries;
    private final double qualityThreshold;
    private final double captionToleranceSec;
    private final int speechConcurrency;
    private final int imageConcurrency;
    private final int sceneWorkers;
    private final Path outputDir;
    private final Path assetsDir;
    private final String databaseUrl;
    private final int videoWidth;
    private final int videoHeight;
    private final int videoFps;
    private final double minDurationSec;
    private final double maxDurationSec;
    private final String channelIntroText;
    private final SpeakerRoster roster;

    private PipelineSettings(Builder b) {
        if (b.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = b.maxRetries;
        this.qualityThreshold = b.qualityThreshold;
        this.captionToleranceSec = b.captionToleranceSec;
        this.speechConcurrency = b.speechConcurrency;
        this.imageConcurrency = b.imageConcurrency;
        this.sceneWorkers = b.sceneWorkers;
        this.outputDir = b.outputDir;
        this.assetsDir = b.assetsDir;
        this.databaseUrl = b.databaseUrl;
        this.videoWidth = b.videoWidth;
        this.videoHeight = b.videoHeight;
        this.videoFps = b.videoFps;
        this.minDurationSec = b.minDurationSec;
        this.maxDurationSec = b.maxDurationSec;
        this.channelIntroText = b.channelIntroText;
        this.roster = b.roster;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineSettings load() {
        return from(ShortsProperties.load());
    }

    public static PipelineSettings from(ShortsProperties props) {
        ShortsProperties.VideoConfig video = props.getVideo();
        return builder()
                .maxRetries(props.getMaxRetries())
                .qualityThreshold(props.getQualityThreshold())
                .captionToleranceSec(props.getCaptionToleranceSec())
                .speechConcurrency(props.getSpeechConcurrency())
                .imageConcurrency(props.getImageConcurrency())
                .sceneWorkers(props.getSceneWorkers())
                .outputDir(Path.of(props.getOutputDir()))
                .assetsDir(Path.of(props.getAssetsDir()))
                .databaseUrl(props.getDatabaseUrl())
                .videoWidth(video.getWidth())
                .videoHeight(video.getHeight())
                .videoFps(video.getFps())
                .minDurationSec(video.getMinDurationSec())
                .maxDurationSec(video.getMaxDurationSec())
                .channelIntroText(props.getChannelIntroText())
                .roster(props.toRoster())
                .build();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public double getCaptionToleranceSec() {
        return captionToleranceSec;
    }

    public int getSpeechConcurrency() {
        return speechConcurrency;
    }

    public int getImageConcurrency() {
        return imageConcurrency;
    }

    public int getSceneWorkers() {
        return sceneWorkers;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Path getAssetsDir() {
        return assetsDir;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public int getVideoWidth() {
        return videoWidth;
    }

    public int getVideoHeight() {
        return videoHeight;
    }

    public int getVideoFps() {
        return videoFps;
    }

    public double getMinDurationSec() {
        return minDurationSec;
    }

    public double getMaxDurationSec() {
        return maxDurationSec;
    }

    public String getChannelIntroText() {
        return channelIntroText;
    }

    public SpeakerRoster getRoster() {
        return roster;
    }

    public static class Builder {

        private int maxRetries = 2;
        private double qualityThreshold = 0.7;
        private double captionToleranceSec = 1.0;
        private int speechConcurrency = 2;
        private int imageConcurrency = 3;
        private int sceneWorkers = 4;
        private Path outputDir = Path.of("output");
        private Path assetsDir = Path.of("assets");
        private String databaseUrl = "jdbc:sqlite:shorts-engine.db";
        private int videoWidth = 1080;
        private int videoHeight = 1920;
        private int videoFps = 30;
        private double minDurationSec = 30.0;
        private double maxDurationSec = 200.0;
        private String channelIntroText = "";
        private SpeakerRoster roster = new SpeakerRoster(List.of(), "default_voice_id");

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder qualityThreshold(double qualityThreshold) {
            this.qualityThreshold = qualityThreshold;
            return this;
        }

        public Builder captionToleranceSec(double captionToleranceSec) {
            this.captionToleranceSec = captionToleranceSec;
            return this;
        }

        public Builder speechConcurrency(int speechConcurrency) {
            this.speechConcurrency = speechConcurrency;
            return this;
        }

        public Builder imageConcurrency(int imageConcurrency) {
            this.imageConcurrency = imageConcurrency;
            return this;
        }

        public Builder sceneWorkers(int sceneWorkers) {
            this.sceneWorkers = sceneWorkers;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder assetsDir(Path assetsDir) {
            this.assetsDir = assetsDir;
            return this;
        }

        public Builder databaseUrl(String databaseUrl) {
            this.databaseUrl = databaseUrl;
            return this;
        }

        public Builder videoWidth(int videoWidth) {
            this.videoWidth = videoWidth;
            return this;
        }

        public Builder videoHeight(int videoHeight) {
            this.videoHeight = videoHeight;
            return this;
        }

        public Builder videoFps(int videoFps) {
            this.videoFps = videoFps;
            return this;
        }

        public Builder minDurationSec(double minDurationSec) {
            this.minDurationSec = minDurationSec;
            return this;
        }

        public Builder maxDurationSec(double maxDurationSec) {
            this.maxDurationSec = maxDurationSec;
            return this;
        }

        public Builder channelIntroText(String channelIntroText) {
            this.channelIntroText = channelIntroText;
            return this;
        }

        public Builder roster(SpeakerRoster roster) {
            this.roster = roster;
            return this;
        }

        public PipelineSettings build() {
            return new PipelineSettings(this);
        }
    }
}
