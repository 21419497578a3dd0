package shorts.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.javaprop.JavaPropsMapper;

/**
 * Typed binding for all {@code shorts.*} properties.
 *
 * <pre>
 * shorts.max-retries=2
 * shorts.video.width=1080
 * shorts.voice.fallback=default_voice_id
 * shorts.roster.1.key=me
 * shorts.roster.1.name=Me
 * shorts.roster.1.voice-id=
 * </pre>
 *
 * Values come from {@code shorts-engine.properties} on the classpath; any
 * {@code -Dshorts.*} system property replaces the key it names.
 */
public class ShortsProperties {

    private static final Logger log = LoggerFactory.getLogger(ShortsProperties.class);

    public static final String RESOURCE = "shorts-engine.properties";

    private static final String PREFIX = "shorts.";

    private static final JavaPropsMapper MAPPER = JavaPropsMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /** Re-attempts per generation stage after the first run. */
    private int maxRetries = 2;
    private double qualityThreshold = 0.7;
    private double captionToleranceSec = 1.0;
    private int speechConcurrency = 2;
    private int imageConcurrency = 3;
    private int sceneWorkers = 4;
    private String outputDir = "output";
    private String assetsDir = "assets";
    private String databaseUrl = "jdbc:sqlite:shorts-engine.db";
    private String channelIntroText = "";

    private VideoConfig video = new VideoConfig();
    private VoiceConfig voice = new VoiceConfig();
    private DemoConfig demo = new DemoConfig();
    private List<MemberConfig> roster = new ArrayList<>();

    // ------------------------------------------------------------------ //

    public static class VideoConfig {
        private int width = 1080;
        private int height = 1920;
        private int fps = 30;
        private double minDurationSec = 30.0;
        private double maxDurationSec = 200.0;

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }

        public int getHeight() {
            return height;
        }

        public void setHeight(int height) {
            this.height = height;
        }

        public int getFps() {
            return fps;
        }

        public void setFps(int fps) {
            this.fps = fps;
        }

        public double getMinDurationSec() {
            return minDurationSec;
        }

        public void setMinDurationSec(double minDurationSec) {
            this.minDurationSec = minDurationSec;
        }

        public double getMaxDurationSec() {
            return maxDurationSec;
        }

        public void setMaxDurationSec(double maxDurationSec) {
            this.maxDurationSec = maxDurationSec;
        }
    }

    public static class VoiceConfig {
        private String fallback = "default_voice_id";

        public String getFallback() {
            return fallback;
        }

        public void setFallback(String fallback) {
            this.fallback = fallback;
        }
    }

    /** Settings of the demo CLI only. */
    public static class DemoConfig {
        private double failureRate = 0.0;

        public double getFailureRate() {
            return failureRate;
        }

        public void setFailureRate(double failureRate) {
            this.failureRate = failureRate;
        }
    }

    public static class MemberConfig {
        private String key;
        private String name;
        private String description = "";
        private String voiceId = "";

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getVoiceId() {
            return voiceId;
        }

        public void setVoiceId(String voiceId) {
            this.voiceId = voiceId;
        }
    }

    // Root of the properties tree; everything the engine reads sits under "shorts".
    static class Document {
        private ShortsProperties shorts = new ShortsProperties();

        public ShortsProperties getShorts() {
            return shorts;
        }

        public void setShorts(ShortsProperties shorts) {
            this.shorts = shorts;
        }
    }

    // ------------------------------------------------------------------ //

    public static ShortsProperties load() {
        Map<String, String> values = new LinkedHashMap<>();
        try (InputStream in = ShortsProperties.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    values.putAll(MAPPER.writeValueAsMap(MAPPER.readTree(reader)));
                }
            } else {
                log.warn("{} not found on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                values.put(name, System.getProperty(name));
            }
        }
        return fromMap(values);
    }

    /**
     * Binds flat {@code shorts.*} keys; keys outside the prefix are ignored.
     */
    public static ShortsProperties fromMap(Map<String, String> values) {
        if (values.isEmpty()) {
            return new ShortsProperties();
        }
        try {
            Document document = MAPPER.readMapAs(values, Document.class);
            return document == null || document.getShorts() == null ? new ShortsProperties() : document.getShorts();
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to bind shorts properties", e);
        }
    }

    public SpeakerRoster toRoster() {
        List<SpeakerRoster.Member> members = new ArrayList<>();
        for (MemberConfig member : roster) {
            members.add(new SpeakerRoster.Member(
                    member.getKey(),
                    member.getName() == null ? member.getKey() : member.getName(),
                    member.getDescription(),
                    member.getVoiceId()));
        }
        return new SpeakerRoster(members, voice.getFallback());
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public void setQualityThreshold(double qualityThreshold) {
        this.qualityThreshold = qualityThreshold;
    }

    public double getCaptionToleranceSec() {
        return captionToleranceSec;
    }

    public void setCaptionToleranceSec(double captionToleranceSec) {
        this.captionToleranceSec = captionToleranceSec;
    }

    public int getSpeechConcurrency() {
        return speechConcurrency;
    }

    public void setSpeechConcurrency(int speechConcurrency) {
        this.speechConcurrency = speechConcurrency;
    }

    public int getImageConcurrency() {
        return imageConcurrency;
    }

    public void setImageConcurrency(int imageConcurrency) {
        this.imageConcurrency = imageConcurrency;
    }

    public int getSceneWorkers() {
        return sceneWorkers;
    }

    public void setSceneWorkers(int sceneWorkers) {
        this.sceneWorkers = sceneWorkers;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getAssetsDir() {
        return assetsDir;
    }

    public void setAssetsDir(String assetsDir) {
        this.assetsDir = assetsDir;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public String getChannelIntroText() {
        return channelIntroText;
    }

    public void setChannelIntroText(String channelIntroText) {
        this.channelIntroText = channelIntroText;
    }

    public VideoConfig getVideo() {
        return video;
    }

    public void setVideo(VideoConfig video) {
        this.video = video;
    }

    public VoiceConfig getVoice() {
        return voice;
    }

    public void setVoice(VoiceConfig voice) {
        this.voice = voice;
    }

    public DemoConfig getDemo() {
        return demo;
    }

    public void setDemo(DemoConfig demo) {
        this.demo = demo;
    }

    public List<MemberConfig> getRoster() {
        return roster;
    }

    public void setRoster(List<MemberConfig> roster) {
        this.roster = roster;
    }
}
