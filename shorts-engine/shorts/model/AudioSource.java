package shorts.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AudioSource {

    @JsonProperty("tts")
    TTS,

    @JsonProperty("manual")
    MANUAL;

    public String tag() {
        return name().toLowerCase();
    }

    public static AudioSource fromTag(String tag) {
        for (AudioSource source : values()) {
            if (source.tag().equals(tag)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown audio source: " + tag);
    }
}
