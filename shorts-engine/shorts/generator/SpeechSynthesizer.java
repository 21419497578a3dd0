package shorts.generator;

import java.nio.file.Path;

public interface SpeechSynthesizer {

    /**
     * Writes narration for {@code text} to {@code output} and returns the written file.
     */
    Path synthesize(String text, String voiceId, String emotion, Path output);
}
