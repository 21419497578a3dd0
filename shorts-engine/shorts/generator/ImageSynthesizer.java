package shorts.generator;

import java.nio.file.Path;

public interface ImageSynthesizer {

    /**
     * @param sceneType one of {@code hook}, {@code body}, {@code cta} or {@code default};
     *                  lets the generator pick framing and style
     */
    Path synthesize(String prompt, String sceneType, Path output);
}
