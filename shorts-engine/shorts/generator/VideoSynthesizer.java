package shorts.generator;

import java.nio.file.Path;

public interface VideoSynthesizer {

    Path synthesize(String prompt, double durationSec, Path output);
}
