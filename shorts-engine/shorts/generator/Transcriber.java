package shorts.generator;

import java.nio.file.Path;
import java.util.List;

import shorts.timeline.Caption;

/**
 * Speech to text with timestamps. Offsets are relative to the start of the file.
 */
public interface Transcriber {

    List<Caption> transcribe(Path audio);
}
