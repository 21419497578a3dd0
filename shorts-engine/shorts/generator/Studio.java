package shorts.generator;

import java.util.List;

/**
 * The full set of external collaborators a workflow needs.
 */
public interface Studio {

    TextGenerator text();

    List<TrendSource> trendSources();

    SpeechSynthesizer speech();

    ImageSynthesizer images();

    VideoSynthesizer video();

    Transcriber transcriber();

    MediaToolkit media();

    /**
     * {@code null} when finished shorts are kept local only.
     */
    ArtifactPublisher publisher();
}
