package shorts.generator;

import java.util.List;

public interface TrendSource {

    /**
     * Short identifier recorded as the source of each item, e.g. {@code news}.
     */
    String name();

    List<TrendItem> fetchTrending();
}
