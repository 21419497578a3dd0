package shorts.generator;

/**
 * One raw result from a trend source. Keyword-only sources leave url and
 * content empty.
 */
public class TrendItem {

    private String title;
    private String url = "";
    private String content = "";
    private String source;

    public TrendItem() {
    }

    public TrendItem(String title, String url, String content, String source) {
        this.title = title;
        this.url = url;
        this.content = content;
        this.source = source;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }
}
