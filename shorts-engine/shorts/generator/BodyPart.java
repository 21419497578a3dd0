package shorts.generator;

public class BodyPart {

    private String text;
    private String keyPoint;
    private String emotion;

    public BodyPart() {
    }

    public BodyPart(String text, String keyPoint, String emotion) {
        this.text = text;
        this.keyPoint = keyPoint;
        this.emotion = emotion;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getKeyPoint() {
        return keyPoint;
    }

    public void setKeyPoint(String keyPoint) {
        this.keyPoint = keyPoint;
    }

    public String getEmotion() {
        return emotion;
    }

    public void setEmotion(String emotion) {
        this.emotion = emotion;
    }
}
