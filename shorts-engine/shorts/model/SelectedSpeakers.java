package shorts.model;

import java.util.ArrayList;
import java.util.List;

public class SelectedSpeakers {

    private String host;
    private List<String> participants = new ArrayList<>();

    public SelectedSpeakers() {
    }

    public SelectedSpeakers(String host, List<String> participants) {
        this.host = host;
        this.participants = new ArrayList<>(participants);
    }

    /**
     * Speaker tag used in scenes for the n-th participant (1-based).
     */
    public static String participantRole(int n) {
        return "participant_" + n;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public List<String> getParticipants() {
        return participants;
    }

    public void setParticipants(List<String> participants) {
        this.participants = participants;
    }
}
