package shorts.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import shorts.model.Scene;
import shorts.model.SelectedSpeakers;

/**
 * People who can appear in a short, keyed by a stable member key, each with the
 * external voice id used for speech synthesis.
 */
public class SpeakerRoster {

    public static class Member {

        private final String key;
        private final String name;
        private final String description;
        private final String voiceId;

        public Member(String key, String name, String description, String voiceId) {
            this.key = key;
            this.name = name;
            this.description = description;
            this.voiceId = voiceId;
        }

        public String getKey() {
            return key;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        public String getVoiceId() {
            return voiceId;
        }

        public String getPhotoUrl() {
            return "/files/assets/pic/" + key + ".jpeg";
        }
    }

    private final Map<String, Member> members;
    private final String fallbackVoiceId;

    public SpeakerRoster(Collection<Member> members, String fallbackVoiceId) {
        Map<String, Member> byKey = new LinkedHashMap<>();
        for (Member member : members) {
            byKey.put(member.getKey(), member);
        }
        this.members = Collections.unmodifiableMap(byKey);
        this.fallbackVoiceId = fallbackVoiceId;
    }

    public List<Member> members() {
        return new ArrayList<>(members.values());
    }

    public Optional<Member> find(String key) {
        return Optional.ofNullable(members.get(key));
    }

    public boolean contains(String key) {
        return members.containsKey(key);
    }

    public String getFallbackVoiceId() {
        return fallbackVoiceId;
    }

    /**
     * Maps scene speaker tags (host, participant_1..N) to voice ids. Members
     * without a configured voice get the fallback voice.
     */
    public Map<String, String> resolveVoices(SelectedSpeakers speakers) {
        Map<String, String> voices = new LinkedHashMap<>();
        voices.put(Scene.HOST, voiceOf(speakers.getHost()));

        List<String> participants = speakers.getParticipants();
        for (int i = 0; i < participants.size(); i++) {
            voices.put(SelectedSpeakers.participantRole(i + 1), voiceOf(participants.get(i)));
        }
        return voices;
    }

    private String voiceOf(String memberKey) {
        return find(memberKey)
                .map(Member::getVoiceId)
                .filter(id -> id != null && !id.isBlank())
                .orElse(fallbackVoiceId);
    }
}
