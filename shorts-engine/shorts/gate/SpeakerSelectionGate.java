package shorts.gate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import shorts.config.SpeakerRoster;
import shorts.graph.StateUpdate;
import shorts.model.PipelineState;
import shorts.model.SelectedSpeakers;

/**
 * Lets the user cast the short: one host and any number of participants from
 * the roster. The role to voice mapping is resolved here, once, so later stages
 * never consult the roster for voices.
 */
public class SpeakerSelectionGate extends HumanGate {

    private static final Logger log = LoggerFactory.getLogger(SpeakerSelectionGate.class);

    private final SpeakerRoster roster;

    public SpeakerSelectionGate(SpeakerRoster roster) {
        super(GateType.SPEAKER_SELECTION);
        this.roster = roster;
    }

    @Override
    protected Map<String, Object> publish(PipelineState state) {
        log.info("Run {} waiting for speaker selection", state.getRunId());

        List<Map<String, Object>> members = new ArrayList<>();
        for (SpeakerRoster.Member member : roster.members()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("key", member.getKey());
            entry.put("name", member.getName());
            entry.put("description", member.getDescription());
            entry.put("photo_url", member.getPhotoUrl());
            members.add(entry);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("members", members);
        payload.put("message", "Choose the speakers: one host and any participants.");
        return payload;
    }

    @Override
    public GateDecision decide(PipelineState state, Map<String, Object> payload) {
        String host = requireString(state, payload, "host");
        if (!roster.contains(host)) {
            throw new ResumeRejectedException(state.getRunId(), "unknown host '" + host + "'");
        }
        List<String> participants = optionalStringList(state, payload, "participants");
        for (String participant : participants) {
            if (!roster.contains(participant)) {
                throw new ResumeRejectedException(state.getRunId(), "unknown participant '" + participant + "'");
            }
        }

        SelectedSpeakers speakers = new SelectedSpeakers(host, participants);
        Map<String, String> voices = roster.resolveVoices(speakers);
        log.info("Run {} speakers selected: host={} participants={}", state.getRunId(), host, participants);

        StateUpdate update = StateUpdate.of(s -> {
            s.setSelectedSpeakers(speakers);
            s.setVoiceIds(new LinkedHashMap<>(voices));
            s.setSpeakerSelectionApproved(true);
        });
        return new GateDecision(type(), update, "host=" + host + " participants=" + participants);
    }
}
