package org.nowstart.tseval.service;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.nowstart.tseval.data.dto.TrialKey;
import org.nowstart.tseval.data.type.TrialState;

@Getter
public class Trial {

    private final TrialKey key;
    private TrialState state = TrialState.PENDING;
    private final List<TrialState> history = new ArrayList<>(List.of(TrialState.PENDING));

    public Trial(TrialKey key) {
        this.key = key;
    }

    public void moveTo(TrialState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal trial transition " + state + " -> " + next + " for trial=" + key);
        }
        state = next;
        history.add(next);
    }

    public List<TrialState> getHistory() {
        return List.copyOf(history);
    }
}
