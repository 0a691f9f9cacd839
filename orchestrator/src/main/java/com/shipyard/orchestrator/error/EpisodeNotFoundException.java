package com.shipyard.orchestrator.error;

import com.shipyard.orchestrator.model.EpisodeKey;

public class EpisodeNotFoundException extends OrchestrationException {

    public EpisodeNotFoundException(EpisodeKey key) {
        super("No unresolved failure episode for " + key);
    }

    @Override
    public String code() { return "episode_not_found"; }
}
