package com.talentledger.projection;

import java.util.List;

public record AggregateDeltas(List<ProfileDelta> profiles, PlatformDelta platform) {

    public AggregateDeltas {
        profiles = List.copyOf(profiles);
        platform = platform == null ? PlatformDelta.NONE : platform;
    }
}
