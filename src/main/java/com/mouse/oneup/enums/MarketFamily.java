package com.mouse.oneup.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Getter
@RequiredArgsConstructor
public enum MarketFamily {
    MATCH_RESULT("1X2", 3, false, true),            // home, draw, away
    TOTAL_GOALS("Over/Under", 2, true, true),       // over, under
    HOME_GOALS("Home O/U", 2, true, true),
    AWAY_GOALS("Away O/U", 2, true, true),
    FIRST_TEAM_TO_SCORE("1st Goal", 3, false, false), // home, no goal, away
    BOTH_TEAMS_TO_SCORE("GG/NG", 2, false, false);  // yes, no

    private final String marketName;
    private final int outcomeCount;
    private final boolean lined;
    private final boolean mandatory;

    public static List<MarketFamily> mandatoryFamilies() {
        return Arrays.stream(values())
                .filter(MarketFamily::isMandatory)
                .collect(Collectors.toList());
    }
}
