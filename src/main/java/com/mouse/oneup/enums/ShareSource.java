package com.mouse.oneup.enums;

public enum ShareSource {
    PROPORTIONAL,   // team totals rescaled to the match total
    SUPREMACY_FIT,  // split fitted to the 1X2 market
    FIRST_SCORER    // conditional share from the first-team-to-score market
}
