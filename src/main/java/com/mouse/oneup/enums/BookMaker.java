package com.mouse.oneup.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Bookmakers whose markets are priced. The code is the source identity tag that
 * travels with every pricing request.
 */
@Getter
@RequiredArgsConstructor
public enum BookMaker {
    SPORTY_BET("sporty", "SportyBet"),

    BET9JA("bet9ja", "Bet9ja"),

    BET_PAWA("pawa", "BetPawa");

    private final String code;
    private final String displayName;

    /**
     * Get BookMaker from its source code (case-insensitive)
     * @param code the source identity tag
     * @return Optional containing the BookMaker if found
     */
    public static Optional<BookMaker> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }

        return Arrays.stream(BookMaker.values())
                .filter(bookMaker -> bookMaker.getCode().equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
