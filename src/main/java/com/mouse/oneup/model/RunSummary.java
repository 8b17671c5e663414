package com.mouse.oneup.model;

public record RunSummary(int priced, int insufficientData, int skipped, int failed) {

    public int total() {
        return priced + insufficientData + skipped + failed;
    }
}
