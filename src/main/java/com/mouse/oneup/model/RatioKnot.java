package com.mouse.oneup.model;

public record RatioKnot(double ratio, double multiplier) {
}
