package com.jay.mfses.model;

/** How one factor score was reached: the raw input, the matched bracket and the score. */
public record FactorAudit(String input, String bracket, int score) {}
