package com.issuesla.gold.model;

public record SlaDistributionRow(boolean slaMet, long issueCount, double percentage) {}
